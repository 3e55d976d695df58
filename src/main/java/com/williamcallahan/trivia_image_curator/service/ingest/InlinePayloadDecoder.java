package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.types.InlinePayload;
import com.williamcallahan.trivia_image_curator.util.ArtifactPaths;
import org.springframework.stereotype.Component;

import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses {@code data:<type>/<subtype>;base64,<data>} strings. Pure; no I/O.
 */
@Component
public class InlinePayloadDecoder {

    private static final Pattern HEADER = Pattern.compile("^data:([a-zA-Z0-9]+/[a-zA-Z0-9-.+]+);base64,");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * @throws PayloadFormatException if the header is missing or malformed, or the data is not valid base64
     */
    public InlinePayload decode(String encodedPayload) {
        if (encodedPayload == null || encodedPayload.isEmpty()) {
            throw new PayloadFormatException("Inline payload is empty");
        }
        Matcher matcher = HEADER.matcher(encodedPayload);
        if (!matcher.find()) {
            throw new PayloadFormatException("Invalid data URI format: expected data:<type>/<subtype>;base64,<data>");
        }
        String mimeType = matcher.group(1);
        String data = WHITESPACE.matcher(encodedPayload.substring(matcher.end())).replaceAll("");

        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(data);
        } catch (IllegalArgumentException e) {
            throw new PayloadFormatException("Inline payload is not valid base64: " + e.getMessage(), e);
        }
        if (bytes.length == 0) {
            throw new PayloadFormatException("Inline payload contains no data");
        }
        return new InlinePayload(mimeType, ArtifactPaths.extensionFromMimeType(mimeType), bytes);
    }
}
