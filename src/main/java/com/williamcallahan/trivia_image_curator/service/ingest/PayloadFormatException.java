package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.types.IngestionStage;

/**
 * Inline payload is not a {@code data:<type>/<subtype>;base64,<data>} string.
 * Raised before any network or storage call.
 */
public class PayloadFormatException extends ImageIngestionException {

    public PayloadFormatException(String message) {
        super(IngestionStage.DECODE, message);
    }

    public PayloadFormatException(String message, Throwable cause) {
        super(IngestionStage.DECODE, message, cause);
    }
}
