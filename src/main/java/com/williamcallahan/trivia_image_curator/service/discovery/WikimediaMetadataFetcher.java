/**
 * Resolves a Commons search hit into an image candidate
 *
 * Features:
 * - Reads the URL triple and extended metadata from the imageinfo API
 * - Applies LicensePolicy before a candidate is produced
 * - Reports every failure as a CandidateResolution outcome instead of an error
 */
package com.williamcallahan.trivia_image_curator.service.discovery;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.trivia_image_curator.config.CurationProperties;
import com.williamcallahan.trivia_image_curator.types.CandidateResolution;
import com.williamcallahan.trivia_image_curator.types.ImageCandidate;
import com.williamcallahan.trivia_image_curator.types.SearchHit;
import com.williamcallahan.trivia_image_curator.util.ExternalApiLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Iterator;

@Service
@Slf4j
public class WikimediaMetadataFetcher {

    static final String UNKNOWN_LICENSE = "Unknown";

    private final WebClient webClient;
    private final String apiUrl;
    private final int thumbnailWidth;
    private final Duration timeout;

    public WikimediaMetadataFetcher(WebClient.Builder webClientBuilder, CurationProperties properties) {
        this.webClient = webClientBuilder.build();
        this.apiUrl = properties.getWikimedia().getApiUrl();
        this.thumbnailWidth = properties.getWikimedia().getThumbnailWidth();
        this.timeout = properties.getWikimedia().getTimeout();
    }

    /**
     * Fetch image info for one hit.
     *
     * @param hit the search hit to resolve
     * @return the resolution outcome; the Mono always completes with a value
     */
    public Mono<CandidateResolution> resolve(SearchHit hit) {
        String title = hit.title();
        URI uri = UriComponentsBuilder.fromUriString(apiUrl)
            .queryParam("action", "query")
            .queryParam("titles", "{title}")
            .queryParam("prop", "imageinfo")
            .queryParam("iiprop", "url|extmetadata")
            .queryParam("iiurlwidth", thumbnailWidth)
            .queryParam("format", "json")
            .encode()
            .buildAndExpand(title)
            .toUri();

        ExternalApiLogger.logHttpRequest(log, "GET", uri.toString());

        return webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(timeout)
            .map(body -> toResolution(title, body))
            .defaultIfEmpty(CandidateResolution.notFound(title, "empty response body"))
            .onErrorResume(e -> {
                String reason = e instanceof WebClientResponseException wcre
                    ? "HTTP " + wcre.getStatusCode().value()
                    : e.getClass().getSimpleName() + ": " + e.getMessage();
                ExternalApiLogger.logApiCallFailure(log, "WikimediaCommons", "IMAGEINFO", title, reason);
                return Mono.just(CandidateResolution.transportError(title, reason));
            });
    }

    static CandidateResolution toResolution(String title, JsonNode body) {
        Iterator<JsonNode> pages = body.path("query").path("pages").elements();
        if (!pages.hasNext()) {
            return CandidateResolution.notFound(title, "no page in response");
        }
        JsonNode page = pages.next();
        JsonNode imageInfo = page.path("imageinfo").path(0);
        if (imageInfo.isMissingNode()) {
            return CandidateResolution.notFound(title, "no imageinfo");
        }
        JsonNode extMetadata = imageInfo.path("extmetadata");
        if (extMetadata.isMissingNode()) {
            return CandidateResolution.notFound(title, "no extmetadata");
        }

        String license = extMetadata.path("LicenseShortName").path("value").asText("");
        if (license.isEmpty()) {
            license = UNKNOWN_LICENSE;
        }
        if (!LicensePolicy.isPermissive(license)) {
            log.debug("Rejecting {} with license '{}'", title, license);
            return CandidateResolution.licenseRejected(title, license);
        }

        return CandidateResolution.resolved(new ImageCandidate(
            imageInfo.path("descriptionurl").asText(""),
            imageInfo.path("thumburl").asText(""),
            imageInfo.path("url").asText(""),
            license,
            page.path("title").asText(title)
        ));
    }
}
