/**
 * Stores a chosen image and points an entity's record at it
 *
 * Features:
 * - Downloads a discovered candidate by URL, or decodes an inline data URI
 * - Optionally watermarks inline uploads, falling back to the original on failure
 * - Uploads publicly readable objects under keys derived from the entity id
 * - Updates the metadata record last; a failure there is reported as an orphaned object
 * - Re-runs only the record update for a previously orphaned object
 */
package com.williamcallahan.trivia_image_curator.service.ingest;

import com.williamcallahan.trivia_image_curator.config.CurationProperties;
import com.williamcallahan.trivia_image_curator.monitoring.CurationMetrics;
import com.williamcallahan.trivia_image_curator.repository.ArtifactRecordStore;
import com.williamcallahan.trivia_image_curator.service.S3StorageService;
import com.williamcallahan.trivia_image_curator.service.image.WatermarkService;
import com.williamcallahan.trivia_image_curator.types.ArtifactRecord;
import com.williamcallahan.trivia_image_curator.types.IngestOptions;
import com.williamcallahan.trivia_image_curator.types.IngestionMode;
import com.williamcallahan.trivia_image_curator.types.InlinePayload;
import com.williamcallahan.trivia_image_curator.util.ArtifactPaths;
import com.williamcallahan.trivia_image_curator.util.ExternalApiLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

@Service
public class ImageIngestionService {

    private static final Logger logger = LoggerFactory.getLogger(ImageIngestionService.class);
    static final String DEFAULT_CONTENT_TYPE = "image/jpeg";

    private final WebClient webClient;
    private final S3StorageService s3StorageService;
    private final ArtifactRecordStore artifactRecordStore;
    private final InlinePayloadDecoder payloadDecoder;
    private final WatermarkService watermarkService;
    private final CurationMetrics metrics;
    private final Clock clock;
    private final String prefix;
    private final Duration downloadTimeout;
    private final boolean createMissingRecords;

    @Autowired
    public ImageIngestionService(WebClient.Builder webClientBuilder,
                                 @Autowired(required = false) S3StorageService s3StorageService,
                                 ArtifactRecordStore artifactRecordStore,
                                 InlinePayloadDecoder payloadDecoder,
                                 WatermarkService watermarkService,
                                 CurationProperties curationProperties,
                                 CurationMetrics metrics) {
        this(webClientBuilder, s3StorageService, artifactRecordStore, payloadDecoder, watermarkService,
            curationProperties, metrics, Clock.systemUTC());
    }

    ImageIngestionService(WebClient.Builder webClientBuilder,
                          S3StorageService s3StorageService,
                          ArtifactRecordStore artifactRecordStore,
                          InlinePayloadDecoder payloadDecoder,
                          WatermarkService watermarkService,
                          CurationProperties curationProperties,
                          CurationMetrics metrics,
                          Clock clock) {
        this.webClient = webClientBuilder.build();
        this.s3StorageService = s3StorageService;
        this.artifactRecordStore = artifactRecordStore;
        this.payloadDecoder = payloadDecoder;
        this.watermarkService = watermarkService;
        this.metrics = metrics;
        this.clock = clock;
        this.prefix = curationProperties.getStorage().getPrefix();
        this.downloadTimeout = curationProperties.getStorage().getDownloadTimeout();
        this.createMissingRecords = curationProperties.getMetadata().isCreateMissingRecords();
        if (s3StorageService == null) {
            logger.warn("S3StorageService is not available; every ingest will fail at the upload stage.");
        }
    }

    /**
     * Download a discovered image and store it as {@code <prefix>/<entityId>.<ext>}.
     *
     * @param sourceUrl full-resolution URL of the chosen candidate
     * @param entityId record the image belongs to
     * @return the public URL now stored on the record
     */
    public Mono<String> ingestFromUrl(String sourceUrl, String entityId) {
        return Mono.defer(() -> {
            requireEntityId(entityId);
            String extension = ArtifactPaths.extensionFromUrl(sourceUrl);
            String key = ArtifactPaths.urlObjectKey(prefix, entityId, extension);
            logger.info("Ingesting image for entity {} from {} as {}", entityId, sourceUrl, key);

            return download(sourceUrl)
                .flatMap(downloaded -> upload(key, downloaded.bytes(), downloaded.contentType())
                    .flatMap(publicUrl -> persist(new ArtifactRecord(entityId, publicUrl, key, downloaded.contentType()))));
        }).transform(result -> recordOutcome(result, IngestionMode.URL));
    }

    /**
     * Decode a {@code data:<mime>;base64,<data>} payload and store it as
     * {@code <prefix>/<entityId>_upload_<epochMillis>.<ext>}. A malformed payload fails
     * with {@link PayloadFormatException} before any network or storage call.
     *
     * @param options whether to watermark; callers must decide explicitly
     */
    public Mono<String> ingestFromInlinePayload(String entityId, String encodedPayload, IngestOptions options) {
        return Mono.defer(() -> {
            requireEntityId(entityId);
            Objects.requireNonNull(options, "options");
            InlinePayload payload = payloadDecoder.decode(encodedPayload);
            String key = ArtifactPaths.inlineObjectKey(prefix, entityId, clock.millis(), payload.extension());
            logger.info("Ingesting inline {} payload ({} bytes) for entity {} as {}, watermark={}",
                payload.mimeType(), payload.bytes().length, entityId, key, options.addWatermark());

            Mono<byte[]> bytes = options.addWatermark()
                ? watermarkOrOriginal(payload, entityId)
                : Mono.just(payload.bytes());

            return bytes
                .flatMap(content -> upload(key, content, payload.mimeType()))
                .flatMap(publicUrl -> persist(new ArtifactRecord(entityId, publicUrl, key, payload.mimeType())));
        }).transform(result -> recordOutcome(result, IngestionMode.INLINE));
    }

    /**
     * Retry only the record update for an object whose first update failed.
     */
    public Mono<String> reattach(OrphanedObjectException orphan) {
        return reattach(orphan.getEntityId(), orphan.getStoragePath(), orphan.getPublicUrl(), orphan.getContentType());
    }

    /**
     * Point a record at an already-uploaded object. Never uploads.
     */
    public Mono<String> reattach(String entityId, String storagePath, String publicUrl, String contentType) {
        return Mono.defer(() -> {
            requireEntityId(entityId);
            if (publicUrl == null || publicUrl.isBlank()) {
                return Mono.error(new IllegalArgumentException("publicUrl is required"));
            }
            logger.info("Reattaching {} to entity {}", publicUrl, entityId);
            return persist(new ArtifactRecord(entityId, publicUrl, storagePath, contentType));
        }).transform(result -> recordOutcome(result, IngestionMode.REATTACH));
    }

    private Mono<Downloaded> download(String sourceUrl) {
        URI uri;
        try {
            uri = URI.create(sourceUrl);
        } catch (IllegalArgumentException | NullPointerException e) {
            return Mono.error(new IngestTransportException(sourceUrl, null, "Invalid source URL: " + sourceUrl, e));
        }
        ExternalApiLogger.logHttpRequest(logger, "GET", sourceUrl);

        return webClient.get()
            .uri(uri)
            .retrieve()
            .toEntity(byte[].class)
            .timeout(downloadTimeout)
            .flatMap(entity -> toDownloaded(sourceUrl, entity))
            .switchIfEmpty(Mono.error(() -> new IngestTransportException(sourceUrl, null,
                "Download returned no response: " + sourceUrl, null)))
            .onErrorMap(e -> !(e instanceof IngestTransportException), e -> {
                Integer status = e instanceof WebClientResponseException wcre ? wcre.getStatusCode().value() : null;
                String message = status != null
                    ? "Failed to download image. Status: " + status
                    : "Failed to download image: " + e.getMessage();
                return new IngestTransportException(sourceUrl, status, message, e);
            })
            .doOnError(e -> logger.error("Download of {} failed: {}", sourceUrl, e.getMessage()));
    }

    private Mono<Downloaded> toDownloaded(String sourceUrl, ResponseEntity<byte[]> entity) {
        byte[] body = entity.getBody();
        if (body == null || body.length == 0) {
            return Mono.error(new IngestTransportException(sourceUrl, entity.getStatusCode().value(),
                "Download returned an empty body", null));
        }
        MediaType mediaType = entity.getHeaders().getContentType();
        String contentType = mediaType != null
            ? mediaType.getType() + "/" + mediaType.getSubtype()
            : DEFAULT_CONTENT_TYPE;
        ExternalApiLogger.logHttpResponse(logger, entity.getStatusCode().value(), sourceUrl, body.length);
        return Mono.just(new Downloaded(body, contentType));
    }

    private Mono<byte[]> watermarkOrOriginal(InlinePayload payload, String entityId) {
        return watermarkService.applyWatermarkAsync(payload.bytes(), payload.mimeType(), entityId)
            .map(processed -> {
                if (processed.isProcessingSuccessful() && processed.getProcessedBytes() != null) {
                    return processed.getProcessedBytes();
                }
                logger.warn("Entity {}: Could not apply watermark ({}). Proceeding without watermark.",
                    entityId, processed.getProcessingError());
                metrics.incrementWatermarkFallback();
                return payload.bytes();
            })
            .onErrorResume(e -> {
                logger.warn("Entity {}: Watermarking failed ({}). Proceeding without watermark.", entityId, e.getMessage());
                metrics.incrementWatermarkFallback();
                return Mono.just(payload.bytes());
            });
    }

    private Mono<String> upload(String key, byte[] bytes, String contentType) {
        if (s3StorageService == null) {
            return Mono.error(new StorageWriteException(key, "Object storage is not configured", null));
        }
        return Mono.fromFuture(() -> s3StorageService.uploadFileAsync(key, bytes, contentType))
            .onErrorMap(e -> new StorageWriteException(key, "Failed to upload " + key + ": " + e.getMessage(), e));
    }

    private Mono<String> persist(ArtifactRecord record) {
        return Mono.fromCallable(() -> {
                if (createMissingRecords) {
                    artifactRecordStore.upsertImage(record);
                } else if (!artifactRecordStore.updateImage(record)) {
                    throw orphaned(record, "No metadata record exists for entity " + record.entityId(), null);
                }
                logger.info("Metadata record for entity {} now points at {}", record.entityId(), record.publicUrl());
                return record.publicUrl();
            })
            .subscribeOn(Schedulers.boundedElastic())
            .onErrorMap(e -> !(e instanceof OrphanedObjectException),
                e -> orphaned(record, "Failed to update metadata record: " + e.getMessage(), e))
            .doOnError(e -> logger.error("Object {} for entity {} is stored but unreferenced: {}",
                record.storagePath(), record.entityId(), e.getMessage()));
    }

    private static OrphanedObjectException orphaned(ArtifactRecord record, String message, Throwable cause) {
        return new OrphanedObjectException(record.entityId(), record.storagePath(), record.publicUrl(),
            record.contentType(), message, cause);
    }

    private Mono<String> recordOutcome(Mono<String> result, IngestionMode mode) {
        return result
            .doOnSuccess(publicUrl -> metrics.incrementIngestSuccess(mode))
            .doOnError(ImageIngestionException.class, e -> metrics.incrementIngestFailure(mode, e.getStage()));
    }

    private static void requireEntityId(String entityId) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId is required");
        }
    }

    private record Downloaded(byte[] bytes, String contentType) {
    }
}
