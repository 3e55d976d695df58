/**
 * REST Controller for image discovery and ingestion
 *
 * Features:
 * - Lists permissively licensed Commons candidates for a term or title/author pair
 * - Stores a chosen candidate by URL, or an inline data URI with explicit watermark choice
 * - Reattaches orphaned objects to their records
 * - Runs orphan cleanup as a dry run or a delete pass
 * - Maps each ingestion failure stage to its own HTTP status
 */

package com.williamcallahan.trivia_image_curator.controller;

import com.williamcallahan.trivia_image_curator.config.CurationProperties;
import com.williamcallahan.trivia_image_curator.controller.dto.IngestResponse;
import com.williamcallahan.trivia_image_curator.controller.dto.InlineUploadRequest;
import com.williamcallahan.trivia_image_curator.controller.dto.ReattachRequest;
import com.williamcallahan.trivia_image_curator.controller.dto.UrlIngestRequest;
import com.williamcallahan.trivia_image_curator.controller.support.ErrorResponseUtils;
import com.williamcallahan.trivia_image_curator.service.OrphanImageCleanupService;
import com.williamcallahan.trivia_image_curator.service.discovery.ImageDiscoveryService;
import com.williamcallahan.trivia_image_curator.service.ingest.ImageIngestionService;
import com.williamcallahan.trivia_image_curator.service.ingest.IngestTransportException;
import com.williamcallahan.trivia_image_curator.service.ingest.OrphanedObjectException;
import com.williamcallahan.trivia_image_curator.service.ingest.PayloadFormatException;
import com.williamcallahan.trivia_image_curator.service.ingest.StorageWriteException;
import com.williamcallahan.trivia_image_curator.types.ImageCandidate;
import com.williamcallahan.trivia_image_curator.types.IngestOptions;
import com.williamcallahan.trivia_image_curator.types.OrphanCleanupSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/admin/images")
public class ImageCurationController {

    private static final Logger logger = LoggerFactory.getLogger(ImageCurationController.class);

    private final ImageDiscoveryService imageDiscoveryService;
    private final ImageIngestionService imageIngestionService;
    private final OrphanImageCleanupService orphanImageCleanupService;
    private final int defaultBatchLimit;

    public ImageCurationController(ImageDiscoveryService imageDiscoveryService,
                                   ImageIngestionService imageIngestionService,
                                   OrphanImageCleanupService orphanImageCleanupService,
                                   CurationProperties curationProperties) {
        this.imageDiscoveryService = imageDiscoveryService;
        this.imageIngestionService = imageIngestionService;
        this.orphanImageCleanupService = orphanImageCleanupService;
        this.defaultBatchLimit = curationProperties.getCleanup().getDefaultBatchLimit();
    }

    /**
     * Candidate images for either a raw search term or a title with optional author.
     */
    @GetMapping(value = "/candidates", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<List<ImageCandidate>>> findCandidates(
            @RequestParam(name = "term", required = false) String term,
            @RequestParam(name = "title", required = false) String title,
            @RequestParam(name = "author", required = false) String author) {
        if ((term == null || term.isBlank()) && (title == null || title.isBlank())) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        Mono<List<ImageCandidate>> candidates = (term != null && !term.isBlank())
            ? imageDiscoveryService.findCandidatesForTerm(term)
            : imageDiscoveryService.findCandidates(title, author);
        return candidates.map(ResponseEntity::ok);
    }

    @PostMapping(value = "/{entityId}/from-url", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> ingestFromUrl(@PathVariable String entityId,
                                                      @RequestBody UrlIngestRequest request) {
        if (request == null || request.sourceUrl() == null || request.sourceUrl().isBlank()) {
            return Mono.just(badRequest("sourceUrl is required"));
        }
        return toResponse(imageIngestionService.ingestFromUrl(request.sourceUrl(), entityId), entityId);
    }

    @PostMapping(value = "/{entityId}/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> ingestInline(@PathVariable String entityId,
                                                     @RequestBody InlineUploadRequest request) {
        if (request == null || request.addWatermark() == null) {
            return Mono.just(badRequest("addWatermark is required"));
        }
        IngestOptions options = new IngestOptions(request.addWatermark());
        return toResponse(imageIngestionService.ingestFromInlinePayload(entityId, request.imageDataUri(), options), entityId);
    }

    @PostMapping(value = "/{entityId}/reattach", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Object>> reattach(@PathVariable String entityId,
                                                 @RequestBody ReattachRequest request) {
        if (request == null || request.publicUrl() == null || request.publicUrl().isBlank()) {
            return Mono.just(badRequest("publicUrl is required"));
        }
        return toResponse(imageIngestionService.reattach(entityId, request.storagePath(), request.publicUrl(),
            request.contentType()), entityId);
    }

    /**
     * Lists stored objects under the prefix that no record references.
     * A limit of zero or less scans everything.
     */
    @GetMapping(value = "/orphans/dry-run", produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<OrphanCleanupSummary>> orphanDryRun(
            @RequestParam(name = "prefix", required = false) String prefix,
            @RequestParam(name = "limit", required = false) Integer limit) {
        int limitToUse = limit != null ? limit : defaultBatchLimit;
        logger.info("Admin endpoint /admin/images/orphans/dry-run invoked. Prefix: '{}', limit: {}", prefix, limitToUse);
        return orphanImageCleanupService.performDryRun(prefix, limitToUse)
            .thenApply(summary -> {
                logger.info("Orphan dry run completed. Summary: {}", summary);
                return ResponseEntity.ok(summary);
            });
    }

    @PostMapping(value = "/orphans/delete", produces = MediaType.APPLICATION_JSON_VALUE)
    public CompletableFuture<ResponseEntity<OrphanCleanupSummary>> deleteOrphans(
            @RequestParam(name = "prefix", required = false) String prefix,
            @RequestParam(name = "limit", required = false) Integer limit) {
        int limitToUse = limit != null ? limit : defaultBatchLimit;
        logger.info("Admin endpoint /admin/images/orphans/delete invoked. Prefix: '{}', limit: {}", prefix, limitToUse);
        return orphanImageCleanupService.deleteOrphans(prefix, limitToUse)
            .thenApply(summary -> {
                logger.info("Orphan delete completed. Summary: {}", summary);
                return ResponseEntity.ok(summary);
            });
    }

    private Mono<ResponseEntity<Object>> toResponse(Mono<String> publicUrl, String entityId) {
        return publicUrl
            .map(url -> ResponseEntity.<Object>ok(new IngestResponse(url)))
            .onErrorResume(e -> Mono.just(errorResponse(e, entityId)));
    }

    static ResponseEntity<Object> errorResponse(Throwable e, String entityId) {
        if (e instanceof PayloadFormatException || e instanceof IllegalArgumentException) {
            return badRequest(e.getMessage());
        }
        if (e instanceof IngestTransportException) {
            logger.error("Ingest for entity {} failed downloading the source: {}", entityId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponseUtils.errorBody("Could not download source image", e.getMessage()));
        }
        if (e instanceof StorageWriteException) {
            logger.error("Ingest for entity {} failed writing to storage: {}", entityId, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponseUtils.errorBody("Could not store image", e.getMessage()));
        }
        if (e instanceof OrphanedObjectException orphan) {
            logger.error("Ingest for entity {} left orphaned object {}", entityId, orphan.getStoragePath());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponseUtils.orphanedObjectBody(orphan));
        }
        logger.error("Unexpected error ingesting image for entity {}: {}", entityId, e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponseUtils.errorBody("Unexpected error", e.getMessage()));
    }

    private static ResponseEntity<Object> badRequest(String message) {
        return ResponseEntity.badRequest().body(ErrorResponseUtils.errorBody("Invalid request", message));
    }
}
