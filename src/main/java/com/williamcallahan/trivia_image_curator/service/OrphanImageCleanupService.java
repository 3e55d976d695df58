/**
 * Service for removing stored images that no metadata record references
 *
 * Features:
 * - Compares objects under the image prefix with storage paths held in the metadata store
 * - Leaves objects younger than the configured minimum age alone
 * - Supports dry run mode for safe evaluation
 * - Deletes orphans one by one; a failed delete is counted and the pass continues
 * - Aborts without deleting anything if the referenced paths cannot be read
 */

package com.williamcallahan.trivia_image_curator.service;

import com.williamcallahan.trivia_image_curator.config.CurationProperties;
import com.williamcallahan.trivia_image_curator.repository.ArtifactRecordStore;
import com.williamcallahan.trivia_image_curator.types.OrphanCleanupSummary;
import com.williamcallahan.trivia_image_curator.util.ArtifactPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

@Service
public class OrphanImageCleanupService {

    private static final Logger logger = LoggerFactory.getLogger(OrphanImageCleanupService.class);

    private final S3StorageService s3StorageService;
    private final ArtifactRecordStore artifactRecordStore;
    private final String defaultPrefix;
    private final Duration minAge;
    private final Clock clock;

    /**
     * Constructs the OrphanImageCleanupService with required dependencies
     *
     * @param s3StorageService service for S3 operations, absent when storage is not configured
     * @param artifactRecordStore source of the storage paths still in use
     * @param curationProperties supplies the default image prefix and minimum object age
     */
    @Autowired
    public OrphanImageCleanupService(@Autowired(required = false) S3StorageService s3StorageService,
                                     ArtifactRecordStore artifactRecordStore,
                                     CurationProperties curationProperties) {
        this(s3StorageService, artifactRecordStore, curationProperties, Clock.systemUTC());
    }

    OrphanImageCleanupService(S3StorageService s3StorageService,
                              ArtifactRecordStore artifactRecordStore,
                              CurationProperties curationProperties,
                              Clock clock) {
        this.s3StorageService = s3StorageService;
        this.artifactRecordStore = artifactRecordStore;
        this.defaultPrefix = ArtifactPaths.ensureTrailingSlash(curationProperties.getStorage().getPrefix());
        this.minAge = curationProperties.getCleanup().getMinAge();
        this.clock = clock;
    }

    /**
     * Lists orphaned objects without deleting them.
     *
     * @param prefix prefix to scan; null or blank means the configured image prefix
     * @param limit maximum number of objects to scan; zero or less means no limit
     */
    @Async
    public CompletableFuture<OrphanCleanupSummary> performDryRun(String prefix, int limit) {
        String scanPrefix = resolvePrefix(prefix);
        logger.info("Starting orphan image DRY RUN for prefix '{}', scan limit {}", scanPrefix, limit);
        if (!storageAvailable()) {
            return CompletableFuture.completedFuture(OrphanCleanupSummary.empty(true));
        }
        return findOrphans(scanPrefix, limit)
            .thenApply(scan -> {
                scan.orphanedKeys().forEach(key -> logger.info("[Dry Run] Orphan: {}", key));
                logger.info("Dry run complete for prefix '{}': scanned {}, orphaned {}",
                    scanPrefix, scan.scanned(), scan.orphanedKeys().size());
                return OrphanCleanupSummary.dryRun(scan.scanned(), scan.orphanedKeys());
            })
            .exceptionally(e -> {
                logger.error("Error during orphan dry run for prefix '{}': {}", scanPrefix, e.getMessage(), e);
                return OrphanCleanupSummary.empty(true);
            });
    }

    /**
     * Deletes orphaned objects.
     *
     * @param prefix prefix to scan; null or blank means the configured image prefix
     * @param limit maximum number of objects to scan; zero or less means no limit
     */
    @Async
    public CompletableFuture<OrphanCleanupSummary> deleteOrphans(String prefix, int limit) {
        String scanPrefix = resolvePrefix(prefix);
        logger.info("Starting orphan image DELETE for prefix '{}', scan limit {}", scanPrefix, limit);
        if (!storageAvailable()) {
            return CompletableFuture.completedFuture(OrphanCleanupSummary.empty(false));
        }
        return findOrphans(scanPrefix, limit)
            .thenCompose(scan -> {
                List<CompletableFuture<Boolean>> deletions = scan.orphanedKeys().stream()
                    .map(key -> s3StorageService.deleteObjectAsync(key)
                        .exceptionally(e -> {
                            logger.error("Error deleting orphan {}: {}", key, e.getMessage());
                            return false;
                        }))
                    .collect(Collectors.toList());

                return CompletableFuture.allOf(deletions.toArray(new CompletableFuture[0]))
                    .thenApply(v -> {
                        List<String> deletedKeys = new ArrayList<>();
                        List<String> failedKeys = new ArrayList<>();
                        for (int i = 0; i < deletions.size(); i++) {
                            String key = scan.orphanedKeys().get(i);
                            if (Boolean.TRUE.equals(deletions.get(i).join())) {
                                deletedKeys.add(key);
                            } else {
                                failedKeys.add(key);
                            }
                        }
                        logger.info("Successfully deleted {} orphan files. Failed to delete {} files.",
                            deletedKeys.size(), failedKeys.size());
                        return new OrphanCleanupSummary(false, scan.scanned(), scan.orphanedKeys().size(),
                            deletedKeys.size(), failedKeys.size(), scan.orphanedKeys(), deletedKeys, failedKeys);
                    });
            })
            .exceptionally(e -> {
                logger.error("Error during orphan delete for prefix '{}': {}", scanPrefix, e.getMessage(), e);
                return OrphanCleanupSummary.empty(false);
            });
    }

    private CompletableFuture<OrphanScan> findOrphans(String prefix, int limit) {
        return s3StorageService.listObjectsAsync(prefix, limit)
            .thenApply(objects -> {
                Set<String> referenced = artifactRecordStore.findReferencedStoragePaths();
                Instant cutoff = clock.instant().minus(minAge);
                logger.info("Found {} referenced storage paths; checking {} stored objects last modified before {}",
                    referenced.size(), objects.size(), cutoff);
                List<String> orphanedKeys = new ArrayList<>();
                int tooRecent = 0;
                for (S3Object object : objects) {
                    String key = object.key();
                    if (key.endsWith("/") || referenced.contains(key)) {
                        continue;
                    }
                    // no timestamp means its age is unknown, so it is kept
                    if (object.lastModified() == null || !object.lastModified().isBefore(cutoff)) {
                        tooRecent++;
                        continue;
                    }
                    orphanedKeys.add(key);
                }
                if (tooRecent > 0) {
                    logger.info("Skipped {} unreferenced object(s) newer than {}", tooRecent, minAge);
                }
                return new OrphanScan(objects.size(), orphanedKeys);
            });
    }

    private boolean storageAvailable() {
        if (s3StorageService == null) {
            logger.warn("S3StorageService is not available. Orphan cleanup is disabled.");
            return false;
        }
        String bucketName = s3StorageService.getBucketName();
        if (bucketName == null || bucketName.isEmpty()) {
            logger.error("S3 bucket name is not configured. Aborting orphan cleanup.");
            return false;
        }
        return true;
    }

    private String resolvePrefix(String prefix) {
        return (prefix == null || prefix.isBlank()) ? defaultPrefix : prefix;
    }

    private record OrphanScan(int scanned, List<String> orphanedKeys) {
    }
}
