/**
 * Service for trivia image storage operations in S3
 * - Uploads image bytes under caller-chosen keys, optionally public-read
 * - Generates public URLs, preferring a configured CDN
 * - Lists and deletes objects for orphan cleanup
 * - Records upload timing and errors through CurationMetrics
 */

package com.williamcallahan.trivia_image_curator.service;

import com.williamcallahan.trivia_image_curator.config.S3ConfigurationProperties;
import com.williamcallahan.trivia_image_curator.config.S3EnvironmentCondition;
import com.williamcallahan.trivia_image_curator.monitoring.CurationMetrics;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Conditional;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.ObjectCannedACL;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

@Service
@Conditional(S3EnvironmentCondition.class)
public class S3StorageService {
    private static final Logger logger = LoggerFactory.getLogger(S3StorageService.class);

    private static final int MAX_KEYS_PER_PAGE = 1000;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
    private final S3Client s3Client;
    private final String bucketName;
    private final String publicCdnUrl;
    private final String serverUrl;
    private final boolean publicRead;
    private final CurationMetrics metrics;

    /**
     * Constructs an S3StorageService
     *
     * @param s3Client AWS S3 client for interacting with the bucket
     * @param properties bucket name, CDN URL, server URL and ACL settings
     * @param metrics optional metrics sink for upload timing
     */
    public S3StorageService(S3Client s3Client,
                            S3ConfigurationProperties properties,
                            @Autowired(required = false) CurationMetrics metrics) {
        this.s3Client = s3Client;
        this.bucketName = properties.getBucketName();
        this.publicCdnUrl = properties.getCdnUrl();
        this.serverUrl = properties.getServerUrl();
        this.publicRead = properties.isPublicRead();
        this.metrics = metrics;
    }

    /**
     * Graceful shutdown of S3 service operations
     * Prevents new operations from starting during shutdown
     */
    @PreDestroy
    public void shutdown() {
        logger.info("Shutting down S3StorageService - disabling new operations");
        shuttingDown.set(true);
    }

    private boolean isS3ClientAvailable() {
        return s3Client != null && !shuttingDown.get();
    }

    /**
     * Asynchronously uploads image bytes to the bucket. Overwrites any object already at the key.
     *
     * @param keyName the object key, e.g. {@code trivia_images/q42.jpg}
     * @param bytes the content to store
     * @param contentType the MIME type recorded on the object
     * @return a CompletableFuture with the public URL of the uploaded object; fails with the
     *         underlying SDK exception when the upload is rejected
     */
    public CompletableFuture<String> uploadFileAsync(String keyName, byte[] bytes, String contentType) {
        if (!isS3ClientAvailable()) {
            logger.warn("S3Client is not available. Cannot upload file: {}. S3 may be disabled or shut down.", keyName);
            return CompletableFuture.failedFuture(new IllegalStateException("S3Client is not available or has been shut down."));
        }

        final Timer.Sample sample = metrics != null ? metrics.startS3Timer() : null;

        return Mono.fromCallable(() -> {
            try {
                PutObjectRequest.Builder requestBuilder = PutObjectRequest.builder()
                        .bucket(bucketName)
                        .key(keyName)
                        .contentType(contentType);
                if (publicRead) {
                    requestBuilder.acl(ObjectCannedACL.PUBLIC_READ);
                }

                s3Client.putObject(requestBuilder.build(), RequestBody.fromBytes(bytes));
                logger.info("Successfully uploaded {} ({} bytes, {}) to S3 bucket {}", keyName, bytes.length, contentType, bucketName);
                return buildPublicUrl(keyName);
            } finally {
                if (sample != null) {
                    metrics.stopS3Timer(sample);
                }
            }
        })
        .subscribeOn(Schedulers.boundedElastic())
        .doOnError(throwable -> {
            if (throwable instanceof S3Exception s3e && s3e.awsErrorDetails() != null) {
                logger.error("S3 error uploading {} (AWS S3 Error Code: {}): {}", keyName,
                    s3e.awsErrorDetails().errorCode(), s3e.awsErrorDetails().errorMessage());
            } else {
                logger.error("Error uploading {} to S3: {}", keyName, throwable.getMessage(), throwable);
            }
        })
        .toFuture();
    }

    /**
     * Public URL for a key: CDN if configured, else the S3-compatible server URL, else AWS virtual-host style.
     */
    public String buildPublicUrl(String keyName) {
        String key = keyName.startsWith("/") ? keyName.substring(1) : keyName;
        if (publicCdnUrl != null && !publicCdnUrl.isEmpty()) {
            String cdn = publicCdnUrl.endsWith("/") ? publicCdnUrl : publicCdnUrl + "/";
            return cdn + key;
        }
        if (serverUrl != null && !serverUrl.isEmpty()) {
            String server = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
            return server + "/" + bucketName + "/" + key;
        }
        return String.format("https://%s.s3.amazonaws.com/%s", bucketName, key);
    }

    /**
     * Gets the configured S3 bucket name.
     * @return The S3 bucket name.
     */
    public String getBucketName() {
        return bucketName;
    }

    /**
     * Lists objects in the bucket asynchronously, handling pagination.
     *
     * @param prefix The prefix to filter objects by (e.g., "trivia_images/"). Can be empty or null.
     * @param maxKeys stop after this many objects; zero or less lists everything under the prefix
     * @return A CompletableFuture with the object summaries; fails when listing fails, so a
     *         cleanup pass never mistakes an error for an empty bucket
     */
    public CompletableFuture<List<S3Object>> listObjectsAsync(String prefix, int maxKeys) {
        if (!isS3ClientAvailable()) {
            logger.warn("S3Client is not available. Cannot list objects. S3 may be disabled or shut down.");
            return CompletableFuture.failedFuture(new IllegalStateException("S3Client is not available or has been shut down."));
        }

        return Mono.<List<S3Object>>fromCallable(() -> {
            logger.info("Listing objects in bucket {} with prefix '{}' (max keys: {})", bucketName, prefix, maxKeys > 0 ? maxKeys : "unbounded");
            List<S3Object> allObjects = new ArrayList<>();
            String continuationToken = null;
            do {
                ListObjectsV2Request.Builder requestBuilder = ListObjectsV2Request.builder()
                        .bucket(bucketName)
                        .continuationToken(continuationToken);

                if (prefix != null && !prefix.isEmpty()) {
                    requestBuilder.prefix(prefix);
                }
                if (maxKeys > 0) {
                    requestBuilder.maxKeys(Math.min(maxKeys - allObjects.size(), MAX_KEYS_PER_PAGE));
                }

                ListObjectsV2Response response = s3Client.listObjectsV2(requestBuilder.build());
                allObjects.addAll(response.contents());
                continuationToken = response.nextContinuationToken();
                logger.debug("Fetched a page of {} S3 object(s). More pages to fetch: {}", response.contents().size(), continuationToken != null);
            } while (continuationToken != null && (maxKeys <= 0 || allObjects.size() < maxKeys));

            List<S3Object> listed = maxKeys > 0 && allObjects.size() > maxKeys ? allObjects.subList(0, maxKeys) : allObjects;
            logger.info("Finished listing S3 objects for prefix '{}'. Total objects found: {}", prefix, listed.size());
            return listed;
        })
        .subscribeOn(Schedulers.boundedElastic())
        .doOnError(e -> logger.error("Error listing objects in S3 bucket {}: {}", bucketName, e.getMessage(), e))
        .toFuture();
    }

    /**
     * Deletes an object from the bucket asynchronously
     *
     * @param key The key of the object to delete
     * @return A CompletableFuture<Boolean> indicating if the operation was successful
     */
    public CompletableFuture<Boolean> deleteObjectAsync(String key) {
        if (!isS3ClientAvailable()) {
            logger.warn("S3Client is not available. Cannot delete object {}. S3 may be disabled or shut down.", key);
            return CompletableFuture.completedFuture(false);
        }

        return Mono.<Boolean>fromCallable(() -> {
            logger.info("Attempting to delete object {} from bucket {}", key, bucketName);
            try {
                s3Client.deleteObject(DeleteObjectRequest.builder()
                        .bucket(bucketName)
                        .key(key)
                        .build());
                logger.info("Successfully deleted object {}", key);
                return true;
            } catch (S3Exception e) {
                logger.error("S3 error deleting object {}: {}", key, e.getMessage(), e);
                return false;
            }
        })
        .subscribeOn(Schedulers.boundedElastic())
        .onErrorResume(e -> {
            logger.error("Unexpected error deleting object {}: {}", key, e.getMessage(), e);
            return Mono.just(false);
        })
        .toFuture();
    }
}
