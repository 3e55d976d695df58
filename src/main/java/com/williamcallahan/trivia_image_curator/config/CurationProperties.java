/**
 * Configuration properties for image discovery and ingestion
 *
 * Features:
 * - Wikimedia Commons endpoint, user agent, thumbnail width and call timeout
 * - Object key prefix and download limits for ingested images
 * - Watermark asset location
 * - Metadata-store write mode for entities without an existing record
 * - Default batch limit and minimum object age for orphan cleanup
 */

package com.williamcallahan.trivia_image_curator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "curation")
public class CurationProperties {

    private final Wikimedia wikimedia = new Wikimedia();
    private final Storage storage = new Storage();
    private final Watermark watermark = new Watermark();
    private final Metadata metadata = new Metadata();
    private final Cleanup cleanup = new Cleanup();

    public Wikimedia getWikimedia() { return wikimedia; }
    public Storage getStorage() { return storage; }
    public Watermark getWatermark() { return watermark; }
    public Metadata getMetadata() { return metadata; }
    public Cleanup getCleanup() { return cleanup; }

    public static class Wikimedia {
        private String apiUrl = "https://commons.wikimedia.org/w/api.php";
        // Commons rejects requests without a descriptive agent
        private String userAgent = "TriviaImageCurator/0.1 (https://github.com/williamcallahan)";
        private int thumbnailWidth = 300;
        private Duration timeout = Duration.ofSeconds(10);

        public String getApiUrl() { return apiUrl; }
        public void setApiUrl(String apiUrl) { this.apiUrl = apiUrl; }

        public String getUserAgent() { return userAgent; }
        public void setUserAgent(String userAgent) { this.userAgent = userAgent; }

        public int getThumbnailWidth() { return thumbnailWidth; }
        public void setThumbnailWidth(int thumbnailWidth) { this.thumbnailWidth = thumbnailWidth; }

        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class Storage {
        private String prefix = "trivia_images";
        private Duration downloadTimeout = Duration.ofSeconds(30);
        private DataSize maxDownloadSize = DataSize.ofMegabytes(32);

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public Duration getDownloadTimeout() { return downloadTimeout; }
        public void setDownloadTimeout(Duration downloadTimeout) { this.downloadTimeout = downloadTimeout; }

        public DataSize getMaxDownloadSize() { return maxDownloadSize; }
        public void setMaxDownloadSize(DataSize maxDownloadSize) { this.maxDownloadSize = maxDownloadSize; }
    }

    public static class Watermark {
        private String location = "classpath:watermark/watermark.png";

        public String getLocation() { return location; }
        public void setLocation(String location) { this.location = location; }
    }

    public static class Metadata {
        /**
         * When false, ingesting for an entity with no record is a metadata write failure.
         * When true, the record is created on first ingest.
         */
        private boolean createMissingRecords = false;

        public boolean isCreateMissingRecords() { return createMissingRecords; }
        public void setCreateMissingRecords(boolean createMissingRecords) { this.createMissingRecords = createMissingRecords; }
    }

    public static class Cleanup {
        private int defaultBatchLimit = 1000;
        /**
         * Objects younger than this are never treated as orphans: an ingest may still be
         * between upload and record update, or awaiting reattach.
         */
        private Duration minAge = Duration.ofHours(24);

        public int getDefaultBatchLimit() { return defaultBatchLimit; }
        public void setDefaultBatchLimit(int defaultBatchLimit) { this.defaultBatchLimit = defaultBatchLimit; }

        public Duration getMinAge() { return minAge; }
        public void setMinAge(Duration minAge) { this.minAge = minAge; }
    }
}
