/**
 * S3 configuration properties for the image bucket
 */

package com.williamcallahan.trivia_image_curator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "s3")
public class S3ConfigurationProperties {
    private String accessKeyId;
    private String secretAccessKey;
    private String serverUrl;
    private String region = "us-west-2";
    private String bucketName;
    private String cdnUrl;
    private boolean publicRead = true;

    public String getAccessKeyId() { return accessKeyId; }
    public void setAccessKeyId(String accessKeyId) { this.accessKeyId = accessKeyId; }

    public String getSecretAccessKey() { return secretAccessKey; }
    public void setSecretAccessKey(String secretAccessKey) { this.secretAccessKey = secretAccessKey; }

    public String getServerUrl() { return serverUrl; }
    public void setServerUrl(String serverUrl) { this.serverUrl = serverUrl; }

    public String getRegion() { return region; }
    public void setRegion(String region) { this.region = region; }

    public String getBucketName() { return bucketName; }
    public void setBucketName(String bucketName) { this.bucketName = bucketName; }

    public String getCdnUrl() { return cdnUrl; }
    public void setCdnUrl(String cdnUrl) { this.cdnUrl = cdnUrl; }

    /** Whether uploaded objects get the {@code public-read} canned ACL. */
    public boolean isPublicRead() { return publicRead; }
    public void setPublicRead(boolean publicRead) { this.publicRead = publicRead; }
}
