/**
 * Configuration for the S3 client used for trivia image storage
 *
 * Features:
 * - Creates the S3Client only when S3EnvironmentCondition matches
 * - Talks to AWS S3 directly when no server URL is set
 * - Supports custom endpoint URL for MinIO, DigitalOcean Spaces or other S3-compatible services
 * - Uses path-style access on custom endpoints so bucket names need no DNS entry
 */
package com.williamcallahan.trivia_image_curator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;

@Configuration
@Conditional(S3EnvironmentCondition.class)
public class S3Config {
    private static final Logger logger = LoggerFactory.getLogger(S3Config.class);

    /**
     * Creates and configures the S3Client bean
     *
     * @param properties bound s3.* properties
     * @return configured S3Client; closed by Spring on shutdown
     */
    @Bean(destroyMethod = "close")
    public S3Client s3Client(S3ConfigurationProperties properties) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(properties.getRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(
                        AwsBasicCredentials.create(properties.getAccessKeyId(), properties.getSecretAccessKey())));

        String serverUrl = properties.getServerUrl();
        if (serverUrl != null && !serverUrl.isBlank()) {
            logger.info("Configuring S3Client with server URL: {} and region: {}", serverUrl, properties.getRegion());
            builder.endpointOverride(URI.create(serverUrl))
                    .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());
        } else {
            logger.info("Configuring S3Client for AWS S3 in region: {}", properties.getRegion());
        }
        return builder.build();
    }
}
