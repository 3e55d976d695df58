/**
 * Main application class for the Trivia Image Curator
 *
 * Features:
 * - Discovers openly-licensed candidate images on Wikimedia Commons
 * - Ingests a chosen image into S3 and records it against a question id
 * - Exposes admin endpoints for discovery, ingestion and orphan cleanup
 */
package com.williamcallahan.trivia_image_curator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriviaImageCuratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriviaImageCuratorApplication.class, args);
    }
}
