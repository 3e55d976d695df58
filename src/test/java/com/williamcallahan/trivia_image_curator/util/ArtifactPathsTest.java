package com.williamcallahan.trivia_image_curator.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ArtifactPathsTest {

    @Test
    void urlKeyIsPrefixEntityAndExtension() {
        assertEquals("trivia_images/q42.jpg", ArtifactPaths.urlObjectKey("trivia_images", "q42", "jpg"));
        assertEquals("trivia_images/q42.jpg", ArtifactPaths.urlObjectKey("trivia_images/", "q42", "jpg"));
    }

    @Test
    void inlineKeyCarriesUploadTimestamp() {
        assertEquals("trivia_images/q7_upload_1700000000000.png",
            ArtifactPaths.inlineObjectKey("trivia_images", "q7", 1_700_000_000_000L, "png"));
    }

    @Test
    void extensionFromUrlStripsQueryAndFragmentAndLowercases() {
        assertEquals("jpg", ArtifactPaths.extensionFromUrl("https://example.org/img.jpg"));
        assertEquals("png", ArtifactPaths.extensionFromUrl("https://upload.wikimedia.org/a/b/Flag.PNG?width=300"));
        assertEquals("svg", ArtifactPaths.extensionFromUrl("https://example.org/files/logo.svg#top"));
        assertEquals("tif", ArtifactPaths.extensionFromUrl("https://example.org/v1.2/scan.tif"));
    }

    @Test
    void extensionFromUrlDefaultsToJpg() {
        assertEquals("jpg", ArtifactPaths.extensionFromUrl("https://example.org/image"));
        assertEquals("jpg", ArtifactPaths.extensionFromUrl("https://example.org"));
        assertEquals("jpg", ArtifactPaths.extensionFromUrl("https://example.org/v1.2/"));
        assertEquals("jpg", ArtifactPaths.extensionFromUrl(null));
    }

    @Test
    void extensionFromMimeTypeUsesSubtypeDefaultingToPng() {
        assertEquals("jpeg", ArtifactPaths.extensionFromMimeType("image/jpeg"));
        assertEquals("webp", ArtifactPaths.extensionFromMimeType("image/webp"));
        assertEquals("png", ArtifactPaths.extensionFromMimeType("image/"));
        assertEquals("png", ArtifactPaths.extensionFromMimeType(null));
    }

    @Test
    void blankPrefixFallsBackToDefault() {
        assertEquals("trivia_images/", ArtifactPaths.ensureTrailingSlash(" "));
    }
}
