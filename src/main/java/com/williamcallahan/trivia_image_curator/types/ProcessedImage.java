package com.williamcallahan.trivia_image_curator.types;

/**
 * Result of an image transformation. A failed transformation carries the
 * error text and no bytes; callers fall back to the untouched input.
 */
public class ProcessedImage {
    public final byte[] processedBytes;
    public final String mimeType;
    public final int width;
    public final int height;
    public final boolean processingSuccessful;
    public final String processingError; // Null if successful

    // Constructor for a successfully processed image
    public ProcessedImage(byte[] processedBytes, String mimeType, int width, int height) {
        this.processedBytes = processedBytes;
        this.mimeType = mimeType;
        this.width = width;
        this.height = height;
        this.processingSuccessful = true;
        this.processingError = null;
    }

    // Constructor for a failed processing attempt
    public ProcessedImage(String processingError) {
        this.processedBytes = null;
        this.mimeType = null;
        this.width = 0;
        this.height = 0;
        this.processingSuccessful = false;
        this.processingError = processingError;
    }

    public byte[] getProcessedBytes() {
        return processedBytes;
    }

    public String getMimeType() {
        return mimeType;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public boolean isProcessingSuccessful() {
        return processingSuccessful;
    }

    public String getProcessingError() {
        return processingError;
    }
}
