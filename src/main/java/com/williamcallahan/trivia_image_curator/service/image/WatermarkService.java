package com.williamcallahan.trivia_image_curator.service.image;

import com.williamcallahan.trivia_image_curator.config.CurationProperties;
import com.williamcallahan.trivia_image_curator.types.ProcessedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import javax.imageio.ImageIO;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.concurrent.Executor;

/**
 * Composites the configured watermark onto the bottom-right corner of an image.
 * Never throws: every failure comes back as an unsuccessful {@link ProcessedImage}
 * so the caller can upload the original bytes instead.
 */
@Service
public class WatermarkService {

    private static final Logger logger = LoggerFactory.getLogger(WatermarkService.class);
    private static final double MAX_WATERMARK_WIDTH_RATIO = 0.25; // Shrink the mark if wider than a quarter of the image

    private final ResourceLoader resourceLoader;
    private final String watermarkLocation;
    private final Scheduler scheduler;

    private volatile BufferedImage cachedWatermark;

    public WatermarkService(ResourceLoader resourceLoader,
                            CurationProperties curationProperties,
                            @Qualifier("imageProcessingExecutor") Executor imageProcessingExecutor) {
        this.resourceLoader = resourceLoader;
        this.watermarkLocation = curationProperties.getWatermark().getLocation();
        this.scheduler = Schedulers.fromExecutor(imageProcessingExecutor);
    }

    /**
     * Watermarks on the image-processing pool.
     */
    public Mono<ProcessedImage> applyWatermarkAsync(byte[] imageBytes, String mimeType, String entityIdForLog) {
        return Mono.fromCallable(() -> applyWatermark(imageBytes, mimeType, entityIdForLog))
            .subscribeOn(scheduler);
    }

    /**
     * Watermark an image, keeping its declared MIME type.
     *
     * @return processed bytes, or a failed result describing why the original should be used
     */
    public ProcessedImage applyWatermark(byte[] imageBytes, String mimeType, String entityIdForLog) {
        if (imageBytes == null || imageBytes.length == 0) {
            logger.warn("Entity {}: Image bytes are null or empty. Cannot watermark.", entityIdForLog);
            return new ProcessedImage("Image bytes are null or empty.");
        }

        try {
            BufferedImage watermark = loadWatermark();
            if (watermark == null) {
                return new ProcessedImage("Watermark asset could not be read from " + watermarkLocation);
            }

            BufferedImage original;
            try (ByteArrayInputStream bais = new ByteArrayInputStream(imageBytes)) {
                original = ImageIO.read(bais);
            }
            if (original == null) {
                logger.warn("Entity {}: Could not decode {} bytes as {}. Format might be unsupported or corrupt.",
                    entityIdForLog, imageBytes.length, mimeType);
                return new ProcessedImage("Unsupported or corrupt image format.");
            }

            String formatName = formatName(mimeType);
            boolean opaqueFormat = "jpeg".equals(formatName) || "bmp".equals(formatName);
            int width = original.getWidth();
            int height = original.getHeight();

            BufferedImage output = new BufferedImage(width, height,
                opaqueFormat ? BufferedImage.TYPE_INT_RGB : BufferedImage.TYPE_INT_ARGB);
            Graphics2D g2d = output.createGraphics();
            try {
                g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
                g2d.drawImage(original, 0, 0, null);

                int markWidth = watermark.getWidth();
                int markHeight = watermark.getHeight();
                int maxMarkWidth = Math.max(1, (int) (width * MAX_WATERMARK_WIDTH_RATIO));
                if (markWidth > maxMarkWidth) {
                    markHeight = Math.max(1, (int) Math.round((double) markHeight * maxMarkWidth / markWidth));
                    markWidth = maxMarkWidth;
                }
                g2d.setComposite(AlphaComposite.getInstance(AlphaComposite.SRC_OVER));
                g2d.drawImage(watermark, width - markWidth, height - markHeight, markWidth, markHeight, null);
            } finally {
                g2d.dispose();
            }

            try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
                if (!ImageIO.write(output, formatName, baos)) {
                    logger.warn("Entity {}: No ImageIO writer for format '{}'. Cannot watermark.", entityIdForLog, formatName);
                    return new ProcessedImage("No ImageIO writer available for " + mimeType);
                }
                byte[] processedBytes = baos.toByteArray();
                logger.info("Entity {}: Watermarked {}x{} {} image, {} bytes.", entityIdForLog, width, height, mimeType, processedBytes.length);
                return new ProcessedImage(processedBytes, mimeType, width, height);
            }
        } catch (IOException e) {
            logger.error("Entity {}: IOException during watermarking: {}", entityIdForLog, e.getMessage(), e);
            return new ProcessedImage("IOException during watermarking: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Entity {}: Unexpected exception during watermarking: {}", entityIdForLog, e.getMessage(), e);
            return new ProcessedImage("Unexpected error during watermarking: " + e.getMessage());
        }
    }

    private BufferedImage loadWatermark() throws IOException {
        BufferedImage watermark = cachedWatermark;
        if (watermark != null) {
            return watermark;
        }
        Resource resource = resourceLoader.getResource(watermarkLocation);
        if (!resource.exists()) {
            logger.warn("Watermark asset not found at {}", watermarkLocation);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            watermark = ImageIO.read(in);
        }
        if (watermark == null) {
            logger.warn("Watermark asset at {} is not a readable image", watermarkLocation);
            return null;
        }
        cachedWatermark = watermark;
        return watermark;
    }

    static String formatName(String mimeType) {
        if (mimeType == null || mimeType.indexOf('/') < 0) {
            return "png";
        }
        String subtype = mimeType.substring(mimeType.indexOf('/') + 1).toLowerCase(Locale.ROOT);
        return "jpg".equals(subtype) ? "jpeg" : subtype;
    }
}
