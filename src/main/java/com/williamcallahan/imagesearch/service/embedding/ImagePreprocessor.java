package com.williamcallahan.imagesearch.service.embedding;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Converts decoded images into the tensor layout the tagger model expects.
 *
 * <p>The image is centered on a white square canvas sized to its longer side, scaled to the model
 * resolution, and emitted as NHWC floats in BGR channel order with 0-255 scaling.</p>
 */
public final class ImagePreprocessor {

    /** Channels per pixel in the model input. */
    public static final int CHANNELS = 3;

    private ImagePreprocessor() {}

    /**
     * Pads the image to a white square, preserving aspect ratio, then scales it to {@code targetSize}.
     *
     * @param image source image
     * @param targetSize side length of the output canvas
     * @return RGB image of {@code targetSize x targetSize}
     */
    public static BufferedImage letterbox(BufferedImage image, int targetSize) {
        Objects.requireNonNull(image, "image");
        if (targetSize <= 0) {
            throw new IllegalArgumentException("targetSize must be positive");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        int maxDim = Math.max(width, height);

        BufferedImage padded = new BufferedImage(maxDim, maxDim, BufferedImage.TYPE_INT_RGB);
        Graphics2D paddedGraphics = padded.createGraphics();
        try {
            paddedGraphics.setColor(Color.WHITE);
            paddedGraphics.fillRect(0, 0, maxDim, maxDim);
            paddedGraphics.drawImage(image, (maxDim - width) / 2, (maxDim - height) / 2, null);
        } finally {
            paddedGraphics.dispose();
        }
        if (maxDim == targetSize) {
            return padded;
        }

        BufferedImage resized = new BufferedImage(targetSize, targetSize, BufferedImage.TYPE_INT_RGB);
        Graphics2D resizedGraphics = resized.createGraphics();
        try {
            resizedGraphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            resizedGraphics.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            resizedGraphics.drawImage(padded, 0, 0, targetSize, targetSize, null);
        } finally {
            resizedGraphics.dispose();
        }
        return resized;
    }

    /**
     * Letterboxes the image and flattens it into a {@code [size, size, 3]} BGR float array.
     *
     * @param image source image
     * @param targetSize model input resolution
     * @return row-major pixel values, blue first
     */
    public static float[] toModelInput(BufferedImage image, int targetSize) {
        BufferedImage square = letterbox(image, targetSize);
        float[] pixels = new float[targetSize * targetSize * CHANNELS];
        int offset = 0;
        for (int y = 0; y < targetSize; y++) {
            for (int x = 0; x < targetSize; x++) {
                int rgb = square.getRGB(x, y);
                pixels[offset++] = rgb & 0xFF;
                pixels[offset++] = (rgb >> 8) & 0xFF;
                pixels[offset++] = (rgb >> 16) & 0xFF;
            }
        }
        return pixels;
    }
}
