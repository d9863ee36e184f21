package com.williamcallahan.imagesearch.service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * Decodes image bytes with the installed ImageIO readers.
 */
public final class ImageDecoder {

    private ImageDecoder() {}

    /**
     * Decodes bytes already read from {@code source}.
     *
     * @throws ImageDecodeException when no reader recognizes the data
     */
    public static BufferedImage decode(byte[] bytes, Path source) throws IOException {
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(bytes));
        if (image == null) {
            throw new ImageDecodeException("No image reader could decode " + source);
        }
        return image;
    }

    public static BufferedImage decode(Path file) throws IOException {
        return decode(Files.readAllBytes(file), file);
    }
}
