package com.williamcallahan.imagesearch.service;

import java.io.IOException;

/**
 * Raised when no installed ImageIO reader can decode a file's bytes.
 */
public class ImageDecodeException extends IOException {

    public ImageDecodeException(String message) {
        super(message);
    }
}
