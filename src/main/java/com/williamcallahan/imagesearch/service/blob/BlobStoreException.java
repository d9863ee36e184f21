package com.williamcallahan.imagesearch.service.blob;

/**
 * Signals a failed blob store call (network, authorization, or missing object on read).
 */
public class BlobStoreException extends RuntimeException {

    public BlobStoreException(String message) {
        super(message);
    }

    public BlobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
