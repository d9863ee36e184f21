package com.williamcallahan.imagesearch.service.vector;

/**
 * Startup-time failure: an existing collection cannot hold the model's vectors.
 */
public class CollectionConfigurationException extends IllegalStateException {

    public CollectionConfigurationException(String message) {
        super(message);
    }
}
