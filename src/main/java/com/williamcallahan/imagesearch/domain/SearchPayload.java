package com.williamcallahan.imagesearch.domain;

/**
 * Typed payload stored with every indexed point and returned by recommend queries.
 *
 * @param path original file name, used as the relative destination of a downloaded match
 * @param hash content hash of the stored bytes
 * @param url public URL of the stored object
 */
public record SearchPayload(String path, String hash, String url) {

    public SearchPayload {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Payload path is required");
        }
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("Payload hash is required");
        }
        if (url == null) {
            throw new IllegalArgumentException("Payload url is required");
        }
    }

    /**
     * Returns the blob store key of the matched content.
     */
    public StoredObjectKey storedObjectKey() {
        return StoredObjectKey.of(new ContentHash(hash), path);
    }
}
