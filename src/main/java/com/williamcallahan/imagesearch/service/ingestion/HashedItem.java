package com.williamcallahan.imagesearch.service.ingestion;

import com.williamcallahan.imagesearch.domain.ContentHash;
import com.williamcallahan.imagesearch.domain.StoredObjectKey;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

/**
 * Output of the hash stage: either already stored, or decoded and waiting for embedding.
 *
 * @param path source file
 * @param hash content hash of the file bytes
 * @param key blob store key
 * @param image decoded pixels, null when already stored
 * @param bytes original bytes to upload, null when the blob is already stored
 */
record HashedItem(Path path, ContentHash hash, StoredObjectKey key, BufferedImage image, byte[] bytes) {

    static HashedItem alreadyStored(Path path, ContentHash hash, StoredObjectKey key) {
        return new HashedItem(path, hash, key, null, null);
    }

    static HashedItem toIndex(Path path, ContentHash hash, StoredObjectKey key, BufferedImage image, byte[] bytes) {
        return new HashedItem(path, hash, key, image, bytes);
    }

    boolean isAlreadyStored() {
        return image == null;
    }

    boolean needsUpload() {
        return bytes != null;
    }

    @Override
    public String toString() {
        return path.toString();
    }
}
