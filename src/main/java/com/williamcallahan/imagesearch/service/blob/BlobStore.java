package com.williamcallahan.imagesearch.service.blob;

import com.williamcallahan.imagesearch.domain.StoredObjectKey;
import java.util.List;

/**
 * Key/value object storage holding the original image bytes.
 *
 * <p>One instance is shared by every pipeline worker, so implementations must be safe under
 * concurrent invocation. Failures surface as {@link BlobStoreException}.</p>
 */
public interface BlobStore {

    /**
     * Reports whether an object is stored under the key.
     *
     * @param key content-addressed key
     * @return true when the object exists
     */
    boolean exists(StoredObjectKey key);

    /**
     * Stores bytes under the key, overwriting any existing object.
     *
     * @param key content-addressed key
     * @param bytes object content
     */
    void put(StoredObjectKey key, byte[] bytes);

    /**
     * Reads the object stored under the key.
     *
     * @param key content-addressed key
     * @return object content
     */
    byte[] get(StoredObjectKey key);

    /**
     * Lists stored keys, optionally restricted to a prefix.
     *
     * @param prefix key prefix, or {@code null} / blank for every key
     * @return matching keys
     */
    List<String> list(String prefix);

    /**
     * Returns the public URL recorded in point payloads for the key.
     *
     * @param key content-addressed key
     * @return absolute URL of the stored object
     */
    String urlFor(StoredObjectKey key);
}
