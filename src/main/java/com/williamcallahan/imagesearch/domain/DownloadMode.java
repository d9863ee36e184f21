package com.williamcallahan.imagesearch.domain;

/**
 * Source used to materialize matched files during a query run.
 */
public enum DownloadMode {
    /** Fetch bytes from the blob store by the content-addressed key. */
    BLOB_STORE,
    /** Fetch bytes from the payload URL over HTTP. */
    HTTP
}
