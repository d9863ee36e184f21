package com.williamcallahan.imagesearch.domain;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Blob store key of the form {@code {hash}.{original-extension}}.
 *
 * @param value full object key
 */
public record StoredObjectKey(String value) {

    public StoredObjectKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Stored object key is required");
        }
    }

    /**
     * Builds the key for a source file from its content hash and file extension.
     *
     * @param hash content hash of the file bytes
     * @param source file whose extension is carried into the key
     * @return content-addressed key
     */
    public static StoredObjectKey of(ContentHash hash, Path source) {
        Objects.requireNonNull(source, "source");
        Path fileName = source.getFileName();
        if (fileName == null) {
            throw new IllegalArgumentException("Source path has no file name: " + source);
        }
        return of(hash, fileName.toString());
    }

    /**
     * Builds the key from a content hash and any file name carrying the original extension.
     *
     * @param hash content hash of the file bytes
     * @param fileName file name such as {@code cat.png}
     * @return content-addressed key
     */
    public static StoredObjectKey of(ContentHash hash, String fileName) {
        Objects.requireNonNull(hash, "hash");
        return new StoredObjectKey(hash.hex() + "." + extensionOf(fileName));
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            throw new IllegalArgumentException("File name is required");
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            throw new IllegalArgumentException("File name has no extension: " + fileName);
        }
        return fileName.substring(dot + 1);
    }

    @Override
    public String toString() {
        return value;
    }
}
