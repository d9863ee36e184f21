package com.williamcallahan.imagesearch.domain;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Hex-encoded 256-bit digest of a file's raw bytes.
 *
 * <p>Identical bytes always produce the same hash regardless of file name, which makes the hash the
 * stem of the stored object key and the seed of the vector index point identifier.</p>
 *
 * @param hex lowercase hexadecimal digest (64 characters)
 */
public record ContentHash(String hex) {
    private static final Pattern HEX_256 = Pattern.compile("[0-9a-f]{64}");

    public ContentHash {
        Objects.requireNonNull(hex, "hex");
        hex = hex.toLowerCase(Locale.ROOT);
        if (!HEX_256.matcher(hex).matches()) {
            throw new IllegalArgumentException("Content hash must be 64 hex characters but was: " + hex);
        }
    }

    /**
     * Derives the name-based point identifier for this content.
     *
     * <p>The same content always maps to the same id, so re-indexing overwrites the existing point.</p>
     *
     * @return deterministic UUID derived from the hex digest
     */
    public UUID pointId() {
        return UUID.nameUUIDFromBytes(hex.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return hex;
    }
}
