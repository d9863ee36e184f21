package com.williamcallahan.imagesearch.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

/**
 * Verifies that object keys combine the content hash with the source file's extension.
 */
class StoredObjectKeyTest {

    private static final ContentHash HASH =
            new ContentHash("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");

    @Test
    void keyIsHashDotExtension() {
        StoredObjectKey key = StoredObjectKey.of(HASH, Path.of("/photos/cats/tabby.png"));

        assertEquals(HASH.hex() + ".png", key.value());
    }

    @Test
    void keepsTheOriginalExtensionCase() {
        StoredObjectKey key = StoredObjectKey.of(HASH, "scan.JPEG");

        assertEquals(HASH.hex() + ".JPEG", key.value());
    }

    @Test
    void usesOnlyTheLastExtension() {
        assertEquals(HASH.hex() + ".gz", StoredObjectKey.of(HASH, "archive.tar.gz").value());
    }

    @Test
    void rejectsFileNamesWithoutExtension() {
        assertThrows(IllegalArgumentException.class, () -> StoredObjectKey.of(HASH, "README"));
        assertThrows(IllegalArgumentException.class, () -> StoredObjectKey.of(HASH, "trailing."));
    }

    @Test
    void payloadResolvesBackToTheStoredKey() {
        SearchPayload payload = new SearchPayload("tabby.png", HASH.hex(), "http://example.test/x");

        assertEquals(StoredObjectKey.of(HASH, "tabby.png"), payload.storedObjectKey());
    }
}
