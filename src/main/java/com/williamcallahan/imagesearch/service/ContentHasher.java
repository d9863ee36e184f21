package com.williamcallahan.imagesearch.service;

import com.williamcallahan.imagesearch.domain.ContentHash;
import java.io.IOException;
import java.nio.MappedByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Computes content hashes of raw file bytes.
 *
 * <p>Files are read through read-only memory-mapped windows so large images never need a heap copy.
 * The digest depends only on the bytes, never on the file name or location.</p>
 */
@Component
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";
    private static final long MAP_WINDOW_BYTES = 64L * 1024 * 1024;

    /**
     * Hashes a file by streaming its memory-mapped contents through the digest.
     *
     * @param file file to hash
     * @return content hash of the file bytes
     * @throws IOException when the file cannot be opened or mapped
     */
    public ContentHash hash(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        MessageDigest digest = newDigest();
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            for (long position = 0; position < size; position += MAP_WINDOW_BYTES) {
                long windowSize = Math.min(MAP_WINDOW_BYTES, size - position);
                MappedByteBuffer window = channel.map(FileChannel.MapMode.READ_ONLY, position, windowSize);
                digest.update(window);
            }
        }
        return new ContentHash(HexFormat.of().formatHex(digest.digest()));
    }

    /**
     * Hashes bytes already held in memory.
     *
     * @param bytes content to hash
     * @return content hash of the bytes
     */
    public ContentHash hash(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        return new ContentHash(HexFormat.of().formatHex(newDigest().digest(bytes)));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
