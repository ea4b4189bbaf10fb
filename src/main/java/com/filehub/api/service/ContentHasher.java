package com.filehub.api.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.InputStreamSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Computes the SHA-256 content digest used as the deduplication key. The digest is
 * an identity, not a security measure. Input is read in fixed-size chunks so memory
 * use does not grow with the file.
 */
@Component
public class ContentHasher {

    private static final String ALGORITHM = "SHA-256";

    private final int chunkSize;

    public ContentHasher(@Value("${app.hashing.chunk-size:4096}") int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("app.hashing.chunk-size must be positive, got " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    /**
     * Hashes the full content of the source, from its first byte. Every call opens and
     * closes its own stream, so the result never depends on where another reader of the
     * same source has got to, and the source can be read again afterwards.
     */
    public ContentDigest hash(InputStreamSource source) throws IOException {
        MessageDigest md = newDigest();
        byte[] chunk = new byte[chunkSize];
        long length = 0;
        try (InputStream in = source.getInputStream()) {
            int read;
            while ((read = in.read(chunk)) != -1) {
                md.update(chunk, 0, read);
                length += read;
            }
        }
        return new ContentDigest(HexFormat.of().formatHex(md.digest()), length);
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " algorithm not found", e);
        }
    }
}
