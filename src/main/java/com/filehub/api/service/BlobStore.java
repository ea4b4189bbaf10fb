package com.filehub.api.service;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.List;

/**
 * Opaque byte storage. Keys are generated by the store and carry no meaning.
 */
public interface BlobStore {

    // 1. Persist the bytes and return the key they can be found under
    String put(InputStream content) throws IOException;

    // 2. Open the bytes for reading; the caller closes the stream
    InputStream openStream(String key) throws IOException;

    // 3. Release the key; missing keys are ignored
    void delete(String key) throws IOException;

    // 4. Keys last written before the cutoff (used by the orphan sweep)
    List<String> listKeysOlderThan(Instant cutoff) throws IOException;
}
