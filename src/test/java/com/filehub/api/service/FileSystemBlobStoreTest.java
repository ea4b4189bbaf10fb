package com.filehub.api.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemBlobStoreTest {

    @TempDir
    Path root;

    private FileSystemBlobStore store;

    @BeforeEach
    void setUp() {
        store = new FileSystemBlobStore(root.toString());
    }

    @Test
    void putThenReadBack() throws IOException {
        String key = store.put(stream("hello"));

        try (InputStream in = store.openStream(key)) {
            assertEquals("hello", new String(in.readAllBytes(), StandardCharsets.UTF_8));
        }
        assertTrue(Files.exists(root.resolve(key)));
    }

    @Test
    void identicalContentGetsDistinctKeys() throws IOException {
        assertNotEquals(store.put(stream("same")), store.put(stream("same")));
    }

    @Test
    void deleteRemovesBlobAndIgnoresMissingKeys() throws IOException {
        String key = store.put(stream("bye"));

        store.delete(key);
        store.delete(key);

        assertFalse(Files.exists(root.resolve(key)));
        assertThrows(FileNotFoundException.class, () -> store.openStream(key));
    }

    @Test
    void listsOnlyBlobsOlderThanCutoff() throws IOException {
        String old = store.put(stream("old"));
        String fresh = store.put(stream("fresh"));
        Files.setLastModifiedTime(root.resolve(old), FileTime.from(Instant.now().minus(2, ChronoUnit.HOURS)));
        Files.createFile(root.resolve(".DS_Store"));

        List<String> keys = store.listKeysOlderThan(Instant.now().minus(1, ChronoUnit.HOURS));

        assertEquals(List.of(old), keys);
        assertFalse(keys.contains(fresh));
    }

    @Test
    void rejectsKeysOutsideTheRoot() {
        assertThrows(IllegalArgumentException.class, () -> store.openStream("../escape"));
    }

    private static InputStream stream(String s) {
        return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
    }
}
