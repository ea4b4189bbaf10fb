package com.filehub.api.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Slf4j
@Service
public class FileSystemBlobStore implements BlobStore {

    private static final int BUFFER_SIZE = 65536;

    private final Path rootLocation;

    public FileSystemBlobStore(@Value("${app.storage.location}") String storageLocation) {
        this.rootLocation = Paths.get(storageLocation).toAbsolutePath().normalize();
        init();
    }

    private void init() {
        try {
            Files.createDirectories(rootLocation);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not initialize storage location " + rootLocation, e);
        }
    }

    @Override
    public String put(InputStream content) throws IOException {
        // UUID keys: two uploads never share a path, whatever their names
        String key = UUID.randomUUID().toString();
        Path destination = resolve(key);

        try (OutputStream out = new BufferedOutputStream(
                Files.newOutputStream(destination, StandardOpenOption.CREATE_NEW), BUFFER_SIZE)) {
            content.transferTo(out);
        } catch (IOException e) {
            Files.deleteIfExists(destination);
            throw e;
        }
        log.debug("Stored blob {}", key);
        return key;
    }

    @Override
    public InputStream openStream(String key) throws IOException {
        Path path = resolve(key);
        if (!Files.exists(path)) {
            throw new FileNotFoundException("Blob not found: " + key);
        }
        return Files.newInputStream(path);
    }

    @Override
    public void delete(String key) throws IOException {
        if (Files.deleteIfExists(resolve(key))) {
            log.debug("Deleted blob {}", key);
        }
    }

    @Override
    public List<String> listKeysOlderThan(Instant cutoff) throws IOException {
        try (Stream<Path> files = Files.list(rootLocation)) {
            return files
                    .filter(Files::isRegularFile)
                    // Skip hidden system files (like .DS_Store)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .filter(p -> lastModified(p).isBefore(cutoff))
                    .map(p -> p.getFileName().toString())
                    .collect(Collectors.toList());
        }
    }

    private Instant lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toInstant();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private Path resolve(String key) {
        Path path = rootLocation.resolve(key).normalize();
        if (!path.getParent().equals(rootLocation)) {
            throw new IllegalArgumentException("Invalid blob key: " + key);
        }
        return path;
    }
}
