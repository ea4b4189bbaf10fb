package com.filehub.api.service;

import com.filehub.api.repository.FileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Removes blobs that no file row owns. They are left behind when an upload fails
 * after its bytes were written, or when a release after delete fails.
 */
@Slf4j
@Service
public class FileCleanupService {

    private final FileRepository fileRepository;
    private final BlobStore blobStore;
    private final Duration gracePeriod;

    public FileCleanupService(FileRepository fileRepository,
                              BlobStore blobStore,
                              @Value("${app.cleanup.orphan-grace-ms:600000}") long graceMillis) {
        this.fileRepository = fileRepository;
        this.blobStore = blobStore;
        this.gracePeriod = Duration.ofMillis(graceMillis);
    }

    /**
     * Blobs younger than the grace period are skipped: they may belong to an upload
     * whose row is not committed yet.
     *
     * @return the number of blobs deleted
     */
    @Scheduled(fixedRateString = "${app.cleanup.orphan-interval-ms:3600000}",
            initialDelayString = "${app.cleanup.orphan-interval-ms:3600000}")
    public int cleanOrphanBlobs() {
        log.debug("Checking for orphan blobs");

        List<String> candidates;
        try {
            candidates = blobStore.listKeysOlderThan(Instant.now().minus(gracePeriod));
        } catch (IOException e) {
            log.error("Could not list blobs for the orphan sweep", e);
            return 0;
        }

        int deleted = 0;
        for (String key : candidates) {
            if (fileRepository.existsByStorageKey(key)) {
                continue;
            }
            try {
                blobStore.delete(key);
                deleted++;
                log.info("Deleted orphan blob {}", key);
            } catch (IOException e) {
                log.warn("Failed to delete orphan blob {}: {}", key, e.getMessage());
            }
        }
        return deleted;
    }
}
