package com.filehub.api.service;

import com.filehub.api.model.StoredFile;
import com.filehub.api.repository.FileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.util.List;

/**
 * Gives legacy rows without a content digest one, computed from their stored bytes.
 * A row whose content already belongs to another file keeps its NULL digest: two rows
 * must never share one.
 */
@Slf4j
@Service
public class ContentHashBackfillService {

    private final FileRepository fileRepository;
    private final ContentHasher contentHasher;
    private final BlobStore blobStore;
    private final TransactionTemplate transactionTemplate;
    private final boolean enabled;

    public ContentHashBackfillService(FileRepository fileRepository,
                                      ContentHasher contentHasher,
                                      BlobStore blobStore,
                                      PlatformTransactionManager transactionManager,
                                      @Value("${app.backfill.enabled:true}") boolean enabled) {
        this.fileRepository = fileRepository;
        this.contentHasher = contentHasher;
        this.blobStore = blobStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.enabled = enabled;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (enabled) {
            backfill();
        }
    }

    /** @return the number of rows that received a digest */
    public int backfill() {
        List<StoredFile> legacy = fileRepository.findByContentHashIsNull();
        if (legacy.isEmpty()) {
            return 0;
        }
        log.info("Backfilling content digests for {} legacy files", legacy.size());

        int filled = 0;
        for (StoredFile file : legacy) {
            String digest;
            try {
                digest = contentHasher.hash(() -> blobStore.openStream(file.getStorageKey())).getHex();
            } catch (IOException e) {
                log.warn("Cannot read blob of legacy file {}: {}", file.getId(), e.getMessage());
                continue;
            }

            if (fileRepository.findByContentHash(digest).isPresent()) {
                log.warn("Legacy file {} duplicates existing content {}, leaving it unhashed", file.getId(), digest);
                continue;
            }
            try {
                Integer updated = transactionTemplate.execute(status -> fileRepository.backfillContentHash(file.getId(), digest));
                if (updated != null && updated > 0) {
                    filled++;
                }
            } catch (DataIntegrityViolationException e) {
                log.warn("Digest {} was claimed concurrently, leaving legacy file {} unhashed", digest, file.getId());
            }
        }
        log.info("Backfilled {} of {} legacy files", filled, legacy.size());
        return filled;
    }
}
