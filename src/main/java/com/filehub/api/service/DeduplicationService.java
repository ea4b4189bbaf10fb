package com.filehub.api.service;

import com.filehub.api.dto.UploadResult;
import com.filehub.api.exception.DuplicateNameException;
import com.filehub.api.exception.InvalidUploadException;
import com.filehub.api.exception.StorageFailureException;
import com.filehub.api.model.FileReference;
import com.filehub.api.model.StoredFile;
import com.filehub.api.repository.FileReferenceRepository;
import com.filehub.api.repository.FileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.InputStreamSource;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Decides, per upload, whether the content becomes a new {@link StoredFile} or a
 * {@link FileReference} to the file that already holds it.
 * <p>
 * The digest lookup comes first; the reference name is only checked once the content
 * is known to exist. The unique constraint on {@code content_hash} is the serialization
 * point for creation: an insert that loses the race is rolled back and the upload is
 * resolved again as a reference. Each path commits exactly one new row, plus the
 * counter update on the owning file for the reference path.
 */
@Slf4j
@Service
public class DeduplicationService {

    private static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final FileRepository fileRepository;
    private final FileReferenceRepository referenceRepository;
    private final ReferenceCountService referenceCountService;
    private final ContentHasher contentHasher;
    private final BlobStore blobStore;
    private final TransactionTemplate transactionTemplate;
    private final int maxAttempts;

    public DeduplicationService(FileRepository fileRepository,
                                FileReferenceRepository referenceRepository,
                                ReferenceCountService referenceCountService,
                                ContentHasher contentHasher,
                                BlobStore blobStore,
                                PlatformTransactionManager transactionManager,
                                @Value("${app.dedup.max-attempts:3}") int maxAttempts) {
        this.fileRepository = fileRepository;
        this.referenceRepository = referenceRepository;
        this.referenceCountService = referenceCountService;
        this.contentHasher = contentHasher;
        this.blobStore = blobStore;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Stores the upload, or records it as a reference when identical content exists.
     *
     * @throws InvalidUploadException  when the content has no bytes or there is no name
     * @throws DuplicateNameException  when the content exists and a reference with this name exists too
     * @throws StorageFailureException when hashing, the blob store or the database fails
     */
    public UploadResult submit(InputStreamSource content, String filename, String contentType, long size) {
        if (content == null) {
            throw new InvalidUploadException("No file provided");
        }
        if (!StringUtils.hasText(filename)) {
            throw new InvalidUploadException("A file name is required.");
        }
        String fileType = StringUtils.hasText(contentType) ? contentType : DEFAULT_CONTENT_TYPE;

        ContentDigest hashed = computeDigest(content, filename);
        // The bytes actually read are authoritative, not the declared size
        if (hashed.getLength() == 0) {
            throw new InvalidUploadException("Failed to store empty file.");
        }
        if (hashed.getLength() != size) {
            log.warn("Upload '{}' declared {} bytes but contains {}", filename, size, hashed.getLength());
        }
        String digest = hashed.getHex();
        long storedSize = hashed.getLength();
        log.debug("Upload '{}' ({} bytes) has digest {}", filename, storedSize, digest);

        String pendingKey = null;
        RuntimeException lastFailure = null;
        try {
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                try {
                    Optional<StoredFile> existing = fileRepository.findByContentHash(digest);

                    if (existing.isPresent()) {
                        Optional<FileReference> reference = tryCreateReference(existing.get(), filename);
                        if (reference.isPresent()) {
                            log.info("Duplicate content for '{}': referenced existing file {} ({})",
                                    filename, existing.get().getId(), existing.get().getOriginalFilename());
                            return UploadResult.referenced(reference.get());
                        }
                        log.warn("File {} disappeared before '{}' could reference it, resolving again",
                                existing.get().getId(), filename);
                        continue;
                    }

                    if (pendingKey == null) {
                        pendingKey = storeBlob(content, filename);
                    }
                    Optional<StoredFile> created = tryCreateFile(pendingKey, digest, filename, fileType, storedSize);
                    if (created.isPresent()) {
                        pendingKey = null; // owned by the committed row now
                        log.info("Stored new file '{}' as {}", filename, created.get().getId());
                        return UploadResult.created(created.get());
                    }
                    log.warn("Concurrent upload created digest {} first, resolving '{}' as a reference", digest, filename);
                } catch (ConcurrencyFailureException e) {
                    // Lock timeout or serialization failure: nothing was committed, try again
                    log.warn("Attempt {} for '{}' hit a concurrency failure: {}", attempt, filename, e.getMessage());
                    lastFailure = e;
                }
            }
        } catch (DataAccessException | TransactionException e) {
            throw new StorageFailureException("Failed to store " + filename, e);
        } finally {
            if (pendingKey != null) {
                releaseBlob(pendingKey);
            }
        }

        throw new StorageFailureException(
                "Could not resolve upload of " + filename + " after " + maxAttempts + " attempts", lastFailure);
    }

    /**
     * Inserts the reference and bumps the owner's counters in one transaction, with the
     * owner row locked. Empty when the owner no longer exists.
     */
    private Optional<FileReference> tryCreateReference(StoredFile owner, String referenceName) {
        try {
            return Optional.ofNullable(transactionTemplate.execute(status -> {
                Optional<StoredFile> locked = fileRepository.findByIdForUpdate(owner.getId());
                if (locked.isEmpty()) {
                    return null;
                }
                if (referenceRepository.existsByReferenceName(referenceName)) {
                    throw new DuplicateNameException(referenceName, locked.get().getOriginalFilename());
                }

                FileReference reference = referenceRepository.saveAndFlush(FileReference.builder()
                        .originalFile(locked.get())
                        .referenceName(referenceName)
                        .createdAt(LocalDateTime.now())
                        .build());

                StoredFile updated = referenceCountService.adjustCount(owner.getId(), +1);
                reference.setOriginalFile(updated);
                return reference;
            }));
        } catch (DataIntegrityViolationException e) {
            // Same name taken concurrently for another file's content
            if (referenceRepository.existsByReferenceName(referenceName)) {
                throw new DuplicateNameException(referenceName, owner.getOriginalFilename());
            }
            throw e;
        }
    }

    /**
     * Inserts a new file row in its own transaction. Empty when another upload committed
     * the same digest first.
     */
    private Optional<StoredFile> tryCreateFile(String storageKey, String digest, String filename,
                                               String fileType, long size) {
        try {
            return Optional.ofNullable(transactionTemplate.execute(status ->
                    fileRepository.saveAndFlush(StoredFile.builder()
                            .originalFilename(filename)
                            .fileType(fileType)
                            .size(size)
                            .uploadedAt(LocalDateTime.now())
                            .contentHash(digest)
                            .storageKey(storageKey)
                            .build())));
        } catch (DataIntegrityViolationException e) {
            if (fileRepository.findByContentHash(digest).isPresent()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    private ContentDigest computeDigest(InputStreamSource content, String filename) {
        try {
            return contentHasher.hash(content);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to read " + filename, e);
        }
    }

    private String storeBlob(InputStreamSource content, String filename) {
        try (InputStream in = content.getInputStream()) {
            return blobStore.put(in);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to write " + filename + " to the blob store", e);
        }
    }

    private void releaseBlob(String key) {
        try {
            blobStore.delete(key);
        } catch (IOException e) {
            // The orphan sweep picks it up later
            log.warn("Failed to release unused blob {}: {}", key, e.getMessage());
        }
    }
}
