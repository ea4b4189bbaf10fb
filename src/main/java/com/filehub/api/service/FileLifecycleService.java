package com.filehub.api.service;

import com.filehub.api.exception.ReferencesExistException;
import com.filehub.api.exception.ResourceNotFoundException;
import com.filehub.api.exception.StorageFailureException;
import com.filehub.api.model.FileReference;
import com.filehub.api.model.StoredFile;
import com.filehub.api.repository.FileReferenceRepository;
import com.filehub.api.repository.FileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.IOException;

/**
 * Deletion rules: references go first, one at a time; a file goes only once nothing
 * references it. Both operations lock the owning file row before touching anything,
 * so they serialize with each other and with reference creation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileLifecycleService {

    private final FileRepository fileRepository;
    private final FileReferenceRepository referenceRepository;
    private final ReferenceCountService referenceCountService;
    private final BlobStore blobStore;

    /**
     * Deletes the file and, after commit, its blob.
     *
     * @throws ReferencesExistException when live references remain; nothing is changed
     * @throws ResourceNotFoundException when no such file exists
     */
    @Transactional
    public void deleteFile(String id) {
        try {
            StoredFile file = fileRepository.findByIdForUpdate(id)
                    .orElseThrow(() -> new ResourceNotFoundException("File", id));

            long references = referenceRepository.countByOriginalFileId(id);
            if (references > 0) {
                throw new ReferencesExistException(id, references);
            }

            fileRepository.delete(file);
            fileRepository.flush();
            releaseAfterCommit(file.getStorageKey());
            log.info("Deleted file {} ({})", id, file.getOriginalFilename());
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to delete file " + id, e);
        }
    }

    /**
     * Deletes the reference and decrements the owner's count in the same transaction.
     *
     * @throws ResourceNotFoundException when no such reference exists
     */
    @Transactional
    public void deleteReference(String id) {
        try {
            FileReference reference = referenceRepository.findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("Reference", id));
            String fileId = reference.getOriginalFile().getId();

            fileRepository.findByIdForUpdate(fileId)
                    .orElseThrow(() -> new ResourceNotFoundException("File", fileId));

            // Re-checked under the lock: a concurrent delete of the same reference wins once
            if (referenceRepository.deleteByIdReturningCount(id) == 0) {
                throw new ResourceNotFoundException("Reference", id);
            }
            StoredFile owner = referenceCountService.adjustCount(fileId, -1);
            log.info("Deleted reference '{}', file {} now has reference count {}",
                    reference.getReferenceName(), fileId, owner.getReferenceCount());
        } catch (DataAccessException e) {
            throw new StorageFailureException("Failed to delete reference " + id, e);
        }
    }

    private void releaseAfterCommit(String storageKey) {
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                try {
                    blobStore.delete(storageKey);
                } catch (IOException e) {
                    log.warn("Failed to release blob {}, leaving it to the orphan sweep: {}", storageKey, e.getMessage());
                }
            }
        });
    }
}
