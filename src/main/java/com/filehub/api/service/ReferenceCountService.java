package com.filehub.api.service;

import com.filehub.api.exception.ResourceNotFoundException;
import com.filehub.api.model.StoredFile;
import com.filehub.api.repository.FileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps {@code referenceCount} and {@code storageSaved} in step. Runs only inside the
 * transaction of the operation that created or deleted the reference row.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReferenceCountService {

    private final FileRepository fileRepository;

    /**
     * Applies {@code delta} (+1 or -1) as a single conditional update. The count never
     * drops below 1 and storage saved is recomputed in the same statement.
     *
     * @return the file as committed by the update
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public StoredFile adjustCount(String fileId, int delta) {
        if (delta != 1 && delta != -1) {
            throw new IllegalArgumentException("Reference count delta must be +1 or -1, got " + delta);
        }

        if (fileRepository.applyReferenceDelta(fileId, delta) == 0) {
            throw new ResourceNotFoundException("File", fileId);
        }

        StoredFile updated = fileRepository.findById(fileId)
                .orElseThrow(() -> new ResourceNotFoundException("File", fileId));
        log.debug("Reference count of {} is now {} (saved {} bytes)",
                fileId, updated.getReferenceCount(), updated.getStorageSaved());
        return updated;
    }
}
