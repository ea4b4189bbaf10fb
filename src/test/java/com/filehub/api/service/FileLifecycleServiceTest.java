package com.filehub.api.service;

import com.filehub.api.dto.UploadResult;
import com.filehub.api.exception.ReferencesExistException;
import com.filehub.api.exception.ResourceNotFoundException;
import com.filehub.api.model.FileReference;
import com.filehub.api.model.StoredFile;
import com.filehub.api.repository.FileReferenceRepository;
import com.filehub.api.repository.FileRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.io.ByteArrayResource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

@SpringBootTest
class FileLifecycleServiceTest {

    @Autowired
    private DeduplicationService deduplicationService;

    @Autowired
    private FileLifecycleService lifecycleService;

    @Autowired
    private FileRepository fileRepository;

    @Autowired
    private FileReferenceRepository referenceRepository;

    @BeforeEach
    void clean() {
        referenceRepository.deleteAllInBatch();
        fileRepository.deleteAllInBatch();
    }

    @Test
    void refusesToDeleteReferencedFileAndChangesNothing() {
        StoredFile original = upload("report", "report.pdf").getFile();
        upload("report", "report-copy.pdf");
        upload("report", "report-final.pdf");

        ReferencesExistException conflict = assertThrows(ReferencesExistException.class,
                () -> lifecycleService.deleteFile(original.getId()));

        assertEquals(2, conflict.getReferenceCount());
        assertEquals(1, fileRepository.count());
        assertEquals(2, referenceRepository.count());
        StoredFile unchanged = fileRepository.findById(original.getId()).orElseThrow();
        assertEquals(3, unchanged.getReferenceCount());
        assertEquals(12, unchanged.getStorageSaved());
    }

    @Test
    void deletesFileOnceAllReferencesAreGone() {
        StoredFile original = upload("report", "report.pdf").getFile();
        upload("report", "report-copy.pdf");

        for (FileReference reference : referenceRepository.findByOriginalFileIdOrderByCreatedAtDesc(original.getId())) {
            lifecycleService.deleteReference(reference.getId());
        }
        assertEquals(1, fileRepository.findById(original.getId()).orElseThrow().getReferenceCount());

        lifecycleService.deleteFile(original.getId());

        assertFalse(fileRepository.existsById(original.getId()));
    }

    @Test
    void deletingSameReferenceTwiceDecrementsOnce() {
        StoredFile original = upload("data", "data.csv").getFile();
        String first = upload("data", "data-1.csv").getReference().getId();
        upload("data", "data-2.csv");

        lifecycleService.deleteReference(first);
        assertThrows(ResourceNotFoundException.class, () -> lifecycleService.deleteReference(first));

        StoredFile file = fileRepository.findById(original.getId()).orElseThrow();
        assertEquals(2, file.getReferenceCount());
        assertEquals(4, file.getStorageSaved());
    }

    @Test
    void unknownIdsAreReportedAsNotFound() {
        assertThrows(ResourceNotFoundException.class, () -> lifecycleService.deleteFile("missing"));
        assertThrows(ResourceNotFoundException.class, () -> lifecycleService.deleteReference("missing"));
    }

    private UploadResult upload(String content, String name) {
        byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
        return deduplicationService.submit(new ByteArrayResource(bytes), name, "application/octet-stream", bytes.length);
    }
}
