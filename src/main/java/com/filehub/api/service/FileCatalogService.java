package com.filehub.api.service;

import com.filehub.api.dto.FileFilter;
import com.filehub.api.dto.StorageSummary;
import com.filehub.api.dto.StoredContent;
import com.filehub.api.exception.InvalidFilterException;
import com.filehub.api.exception.ResourceNotFoundException;
import com.filehub.api.exception.StorageFailureException;
import com.filehub.api.model.FileReference;
import com.filehub.api.model.StoredFile;
import com.filehub.api.repository.FileReferenceRepository;
import com.filehub.api.repository.FileRepository;
import com.filehub.api.repository.FileSpecifications;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.InputStreamResource;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Read side of the store: listings, lookups and downloads. Nothing here is cached,
 * so every read sees the latest committed counters.
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class FileCatalogService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Direction.DESC, "uploadedAt");

    // Public ordering names mapped to entity properties
    private static final Map<String, String> ORDERABLE = Map.of(
            "original_filename", "originalFilename",
            "size", "size",
            "uploaded_at", "uploadedAt");

    private final FileRepository fileRepository;
    private final FileReferenceRepository referenceRepository;
    private final BlobStore blobStore;

    /**
     * Files matching every criterion set on the filter, newest first unless the filter
     * names an ordering.
     *
     * @throws InvalidFilterException when the ordering names an unknown field
     */
    public List<StoredFile> listFiles(FileFilter filter) {
        FileFilter criteria = filter == null ? FileFilter.none() : filter;
        return fileRepository.findAll(FileSpecifications.matching(criteria), sortFor(criteria.getOrdering()));
    }

    static Sort sortFor(String ordering) {
        if (!StringUtils.hasText(ordering)) {
            return NEWEST_FIRST;
        }
        String field = ordering.trim();
        Sort.Direction direction = Sort.Direction.ASC;
        if (field.startsWith("-")) {
            direction = Sort.Direction.DESC;
            field = field.substring(1);
        }
        String property = ORDERABLE.get(field);
        if (property == null) {
            throw new InvalidFilterException("Cannot order by '" + ordering + "'. Use one of "
                    + String.join(", ", new TreeSet<>(ORDERABLE.keySet())) + ", optionally prefixed with '-'.");
        }
        // Newest first breaks ties
        return property.equals("uploadedAt")
                ? Sort.by(direction, property)
                : Sort.by(direction, property).and(NEWEST_FIRST);
    }

    public StoredFile getFile(String id) {
        return fileRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("File", id));
    }

    public List<FileReference> listReferences(String originalFileId) {
        if (StringUtils.hasText(originalFileId)) {
            return referenceRepository.findByOriginalFileIdOrderByCreatedAtDesc(originalFileId);
        }
        return referenceRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Opens the bytes behind a file id, or behind a reference id (served under the
     * reference's name).
     */
    public StoredContent openContent(String id) {
        Optional<StoredFile> file = fileRepository.findById(id);
        String servedName;
        StoredFile owner;
        if (file.isPresent()) {
            owner = file.get();
            servedName = owner.getOriginalFilename();
        } else {
            FileReference reference = referenceRepository.findById(id)
                    .orElseThrow(() -> new ResourceNotFoundException("File", id));
            owner = reference.getOriginalFile();
            servedName = reference.getReferenceName();
        }

        try {
            return new StoredContent(servedName, owner.getFileType(), owner.getSize(),
                    new InputStreamResource(blobStore.openStream(owner.getStorageKey())));
        } catch (IOException e) {
            throw new StorageFailureException("Content of " + id + " is unavailable", e);
        }
    }

    public StorageSummary summary() {
        return new StorageSummary(
                fileRepository.count(),
                referenceRepository.count(),
                fileRepository.sumSize(),
                fileRepository.sumStorageSaved());
    }
}
