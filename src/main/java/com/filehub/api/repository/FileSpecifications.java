package com.filehub.api.repository;

import com.filehub.api.dto.FileFilter;
import com.filehub.api.model.StoredFile;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class FileSpecifications {

    private FileSpecifications() {
    }

    public static Specification<StoredFile> matching(FileFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();

            if (StringUtils.hasText(filter.getFilename())) {
                String pattern = "%" + filter.getFilename().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.like(cb.lower(root.<String>get("originalFilename")), pattern));
            }
            if (StringUtils.hasText(filter.getSearch())) {
                String pattern = "%" + filter.getSearch().toLowerCase(Locale.ROOT) + "%";
                predicates.add(cb.or(
                        cb.like(cb.lower(root.<String>get("originalFilename")), pattern),
                        cb.like(cb.lower(root.<String>get("fileType")), pattern)));
            }
            if (StringUtils.hasText(filter.getFileType())) {
                predicates.add(cb.equal(cb.lower(root.<String>get("fileType")), filter.getFileType().toLowerCase(Locale.ROOT)));
            }
            if (filter.getMinSize() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<Long>get("size"), filter.getMinSize()));
            }
            if (filter.getMaxSize() != null) {
                predicates.add(cb.lessThanOrEqualTo(root.<Long>get("size"), filter.getMaxSize()));
            }
            // Date bounds are inclusive whole days
            if (filter.getUploadedAfter() != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.<LocalDateTime>get("uploadedAt"), filter.getUploadedAfter().atStartOfDay()));
            }
            if (filter.getUploadedBefore() != null) {
                predicates.add(cb.lessThan(root.<LocalDateTime>get("uploadedAt"), filter.getUploadedBefore().plusDays(1).atStartOfDay()));
            }

            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
