package com.filehub.api.repository;

import com.filehub.api.model.FileReference;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FileReferenceRepository extends JpaRepository<FileReference, String> {

    boolean existsByReferenceName(String referenceName);

    long countByOriginalFileId(String originalFileId);

    List<FileReference> findAllByOrderByCreatedAtDesc();

    List<FileReference> findByOriginalFileIdOrderByCreatedAtDesc(String originalFileId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM FileReference r WHERE r.id = :id")
    int deleteByIdReturningCount(@Param("id") String id);
}
