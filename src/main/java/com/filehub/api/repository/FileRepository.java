package com.filehub.api.repository;

import com.filehub.api.model.StoredFile;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface FileRepository extends JpaRepository<StoredFile, String>, JpaSpecificationExecutor<StoredFile> {

    Optional<StoredFile> findByContentHash(String contentHash);

    boolean existsByStorageKey(String storageKey);

    List<StoredFile> findByContentHashIsNull();

    /** Row-level exclusive lock, held until the surrounding transaction ends. */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM StoredFile f WHERE f.id = :id")
    Optional<StoredFile> findByIdForUpdate(@Param("id") String id);

    /**
     * Adds {@code delta} to the reference count, floored at 1, and recomputes storage saved
     * from the same pre-update count in one statement. Returns the number of rows touched.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE StoredFile f
        SET f.referenceCount = CASE
                WHEN f.referenceCount + :delta < 1 THEN 1
                ELSE f.referenceCount + :delta
            END,
            f.storageSaved = CASE
                WHEN f.referenceCount + :delta > 1 THEN f.size * (f.referenceCount + :delta - 1)
                ELSE 0
            END
        WHERE f.id = :id
    """)
    int applyReferenceDelta(@Param("id") String id, @Param("delta") int delta);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE StoredFile f SET f.contentHash = :hash WHERE f.id = :id AND f.contentHash IS NULL")
    int backfillContentHash(@Param("id") String id, @Param("hash") String hash);

    @Query("SELECT COALESCE(SUM(f.storageSaved), 0) FROM StoredFile f")
    long sumStorageSaved();

    @Query("SELECT COALESCE(SUM(f.size), 0) FROM StoredFile f")
    long sumSize();
}
