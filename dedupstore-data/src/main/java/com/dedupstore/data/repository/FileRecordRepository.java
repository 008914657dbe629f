package com.dedupstore.data.repository;

import com.dedupstore.common.constants.IndexStatus;
import com.dedupstore.data.entity.FileRecord;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FileRecordRepository extends JpaRepository<FileRecord, UUID>, JpaSpecificationExecutor<FileRecord> {
    
    Optional<FileRecord> findByIdAndOwnerIdAndDeletedAtIsNull(UUID id, String ownerId);
    
    long countByDeletedAtIsNull();
    
    long countByReferenceAndDeletedAtIsNull(boolean reference);
    
    /**
     * Locks the record row so that indexing and deletion of the same file serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT f FROM FileRecord f WHERE f.id = :id")
    Optional<FileRecord> findByIdForUpdate(@Param("id") UUID id);
    
    @Query("""
        SELECT DISTINCT f.declaredType FROM FileRecord f
        WHERE f.ownerId = :ownerId AND f.deletedAt IS NULL
        ORDER BY f.declaredType
        """)
    List<String> findDistinctDeclaredTypes(@Param("ownerId") String ownerId);
    
    @Query("SELECT f.id FROM FileRecord f WHERE f.deletedAt IS NULL ORDER BY f.createdAt ASC")
    List<UUID> findLiveIds();
    
    @Query("SELECT COALESCE(SUM(f.sizeBytes), 0) FROM FileRecord f WHERE f.deletedAt IS NULL")
    Long sumLiveSize();
    
    /**
     * Live records of one owner that carry at least one of the given keywords, newest first.
     * Scoping is on the record owner, never on the shared content.
     */
    @Query("""
        SELECT f FROM FileRecord f
        WHERE f.ownerId = :ownerId
          AND f.deletedAt IS NULL
          AND f.id IN (
              SELECT e.fileId FROM IndexEntry e JOIN e.keyword k
              WHERE k.keyword IN :keywords
          )
        ORDER BY f.createdAt DESC
        """)
    List<FileRecord> searchByKeywords(
        @Param("ownerId") String ownerId,
        @Param("keywords") Collection<String> keywords
    );
    
    @Modifying
    @Transactional
    @Query("""
        UPDATE FileRecord f
        SET f.indexStatus = :status,
            f.indexError = :error,
            f.indexedAt = :indexedAt
        WHERE f.id = :id AND f.deletedAt IS NULL
        """)
    int updateIndexStatus(
        @Param("id") UUID id,
        @Param("status") IndexStatus status,
        @Param("error") String error,
        @Param("indexedAt") Instant indexedAt
    );
}
