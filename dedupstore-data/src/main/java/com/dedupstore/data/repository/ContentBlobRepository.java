package com.dedupstore.data.repository;

import com.dedupstore.data.entity.ContentBlob;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContentBlobRepository extends JpaRepository<ContentBlob, String> {
    
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM ContentBlob b WHERE b.fingerprint = :fingerprint")
    Optional<ContentBlob> findForUpdate(@Param("fingerprint") String fingerprint);
    
    @Query("SELECT COALESCE(SUM(b.sizeBytes), 0) FROM ContentBlob b")
    Long sumStoredBytes();
}
