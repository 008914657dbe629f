package com.dedupstore.data.repository;

import com.dedupstore.data.entity.IndexJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface IndexJobRepository extends JpaRepository<IndexJob, UUID> {
    
    List<IndexJob> findByFileIdOrderByCreatedAtAsc(UUID fileId);
    
    long countByStatus(String status);
    
    @Query("""
        SELECT j FROM IndexJob j
        WHERE j.status = 'QUEUED'
          AND (j.nextAttemptAt IS NULL OR j.nextAttemptAt <= :now)
        ORDER BY j.priority ASC, j.createdAt ASC
        """)
    List<IndexJob> findDueJobs(@Param("now") Instant now, Pageable pageable);
    
    /**
     * Compare-and-set claim: only succeeds (returns 1) while the job is still QUEUED.
     */
    @Modifying
    @Transactional
    @Query("""
        UPDATE IndexJob j
        SET j.status = 'PROCESSING',
            j.lockedBy = :workerId,
            j.lockedUntil = :lockedUntil,
            j.startedAt = :now,
            j.attempts = j.attempts + 1
        WHERE j.id = :id AND j.status = 'QUEUED'
        """)
    int claim(
        @Param("id") UUID id,
        @Param("workerId") String workerId,
        @Param("now") Instant now,
        @Param("lockedUntil") Instant lockedUntil
    );
    
    @Modifying
    @Transactional
    @Query("""
        UPDATE IndexJob j
        SET j.status = 'COMPLETED',
            j.completedAt = :now,
            j.lastError = NULL,
            j.lockedBy = NULL,
            j.lockedUntil = NULL
        WHERE j.id = :id
        """)
    int markCompleted(@Param("id") UUID id, @Param("now") Instant now);
    
    @Modifying
    @Transactional
    @Query("""
        UPDATE IndexJob j
        SET j.status = 'QUEUED',
            j.lastError = :error,
            j.nextAttemptAt = :nextAttemptAt,
            j.lockedBy = NULL,
            j.lockedUntil = NULL
        WHERE j.id = :id
        """)
    int requeue(
        @Param("id") UUID id,
        @Param("error") String error,
        @Param("nextAttemptAt") Instant nextAttemptAt
    );
    
    @Modifying
    @Transactional
    @Query("""
        UPDATE IndexJob j
        SET j.status = 'FAILED',
            j.lastError = :error,
            j.completedAt = :now,
            j.lockedBy = NULL,
            j.lockedUntil = NULL
        WHERE j.id = :id
        """)
    int markFailed(@Param("id") UUID id, @Param("error") String error, @Param("now") Instant now);
    
    /**
     * Returns jobs whose worker lease expired (crash or restart) to the queue.
     */
    @Modifying
    @Transactional
    @Query("""
        UPDATE IndexJob j
        SET j.status = 'QUEUED',
            j.lockedBy = NULL,
            j.lockedUntil = NULL
        WHERE j.status = 'PROCESSING' AND j.lockedUntil < :now
        """)
    int recoverExpiredLeases(@Param("now") Instant now);
}
