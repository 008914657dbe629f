package com.dedupstore.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "index_jobs", indexes = {
    @Index(name = "idx_index_job_status", columnList = "status, next_attempt_at"),
    @Index(name = "idx_index_job_file", columnList = "file_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndexJob {
    
    public static final String QUEUED = "QUEUED";
    public static final String PROCESSING = "PROCESSING";
    public static final String COMPLETED = "COMPLETED";
    public static final String FAILED = "FAILED";
    
    public static final String TRIGGER_UPLOAD = "UPLOAD";
    public static final String TRIGGER_REINDEX = "REINDEX";
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;
    
    @Column(name = "file_id", nullable = false)
    private UUID fileId;
    
    @Column(name = "trigger_type", nullable = false, length = 20)
    @Builder.Default
    private String trigger = TRIGGER_UPLOAD;
    
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private String status = QUEUED;
    
    @Column(name = "priority")
    @Builder.Default
    private Integer priority = 5;
    
    @Column(name = "attempts")
    @Builder.Default
    private Integer attempts = 0;
    
    @Column(name = "max_attempts")
    @Builder.Default
    private Integer maxAttempts = 3;
    
    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;
    
    @Column(name = "locked_by")
    private String lockedBy;
    
    @Column(name = "locked_until")
    private Instant lockedUntil;
    
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;
    
    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
    
    @Column(name = "started_at")
    private Instant startedAt;
    
    @Column(name = "completed_at")
    private Instant completedAt;
}
