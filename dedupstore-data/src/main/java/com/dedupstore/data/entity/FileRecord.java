package com.dedupstore.data.entity;

import com.dedupstore.common.constants.IndexStatus;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * A user's view of one stored file. Several records may share the same content; exactly one
 * of them (the canonical record) has {@code reference == false}, the others link to it.
 */
@Entity
@Table(name = "file_records", indexes = {
    @Index(name = "idx_file_owner_created", columnList = "owner_id, created_at"),
    @Index(name = "idx_file_owner_type", columnList = "owner_id, declared_type"),
    @Index(name = "idx_file_fingerprint_ref", columnList = "fingerprint, is_reference")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class FileRecord {
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;
    
    @Column(name = "owner_id", nullable = false)
    private String ownerId;
    
    @Column(name = "filename", nullable = false)
    private String filename;
    
    @Column(name = "declared_type", nullable = false, length = 100)
    private String declaredType;
    
    @Column(name = "size_bytes", nullable = false)
    private Long sizeBytes;
    
    @Column(name = "fingerprint", nullable = false, length = 64)
    private String fingerprint;
    
    @Column(name = "is_reference", nullable = false)
    private boolean reference;
    
    @Column(name = "canonical_id")
    private UUID canonicalId;
    
    @Enumerated(EnumType.STRING)
    @Column(name = "index_status", nullable = false, length = 20)
    @Builder.Default
    private IndexStatus indexStatus = IndexStatus.PENDING;
    
    @Column(name = "index_error", columnDefinition = "TEXT")
    private String indexError;
    
    @Column(name = "indexed_at")
    private Instant indexedAt;
    
    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
    
    @Column(name = "deleted_at")
    private Instant deletedAt;
    
    public boolean isDeleted() {
        return deletedAt != null;
    }
}
