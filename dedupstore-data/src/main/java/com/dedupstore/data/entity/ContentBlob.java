package com.dedupstore.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * Physical content for one fingerprint. Owned by its reference count, not by any single
 * {@link FileRecord}.
 */
@Entity
@Table(name = "content_blobs")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContentBlob {
    
    @Id
    @Column(name = "fingerprint", length = 64)
    private String fingerprint;
    
    @Column(name = "size_bytes", nullable = false)
    private Long sizeBytes;
    
    @Column(name = "storage_key", nullable = false)
    private String storageKey;
    
    @Column(name = "ref_count", nullable = false)
    private int refCount;
    
    // Record that introduced the content; may be tombstoned while references remain
    @Column(name = "canonical_file_id", nullable = false)
    private UUID canonicalFileId;
    
    // Null until persisted, so save() inserts and a concurrent claim surfaces as a key conflict
    @Version
    @Column(name = "version")
    private Long version;
    
    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
