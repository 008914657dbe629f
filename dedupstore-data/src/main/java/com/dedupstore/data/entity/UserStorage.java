package com.dedupstore.data.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "user_storage")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserStorage {
    
    @Id
    @Column(name = "user_id")
    private String userId;
    
    // Bytes charged against the quota
    @Column(name = "actual_used", nullable = false)
    @Builder.Default
    private long actualUsed = 0;
    
    // Bytes the user would occupy without deduplication
    @Column(name = "logical_used", nullable = false)
    @Builder.Default
    private long logicalUsed = 0;
    
    @Version
    @Column(name = "version")
    private Long version;
    
    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
