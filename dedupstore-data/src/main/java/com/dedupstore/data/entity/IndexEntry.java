package com.dedupstore.data.entity;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

/**
 * Edge of the inverted index between a file record and a keyword.
 */
@Entity
@Table(name = "index_entries",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_index_entry_file_keyword", columnNames = {"file_id", "keyword_id"})
    },
    indexes = {
        @Index(name = "idx_index_entry_keyword", columnList = "keyword_id")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndexEntry {
    
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;
    
    @Column(name = "file_id", nullable = false)
    private UUID fileId;
    
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "keyword_id", nullable = false)
    private Keyword keyword;
}
