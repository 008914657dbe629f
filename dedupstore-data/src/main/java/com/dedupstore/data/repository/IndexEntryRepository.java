package com.dedupstore.data.repository;

import com.dedupstore.data.entity.IndexEntry;
import com.dedupstore.data.projection.KeywordCount;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface IndexEntryRepository extends JpaRepository<IndexEntry, UUID> {
    
    @Query("SELECT k.keyword FROM IndexEntry e JOIN e.keyword k WHERE e.fileId = :fileId ORDER BY k.keyword")
    List<String> findKeywordsByFileId(@Param("fileId") UUID fileId);
    
    // Caller owns the transaction
    @Modifying
    @Query("DELETE FROM IndexEntry e WHERE e.fileId = :fileId")
    int deleteByFileId(@Param("fileId") UUID fileId);
    
    @Query("""
        SELECT new com.dedupstore.data.projection.KeywordCount(k.keyword, COUNT(e.id))
        FROM IndexEntry e JOIN e.keyword k
        GROUP BY k.keyword
        ORDER BY COUNT(e.id) DESC, k.keyword ASC
        """)
    List<KeywordCount> findTopKeywords(Pageable pageable);
}
