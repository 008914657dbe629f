package com.dedupstore.data.repository;

import com.dedupstore.data.entity.Keyword;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface KeywordRepository extends JpaRepository<Keyword, UUID> {
    
    Optional<Keyword> findByKeyword(String keyword);
    
    List<Keyword> findByKeywordIn(Collection<String> keywords);
}
