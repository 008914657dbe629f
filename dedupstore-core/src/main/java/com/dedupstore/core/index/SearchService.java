package com.dedupstore.core.index;

import com.dedupstore.core.model.IndexStats;
import com.dedupstore.data.entity.FileRecord;
import com.dedupstore.data.projection.KeywordCount;
import com.dedupstore.data.repository.FileRecordRepository;
import com.dedupstore.data.repository.IndexEntryRepository;
import com.dedupstore.data.repository.KeywordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class SearchService {
    
    private final FileRecordRepository fileRecordRepository;
    private final KeywordRepository keywordRepository;
    private final IndexEntryRepository indexEntryRepository;
    private final KeywordTokenizer tokenizer;
    
    /**
     * Files of {@code userId} matching any of the terms, newest first.
     */
    @Transactional(readOnly = true)
    public List<FileRecord> search(String userId, Collection<String> terms) {
        long startTime = System.currentTimeMillis();
        Set<String> keywords = tokenizer.normalizeQuery(terms);
        if (keywords.isEmpty()) {
            log.debug("[SEARCH] No usable terms after normalization | userId={} | terms={}", userId, terms);
            return List.of();
        }
        
        List<FileRecord> results = fileRecordRepository.searchByKeywords(userId, keywords);
        log.info("[SEARCH] Search completed | userId={} | keywords={} | results={} | durationMs={}",
            userId, keywords, results.size(), System.currentTimeMillis() - startTime);
        return results;
    }
    
    @Transactional(readOnly = true)
    public IndexStats indexStats() {
        long totalKeywords = keywordRepository.count();
        List<KeywordCount> top = indexEntryRepository.findTopKeywords(PageRequest.of(0, 1));
        
        IndexStats.IndexStatsBuilder stats = IndexStats.builder().totalKeywords(totalKeywords);
        if (!top.isEmpty()) {
            stats.mostCommonKeyword(top.get(0).keyword())
                .mostCommonKeywordCount(top.get(0).fileCount());
        }
        return stats.build();
    }
}
