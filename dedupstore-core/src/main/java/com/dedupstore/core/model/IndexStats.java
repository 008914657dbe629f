package com.dedupstore.core.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class IndexStats {
    private long totalKeywords;
    private String mostCommonKeyword;
    private long mostCommonKeywordCount;
}
