package com.dedupstore.core.model;

import com.dedupstore.common.constants.IndexStatus;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class IndexResult {
    private UUID fileId;
    private IndexStatus status;
    private int keywordCount;
}
