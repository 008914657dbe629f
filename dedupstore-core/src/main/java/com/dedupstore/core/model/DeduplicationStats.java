package com.dedupstore.core.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DeduplicationStats {
    private long totalFiles;
    private long originalFiles;
    private long referenceFiles;
    private double deduplicationRatio;
    private long totalOriginalStorage; // sum of live record sizes
    private long totalActualStorage; // bytes held by content blobs
    private long storageSavings;
    private double savingsPercentage;
}
