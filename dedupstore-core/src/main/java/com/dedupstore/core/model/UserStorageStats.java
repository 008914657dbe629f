package com.dedupstore.core.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class UserStorageStats {
    private String userId;
    private long actualUsed; // stored bytes introduced by this user, charged against the quota
    private long logicalUsed; // sum of the sizes of the user's live files
    private long storageSavings;
    private double savingsPercentage;
    private long quotaLimit;
    private long quotaRemaining;
    private double quotaUsagePercentage;
}
