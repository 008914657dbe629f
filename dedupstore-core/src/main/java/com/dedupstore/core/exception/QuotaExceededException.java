package com.dedupstore.core.exception;

import lombok.Getter;

@Getter
public class QuotaExceededException extends DedupStoreException {
    
    private final String userId;
    private final long requestedBytes;
    private final long usedBytes;
    private final long quotaBytes;
    
    public QuotaExceededException(String message, String userId, long requestedBytes, long usedBytes, long quotaBytes) {
        super(message);
        this.userId = userId;
        this.requestedBytes = requestedBytes;
        this.usedBytes = usedBytes;
        this.quotaBytes = quotaBytes;
    }
}
