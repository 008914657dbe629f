package com.dedupstore.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.UUID;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class DedupDecision {
    
    private final boolean newContent;
    private final UUID canonicalId;
    
    public static DedupDecision newContent() {
        return new DedupDecision(true, null);
    }
    
    public static DedupDecision existingCanonical(UUID canonicalId) {
        return new DedupDecision(false, canonicalId);
    }
}
