package com.dedupstore.core.extractor.impl;

import com.dedupstore.core.extractor.ContentExtractor;

import java.util.Set;

/**
 * Fallback for types without an extractor. Not a bean; the registry hands it out for
 * unknown types.
 */
public class NoOpExtractor implements ContentExtractor {
    
    @Override
    public Set<String> supportedTypes() {
        return Set.of();
    }
    
    @Override
    public String extract(byte[] content, String mimeType) {
        return "";
    }
}
