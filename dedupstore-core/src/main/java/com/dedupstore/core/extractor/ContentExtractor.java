package com.dedupstore.core.extractor;

import java.util.Set;

/**
 * Turns stored bytes into indexable text. Implementations throw
 * {@link com.dedupstore.core.exception.ExtractionException} for content they cannot parse.
 */
public interface ContentExtractor {
    
    /**
     * Normalized mime types this extractor handles.
     */
    Set<String> supportedTypes();
    
    String extract(byte[] content, String mimeType);
}
