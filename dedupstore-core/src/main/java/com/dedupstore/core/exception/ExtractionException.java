package com.dedupstore.core.exception;

/**
 * Content could not be turned into text. Confined to indexing.
 */
public class ExtractionException extends DedupStoreException {
    
    public ExtractionException(String message) {
        super(message);
    }
    
    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
