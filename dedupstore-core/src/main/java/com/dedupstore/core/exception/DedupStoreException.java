package com.dedupstore.core.exception;

/**
 * Base class of every error the storage core reports to its callers.
 */
public class DedupStoreException extends RuntimeException {
    
    public DedupStoreException(String message) {
        super(message);
    }
    
    public DedupStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
