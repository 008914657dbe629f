package com.dedupstore.core.exception;

/**
 * The requested file does not exist or is not visible to the caller.
 */
public class NotFoundException extends DedupStoreException {
    
    public NotFoundException(String message) {
        super(message);
    }
    
    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
