package com.dedupstore.core.exception;

/**
 * Malformed upload input (filename, type, size or user id).
 */
public class ValidationException extends DedupStoreException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
