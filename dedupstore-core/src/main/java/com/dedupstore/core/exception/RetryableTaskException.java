package com.dedupstore.core.exception;

/**
 * Indexing failure that may succeed on a later attempt.
 */
public class RetryableTaskException extends DedupStoreException {
    
    public RetryableTaskException(String message) {
        super(message);
    }
    
    public RetryableTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
