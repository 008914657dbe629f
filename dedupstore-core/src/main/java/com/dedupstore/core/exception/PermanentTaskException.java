package com.dedupstore.core.exception;

/**
 * Indexing failure that retrying cannot fix.
 */
public class PermanentTaskException extends DedupStoreException {
    
    public PermanentTaskException(String message) {
        super(message);
    }
    
    public PermanentTaskException(String message, Throwable cause) {
        super(message, cause);
    }
}
