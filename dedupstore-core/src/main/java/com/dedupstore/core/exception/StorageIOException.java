package com.dedupstore.core.exception;

import java.io.IOException;

/**
 * Physical read or write of blob content failed. Thrown inside the upload transaction it
 * rolls back the reservation and any bytes written by that transaction.
 */
public class StorageIOException extends DedupStoreException {
    
    public StorageIOException(String message, IOException cause) {
        super(message, cause);
    }
    
    public StorageIOException(String message) {
        super(message);
    }
}
