package com.dedupstore.core.storage;

import java.io.InputStream;
import java.nio.file.Path;

/**
 * Physical byte storage addressed by fingerprint. Implementations wrap I/O failures in
 * {@link com.dedupstore.core.exception.StorageIOException}.
 */
public interface BlobStorage {
    
    Path stagingDirectory();
    
    /**
     * Makes the staged file the content for {@code fingerprint}.
     *
     * @return true if this call created the content, false if it was already present
     */
    boolean commit(String fingerprint, Path stagedFile);
    
    InputStream open(String fingerprint);
    
    boolean delete(String fingerprint);
    
    boolean exists(String fingerprint);
    
    String storageKey(String fingerprint);
}
