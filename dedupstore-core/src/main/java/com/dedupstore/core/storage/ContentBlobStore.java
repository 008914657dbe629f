package com.dedupstore.core.storage;

import com.dedupstore.core.exception.StorageIOException;
import com.dedupstore.data.entity.ContentBlob;
import com.dedupstore.data.repository.ContentBlobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.io.InputStream;
import java.nio.file.Path;
import java.util.Optional;
import java.util.UUID;

/**
 * Reference-counted content blobs. The {@code content_blobs} row is the source of truth for
 * whether a fingerprint exists; physical bytes follow it, written inside the claiming
 * transaction and removed only after the transaction that drops the last reference commits.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentBlobStore {
    
    private final ContentBlobRepository blobRepository;
    private final BlobStorage blobStorage;
    
    /**
     * Locks the blob row for the rest of the current transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<ContentBlob> lock(String fingerprint) {
        return blobRepository.findForUpdate(fingerprint);
    }
    
    @Transactional(readOnly = true)
    public Optional<ContentBlob> find(String fingerprint) {
        return blobRepository.findById(fingerprint);
    }
    
    /**
     * Claims {@code fingerprint} for new content with a reference count of one. A concurrent
     * claim fails with a {@link org.springframework.dao.DataIntegrityViolationException}
     * from the row insert before any bytes are touched.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ContentBlob put(String fingerprint, Path stagedFile, long sizeBytes, UUID canonicalFileId) {
        ContentBlob blob = blobRepository.saveAndFlush(ContentBlob.builder()
            .fingerprint(fingerprint)
            .sizeBytes(sizeBytes)
            .storageKey(blobStorage.storageKey(fingerprint))
            .refCount(1)
            .canonicalFileId(canonicalFileId)
            .build());
        
        boolean created = blobStorage.commit(fingerprint, stagedFile);
        if (created) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCompletion(int status) {
                    if (status != STATUS_COMMITTED) {
                        log.warn("[UPLOAD] Transaction rolled back, removing written blob | fingerprint={}", fingerprint);
                        deletePhysical(fingerprint);
                    }
                }
            });
        }
        return blob;
    }
    
    @Transactional(propagation = Propagation.MANDATORY)
    public ContentBlob retain(String fingerprint) {
        ContentBlob blob = blobRepository.findForUpdate(fingerprint)
            .orElseThrow(() -> new IllegalStateException("No content blob for fingerprint " + fingerprint));
        blob.setRefCount(blob.getRefCount() + 1);
        return blob;
    }
    
    /**
     * Drops one reference. At zero the row is deleted and the bytes are removed once the
     * transaction commits.
     *
     * @return the remaining reference count
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int release(String fingerprint) {
        Optional<ContentBlob> locked = blobRepository.findForUpdate(fingerprint);
        if (locked.isEmpty()) {
            log.warn("[DELETE] Release of unknown blob ignored | fingerprint={}", fingerprint);
            return 0;
        }
        
        ContentBlob blob = locked.get();
        int remaining = Math.max(blob.getRefCount() - 1, 0);
        if (remaining > 0) {
            blob.setRefCount(remaining);
            return remaining;
        }
        
        blobRepository.delete(blob);
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                deletePhysical(fingerprint);
            }
        });
        log.info("[DELETE] Last reference released | fingerprint={}", fingerprint);
        return 0;
    }
    
    public InputStream open(String fingerprint) {
        return blobStorage.open(fingerprint);
    }
    
    public boolean exists(String fingerprint) {
        return blobStorage.exists(fingerprint);
    }
    
    private void deletePhysical(String fingerprint) {
        try {
            blobStorage.delete(fingerprint);
        } catch (StorageIOException e) {
            // Row is already gone; the orphaned bytes are unreachable and safe to leave
            log.error("Failed to remove blob bytes | fingerprint={} | error={}", fingerprint, e.getMessage(), e);
        }
    }
}
