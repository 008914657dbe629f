package com.dedupstore.core.service;

import com.dedupstore.core.config.StorageProperties;
import com.dedupstore.core.dedup.DedupEngine;
import com.dedupstore.core.dedup.FingerprintLocks;
import com.dedupstore.core.exception.NotFoundException;
import com.dedupstore.core.exception.StorageIOException;
import com.dedupstore.core.hash.HashComputer;
import com.dedupstore.core.index.KeywordIndexer;
import com.dedupstore.core.model.DedupDecision;
import com.dedupstore.core.model.DeduplicationStats;
import com.dedupstore.core.model.FileQuery;
import com.dedupstore.core.model.StagedContent;
import com.dedupstore.core.quota.QuotaLedger;
import com.dedupstore.core.storage.BlobStorage;
import com.dedupstore.core.storage.ContentBlobStore;
import com.dedupstore.core.worker.IndexingTaskQueue;
import com.dedupstore.data.entity.ContentBlob;
import com.dedupstore.data.entity.FileRecord;
import com.dedupstore.data.entity.IndexJob;
import com.dedupstore.data.repository.ContentBlobRepository;
import com.dedupstore.data.repository.FileRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for storing and removing user files. Upload and delete run under the content
 * fingerprint lock and commit as a single transaction covering the record, the blob reference
 * count, the quota ledger and the index job.
 */
@Service
@Slf4j
public class FileRegistry {
    
    private final FileRecordRepository fileRecordRepository;
    private final ContentBlobRepository contentBlobRepository;
    private final UploadValidator uploadValidator;
    private final HashComputer hashComputer;
    private final BlobStorage blobStorage;
    private final ContentBlobStore blobStore;
    private final DedupEngine dedupEngine;
    private final FingerprintLocks fingerprintLocks;
    private final QuotaLedger quotaLedger;
    private final KeywordIndexer keywordIndexer;
    private final IndexingTaskQueue taskQueue;
    private final StorageProperties storageProperties;
    private final FileRegistry self;
    
    public FileRegistry(
        FileRecordRepository fileRecordRepository,
        ContentBlobRepository contentBlobRepository,
        UploadValidator uploadValidator,
        HashComputer hashComputer,
        BlobStorage blobStorage,
        ContentBlobStore blobStore,
        DedupEngine dedupEngine,
        FingerprintLocks fingerprintLocks,
        QuotaLedger quotaLedger,
        KeywordIndexer keywordIndexer,
        IndexingTaskQueue taskQueue,
        StorageProperties storageProperties,
        @Lazy FileRegistry self
    ) {
        this.fileRecordRepository = fileRecordRepository;
        this.contentBlobRepository = contentBlobRepository;
        this.uploadValidator = uploadValidator;
        this.hashComputer = hashComputer;
        this.blobStorage = blobStorage;
        this.blobStore = blobStore;
        this.dedupEngine = dedupEngine;
        this.fingerprintLocks = fingerprintLocks;
        this.quotaLedger = quotaLedger;
        this.keywordIndexer = keywordIndexer;
        this.taskQueue = taskQueue;
        this.storageProperties = storageProperties;
        this.self = self;
    }
    
    /**
     * Stores {@code content} for {@code userId}. New content becomes a canonical record and is
     * charged against the quota; content already held becomes a reference record and is not.
     * Indexing is queued and runs later.
     */
    public FileRecord upload(String userId, InputStream content, String filename, String declaredType) {
        long startTime = System.currentTimeMillis();
        uploadValidator.validateUserId(userId);
        uploadValidator.validateFilename(filename);
        String mimeType = uploadValidator.resolveDeclaredType(filename, declaredType);
        
        StagedContent staged = hashComputer.stage(content, blobStorage.stagingDirectory(), storageProperties.getMaxFileSize());
        try {
            uploadValidator.validateSize(staged.getSizeBytes());
            quotaLedger.openLedger(userId);
            
            FileRecord record = commitWithRetry(userId, filename, mimeType, staged);
            log.info("[UPLOAD] File stored | fileId={} | userId={} | filename={} | sizeBytes={} | reference={} | fingerprint={} | durationMs={}",
                record.getId(), userId, filename, record.getSizeBytes(), record.isReference(),
                record.getFingerprint(), System.currentTimeMillis() - startTime);
            return record;
        } finally {
            discardStaged(staged.getPath());
        }
    }
    
    private FileRecord commitWithRetry(String userId, String filename, String mimeType, StagedContent staged) {
        int maxAttempts = storageProperties.getUploadAttempts();
        for (int attempt = 1; ; attempt++) {
            try {
                return fingerprintLocks.withLock(staged.getFingerprint(),
                    () -> self.commitUpload(userId, filename, mimeType, staged));
            } catch (DataIntegrityViolationException e) {
                // Another process claimed the fingerprint between our resolve and insert
                if (attempt >= maxAttempts) {
                    log.error("[UPLOAD] Giving up after fingerprint conflicts | userId={} | fingerprint={} | attempts={}",
                        userId, staged.getFingerprint(), attempt, e);
                    throw e;
                }
                log.warn("[UPLOAD] Fingerprint conflict, retrying | userId={} | fingerprint={} | attempt={}/{}",
                    userId, staged.getFingerprint(), attempt, maxAttempts);
            }
        }
    }
    
    @Transactional
    public FileRecord commitUpload(String userId, String filename, String mimeType, StagedContent staged) {
        String fingerprint = staged.getFingerprint();
        long size = staged.getSizeBytes();
        DedupDecision decision = dedupEngine.resolve(fingerprint);
        
        FileRecord.FileRecordBuilder builder = FileRecord.builder()
            .ownerId(userId)
            .filename(filename)
            .declaredType(mimeType)
            .sizeBytes(size)
            .fingerprint(fingerprint);
        
        FileRecord record;
        if (decision.isNewContent()) {
            quotaLedger.reserve(userId, size, true);
            record = fileRecordRepository.saveAndFlush(builder.reference(false).build());
            blobStore.put(fingerprint, staged.getPath(), size, record.getId());
        } else {
            quotaLedger.reserve(userId, size, false);
            record = fileRecordRepository.saveAndFlush(builder
                .reference(true)
                .canonicalId(decision.getCanonicalId())
                .build());
            blobStore.retain(fingerprint);
        }
        
        taskQueue.enqueueIndex(record.getId(), IndexJob.TRIGGER_UPLOAD);
        return record;
    }
    
    /**
     * Removes a file from the user's view. The shared content survives while any other record
     * still points at it.
     */
    public void delete(String userId, UUID fileId) {
        FileRecord record = fileRecordRepository.findByIdAndOwnerIdAndDeletedAtIsNull(fileId, userId)
            .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
        
        fingerprintLocks.withLock(record.getFingerprint(), () -> {
            self.deleteLocked(userId, fileId);
            return null;
        });
    }
    
    @Transactional
    public void deleteLocked(String userId, UUID fileId) {
        FileRecord record = fileRecordRepository.findByIdForUpdate(fileId)
            .filter(r -> userId.equals(r.getOwnerId()) && !r.isDeleted())
            .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
        String fingerprint = record.getFingerprint();
        
        ContentBlob blob = blobStore.lock(fingerprint)
            .orElseThrow(() -> new IllegalStateException("No content blob for fingerprint " + fingerprint));
        int remainingReferences = blob.getRefCount() - 1;
        // Actual usage is returned only when nothing else still uses the content
        boolean releasesActual = !record.isReference() && remainingReferences == 0;
        
        quotaLedger.release(userId, record.getSizeBytes(), releasesActual);
        keywordIndexer.removeFile(fileId);
        record.setDeletedAt(Instant.now());
        blobStore.release(fingerprint);
        
        log.info("[DELETE] File deleted | fileId={} | userId={} | reference={} | remainingReferences={} | actualReleased={}",
            fileId, userId, record.isReference(), remainingReferences, releasesActual);
    }
    
    @Transactional(readOnly = true)
    public FileRecord getFile(String userId, UUID fileId) {
        return fileRecordRepository.findByIdAndOwnerIdAndDeletedAtIsNull(fileId, userId)
            .orElseThrow(() -> new NotFoundException("File not found: " + fileId));
    }
    
    @Transactional(readOnly = true)
    public Page<FileRecord> listFiles(String userId, FileQuery query, Pageable pageable) {
        return fileRecordRepository.findAll(FileRecordSpecifications.forOwner(userId, query), pageable);
    }
    
    @Transactional(readOnly = true)
    public List<String> fileTypes(String userId) {
        return fileRecordRepository.findDistinctDeclaredTypes(userId);
    }
    
    /**
     * Opens the stored bytes of a file. References resolve through the shared fingerprint, so
     * this works even after the canonical record was deleted. The caller closes the stream.
     */
    public InputStream openContent(String userId, UUID fileId) {
        FileRecord record = getFile(userId, fileId);
        if (blobStore.find(record.getFingerprint()).isEmpty() || !blobStore.exists(record.getFingerprint())) {
            throw new StorageIOException("Content missing for file " + fileId);
        }
        return blobStore.open(record.getFingerprint());
    }
    
    @Transactional(readOnly = true)
    public DeduplicationStats deduplicationStats() {
        long totalFiles = fileRecordRepository.countByDeletedAtIsNull();
        long referenceFiles = fileRecordRepository.countByReferenceAndDeletedAtIsNull(true);
        long logicalBytes = fileRecordRepository.sumLiveSize();
        long storedBytes = contentBlobRepository.sumStoredBytes();
        long savings = Math.max(logicalBytes - storedBytes, 0);
        
        return DeduplicationStats.builder()
            .totalFiles(totalFiles)
            .originalFiles(totalFiles - referenceFiles)
            .referenceFiles(referenceFiles)
            .deduplicationRatio(totalFiles > 0 ? round((double) referenceFiles / totalFiles) : 0.0)
            .totalOriginalStorage(logicalBytes)
            .totalActualStorage(storedBytes)
            .storageSavings(savings)
            .savingsPercentage(logicalBytes > 0 ? round(savings * 100.0 / logicalBytes) : 0.0)
            .build();
    }
    
    private void discardStaged(Path staged) {
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("[UPLOAD] Could not remove staged file {} | error={}", staged, e.getMessage());
        }
    }
    
    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
