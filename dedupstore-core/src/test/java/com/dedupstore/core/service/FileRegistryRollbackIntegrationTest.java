package com.dedupstore.core.service;

import com.dedupstore.core.IntegrationTestSupport;
import com.dedupstore.core.exception.StorageIOException;
import com.dedupstore.core.hash.HashComputer;
import com.dedupstore.core.storage.BlobStorage;
import com.dedupstore.core.worker.IndexingTaskQueue;
import com.dedupstore.data.entity.FileRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;

/**
 * Failures after the content was committed must undo the whole upload.
 */
class FileRegistryRollbackIntegrationTest extends IntegrationTestSupport {
    
    @SpyBean
    private IndexingTaskQueue taskQueue;
    
    @Autowired
    private BlobStorage blobStorage;
    
    @Autowired
    private HashComputer hashComputer;
    
    @Test
    void failureAfterNewContentIsWrittenLeavesNoTrace() throws Exception {
        byte[] content = "content that never makes it".getBytes(StandardCharsets.UTF_8);
        String fingerprint = hashComputer.fingerprint(content);
        doThrow(new StorageIOException("Index queue unavailable"))
            .when(taskQueue).enqueueIndex(any(UUID.class), anyString());
        
        assertThatThrownBy(() -> upload("alice", "lost.txt", "text/plain", content))
            .isInstanceOf(StorageIOException.class);
        
        assertThat(contentBlobRepository.count()).isZero();
        assertThat(fileRecordRepository.count()).isZero();
        assertThat(indexJobRepository.count()).isZero();
        assertThat(actualUsed("alice")).isZero();
        assertThat(logicalUsed("alice")).isZero();
        assertThat(blobStorage.exists(fingerprint)).isFalse();
        try (Stream<Path> staged = Files.list(blobStorage.stagingDirectory())) {
            assertThat(staged).isEmpty();
        }
    }
    
    @Test
    void failedReferenceUploadKeepsSharedContentIntact() {
        byte[] content = "shared content survives".getBytes(StandardCharsets.UTF_8);
        FileRecord canonical = upload("alice", "shared.txt", "text/plain", content);
        doThrow(new StorageIOException("Index queue unavailable"))
            .when(taskQueue).enqueueIndex(any(UUID.class), anyString());
        
        assertThatThrownBy(() -> upload("bob", "copy.txt", "text/plain", content))
            .isInstanceOf(StorageIOException.class);
        
        assertThat(fileRecordRepository.count()).isEqualTo(1);
        assertThat(contentBlobRepository.findById(canonical.getFingerprint()).orElseThrow().getRefCount()).isEqualTo(1);
        assertThat(actualUsed("bob")).isZero();
        assertThat(logicalUsed("bob")).isZero();
        assertThat(actualUsed("alice")).isEqualTo(content.length);
        assertThat(blobStorage.exists(canonical.getFingerprint())).isTrue();
    }
}
