package com.dedupstore.core.storage;

import com.dedupstore.core.config.StorageProperties;
import com.dedupstore.core.exception.StorageIOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalBlobStorageTest {
    
    private static final String FINGERPRINT = "b94d27b9934d3e08a52e52d7da7dabfac484efe37a5380ee9088f7ace2efcde9";
    
    @TempDir
    Path root;
    
    private LocalBlobStorage storage;
    
    @BeforeEach
    void setUp() {
        StorageProperties properties = new StorageProperties();
        properties.setDirectory(root.toString());
        storage = new LocalBlobStorage(properties);
        storage.init();
    }
    
    @Test
    void commitPlacesContentUnderShardedPath() throws Exception {
        Path staged = stage("hello world");
        
        assertThat(storage.commit(FINGERPRINT, staged)).isTrue();
        
        assertThat(storage.storageKey(FINGERPRINT)).isEqualTo("b9/4d/" + FINGERPRINT);
        assertThat(root.resolve("blobs/b9/4d/" + FINGERPRINT)).exists();
        try (InputStream in = storage.open(FINGERPRINT)) {
            assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8)).isEqualTo("hello world");
        }
    }
    
    @Test
    void secondCommitOfSameFingerprintIsNotACreation() throws Exception {
        assertThat(storage.commit(FINGERPRINT, stage("hello world"))).isTrue();
        assertThat(storage.commit(FINGERPRINT, stage("hello world"))).isFalse();
        assertThat(storage.exists(FINGERPRINT)).isTrue();
    }
    
    @Test
    void concurrentCommitsCreateExactlyOnce() throws Exception {
        int writers = 8;
        List<Path> stagedFiles = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            stagedFiles.add(stage("hello world"));
        }
        
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (Path staged : stagedFiles) {
                Callable<Boolean> commit = () -> {
                    start.await();
                    return storage.commit(FINGERPRINT, staged);
                };
                results.add(executor.submit(commit));
            }
            start.countDown();
            
            int created = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    created++;
                }
            }
            assertThat(created).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }
    
    @Test
    void deleteRemovesContentOnce() throws Exception {
        storage.commit(FINGERPRINT, stage("hello world"));
        
        assertThat(storage.delete(FINGERPRINT)).isTrue();
        assertThat(storage.delete(FINGERPRINT)).isFalse();
        assertThat(storage.exists(FINGERPRINT)).isFalse();
    }
    
    @Test
    void openingMissingContentFails() {
        assertThatThrownBy(() -> storage.open(FINGERPRINT))
            .isInstanceOf(StorageIOException.class)
            .hasMessageContaining("missing");
    }
    
    @Test
    void rejectsMalformedFingerprints() {
        assertThatThrownBy(() -> storage.exists("../../etc/passwd"))
            .isInstanceOf(IllegalArgumentException.class);
    }
    
    private Path stage(String content) throws Exception {
        Path staged = Files.createTempFile(storage.stagingDirectory(), "upload-", ".part");
        Files.writeString(staged, content);
        return staged;
    }
}
