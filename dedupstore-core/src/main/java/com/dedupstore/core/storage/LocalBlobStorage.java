package com.dedupstore.core.storage;

import com.dedupstore.core.config.StorageProperties;
import com.dedupstore.core.exception.StorageIOException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Blobs live at {@code <directory>/blobs/ab/cd/<fingerprint>}; uploads are staged in
 * {@code <directory>/tmp} on the same file system so commit is a link or a rename.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocalBlobStorage implements BlobStorage {
    
    private final StorageProperties storageProperties;
    
    private Path blobRoot;
    private Path stagingRoot;
    
    @PostConstruct
    public void init() {
        Path root = Paths.get(storageProperties.getDirectory()).toAbsolutePath().normalize();
        blobRoot = root.resolve("blobs");
        stagingRoot = root.resolve("tmp");
        try {
            Files.createDirectories(blobRoot);
            Files.createDirectories(stagingRoot);
        } catch (IOException e) {
            throw new StorageIOException("Failed to create storage directories under " + root, e);
        }
        log.info("Blob storage initialized | root={}", root);
    }
    
    @Override
    public Path stagingDirectory() {
        return stagingRoot;
    }
    
    @Override
    public boolean commit(String fingerprint, Path stagedFile) {
        Path target = resolve(fingerprint);
        try {
            Files.createDirectories(target.getParent());
            try {
                // Fails atomically if another writer got there first
                Files.createLink(target, stagedFile);
            } catch (UnsupportedOperationException e) {
                log.debug("Hard links unsupported, falling back to move | fingerprint={}", fingerprint);
                Files.move(stagedFile, target);
            }
            log.info("[UPLOAD] Blob written | fingerprint={} | sizeBytes={}", fingerprint, Files.size(target));
            return true;
        } catch (FileAlreadyExistsException e) {
            log.debug("[UPLOAD] Blob already present, discarding staged copy | fingerprint={}", fingerprint);
            return false;
        } catch (IOException e) {
            log.error("[UPLOAD] Failed to write blob | fingerprint={}", fingerprint, e);
            throw new StorageIOException("Failed to write content " + fingerprint, e);
        }
    }
    
    @Override
    public InputStream open(String fingerprint) {
        try {
            return Files.newInputStream(resolve(fingerprint));
        } catch (NoSuchFileException e) {
            throw new StorageIOException("Content missing from storage: " + fingerprint, e);
        } catch (IOException e) {
            throw new StorageIOException("Failed to read content " + fingerprint, e);
        }
    }
    
    @Override
    public boolean delete(String fingerprint) {
        Path target = resolve(fingerprint);
        try {
            boolean deleted = Files.deleteIfExists(target);
            if (deleted) {
                log.info("[DELETE] Blob removed | fingerprint={}", fingerprint);
            }
            return deleted;
        } catch (IOException e) {
            throw new StorageIOException("Failed to delete content " + fingerprint, e);
        }
    }
    
    @Override
    public boolean exists(String fingerprint) {
        return Files.exists(resolve(fingerprint));
    }
    
    @Override
    public String storageKey(String fingerprint) {
        return blobRoot.relativize(resolve(fingerprint)).toString().replace('\\', '/');
    }
    
    private Path resolve(String fingerprint) {
        if (fingerprint == null || fingerprint.length() < 4 || !fingerprint.matches("[0-9a-f]+")) {
            throw new IllegalArgumentException("Invalid fingerprint: " + fingerprint);
        }
        return blobRoot.resolve(fingerprint.substring(0, 2))
            .resolve(fingerprint.substring(2, 4))
            .resolve(fingerprint);
    }
}
