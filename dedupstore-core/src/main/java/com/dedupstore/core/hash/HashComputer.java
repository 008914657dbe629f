package com.dedupstore.core.hash;

import com.dedupstore.common.util.FileUtils;
import com.dedupstore.core.exception.StorageIOException;
import com.dedupstore.core.exception.ValidationException;
import com.dedupstore.core.model.StagedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 fingerprints over streamed content. Content is read in fixed-size chunks so the
 * whole payload never has to sit in memory.
 */
@Component
@Slf4j
public class HashComputer {
    
    public static final int CHUNK_SIZE = 8192;
    private static final String ALGORITHM = "SHA-256";
    
    public String fingerprint(InputStream inputStream) throws IOException {
        MessageDigest digest = newDigest();
        byte[] buffer = new byte[CHUNK_SIZE];
        int bytesRead;
        while ((bytesRead = inputStream.read(buffer)) != -1) {
            digest.update(buffer, 0, bytesRead);
        }
        return HexFormat.of().formatHex(digest.digest());
    }
    
    public String fingerprint(byte[] content) {
        return HexFormat.of().formatHex(newDigest().digest(content));
    }
    
    /**
     * Copies the stream into a new file under {@code stagingDirectory}, hashing on the way.
     * Stops and removes the partial file as soon as more than {@code maxBytes} arrive.
     */
    public StagedContent stage(InputStream inputStream, Path stagingDirectory, long maxBytes) {
        Path staged = null;
        try {
            Files.createDirectories(stagingDirectory);
            staged = Files.createTempFile(stagingDirectory, "upload-", ".part");
            
            MessageDigest digest = newDigest();
            long total = 0;
            try (FileOutputStream outputStream = new FileOutputStream(staged.toFile())) {
                byte[] buffer = new byte[CHUNK_SIZE];
                int bytesRead;
                while ((bytesRead = inputStream.read(buffer)) != -1) {
                    total += bytesRead;
                    if (total > maxBytes) {
                        throw new ValidationException(String.format(
                            "File size exceeds maximum allowed size of %s", FileUtils.formatFileSize(maxBytes)));
                    }
                    digest.update(buffer, 0, bytesRead);
                    outputStream.write(buffer, 0, bytesRead);
                }
                outputStream.getFD().sync();
            }
            
            String fingerprint = HexFormat.of().formatHex(digest.digest());
            log.debug("[UPLOAD] Staged content | fingerprint={} | sizeBytes={} | path={}", fingerprint, total, staged);
            return StagedContent.builder()
                .path(staged)
                .fingerprint(fingerprint)
                .sizeBytes(total)
                .build();
        } catch (IOException e) {
            discard(staged);
            throw new StorageIOException("Failed to stage upload", e);
        } catch (RuntimeException e) {
            discard(staged);
            throw e;
        }
    }
    
    private void discard(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("[UPLOAD] Could not remove staged file {} | error={}", staged, e.getMessage());
        }
    }
    
    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        }
    }
}
