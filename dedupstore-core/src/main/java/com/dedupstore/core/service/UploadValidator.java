package com.dedupstore.core.service;

import com.dedupstore.common.constants.FileTypes;
import com.dedupstore.common.util.FileUtils;
import com.dedupstore.core.config.StorageProperties;
import com.dedupstore.core.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

@Component
@RequiredArgsConstructor
public class UploadValidator {
    
    private static final Pattern USER_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{3,50}$");
    private static final int MAX_FILENAME_LENGTH = 255;
    private static final Set<String> RESERVED_NAMES = Set.of(
        "CON", "PRN", "AUX", "NUL",
        "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
        "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );
    
    private final StorageProperties storageProperties;
    
    public void validateUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new ValidationException("User id is required");
        }
        if (!USER_ID_PATTERN.matcher(userId).matches()) {
            throw new ValidationException(
                "Invalid user id: use 3-50 letters, digits, underscores or hyphens");
        }
    }
    
    public void validateFilename(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new ValidationException("Filename cannot be empty");
        }
        if (filename.contains("..") || filename.contains("/") || filename.contains("\\")) {
            throw new ValidationException("Filename contains invalid characters");
        }
        if (filename.length() > MAX_FILENAME_LENGTH) {
            throw new ValidationException("Filename is too long (maximum 255 characters)");
        }
        if (RESERVED_NAMES.contains(FileUtils.stripExtension(filename).toUpperCase(Locale.ROOT))) {
            throw new ValidationException("Filename '" + filename + "' is reserved and not allowed");
        }
    }
    
    /**
     * Checks the extension against the allow-list and the declared type against the types
     * expected for that extension.
     *
     * @return the normalized declared type to store
     */
    public String resolveDeclaredType(String filename, String declaredType) {
        String extension = FileUtils.getFileExtension(filename);
        if (extension.isEmpty()) {
            throw new ValidationException("File must have an extension");
        }
        if (!FileTypes.isAllowedExtension(extension)) {
            throw new ValidationException(String.format(
                "File type '.%s' is not allowed. Allowed types: %s",
                extension, String.join(", ", FileTypes.allowedExtensions())));
        }
        
        String normalized = FileTypes.normalizeMimeType(declaredType);
        if (normalized.isEmpty() || FileTypes.OCTET_STREAM.equals(normalized)) {
            return FileTypes.primaryMimeType(extension);
        }
        
        List<String> expected = FileTypes.expectedMimeTypes(extension);
        if (!expected.contains(normalized)) {
            throw new ValidationException(String.format(
                "File content type mismatch: '%s' is declared as '%s' but has extension '.%s'. Expected types: %s",
                filename, normalized, extension, String.join(", ", expected)));
        }
        return normalized;
    }
    
    public void validateSize(long sizeBytes) {
        if (sizeBytes <= 0) {
            throw new ValidationException("File is empty");
        }
        long max = storageProperties.getMaxFileSize();
        if (sizeBytes > max) {
            throw new ValidationException(String.format(
                "File size (%s) exceeds maximum allowed size (%s)",
                FileUtils.formatFileSize(sizeBytes), FileUtils.formatFileSize(max)));
        }
    }
}
