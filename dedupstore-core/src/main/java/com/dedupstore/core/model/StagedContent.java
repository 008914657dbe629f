package com.dedupstore.core.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * Upload bytes spooled to a temporary file together with their fingerprint.
 */
@Data
@Builder
public class StagedContent {
    private Path path;
    private String fingerprint;
    private long sizeBytes;
}
