package com.dedupstore.data.projection;

/**
 * Number of indexed files per keyword.
 */
public record KeywordCount(String keyword, Long fileCount) {
}
