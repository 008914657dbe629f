package com.dedupstore.common.constants;

/**
 * Keyword-index state of a stored file.
 */
public enum IndexStatus {
    PENDING,
    INDEXED,
    FAILED,
    UNSUPPORTED
}
