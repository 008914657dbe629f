package com.dedupstore.api.dto.response;

import com.dedupstore.common.constants.IndexStatus;
import com.dedupstore.common.util.FileUtils;
import com.dedupstore.data.entity.FileRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileResponse {
    private UUID id;
    private String filename;
    private String fileType;
    private Long size;
    private String sizeFormatted;
    private String fileHash;
    private boolean reference;
    private UUID originalFileId;
    private IndexStatus indexStatus;
    private String indexError;
    private Instant uploadedAt;
    private Instant indexedAt;
    
    public static FileResponse from(FileRecord record) {
        return FileResponse.builder()
            .id(record.getId())
            .filename(record.getFilename())
            .fileType(record.getDeclaredType())
            .size(record.getSizeBytes())
            .sizeFormatted(FileUtils.formatFileSize(record.getSizeBytes()))
            .fileHash(record.getFingerprint())
            .reference(record.isReference())
            .originalFileId(record.getCanonicalId())
            .indexStatus(record.getIndexStatus())
            .indexError(record.getIndexError())
            .uploadedAt(record.getCreatedAt())
            .indexedAt(record.getIndexedAt())
            .build();
    }
}
