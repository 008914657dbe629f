package com.dedupstore.api.dto.response;

import com.dedupstore.common.constants.IndexStatus;
import com.dedupstore.data.entity.FileRecord;
import com.dedupstore.data.entity.IndexJob;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexStatusResponse {
    private UUID fileId;
    private IndexStatus indexStatus;
    private String indexError;
    private Instant indexedAt;
    private List<String> keywords;
    private List<JobSummary> jobs;
    
    public static IndexStatusResponse from(FileRecord record, List<String> keywords, List<IndexJob> jobs) {
        return IndexStatusResponse.builder()
            .fileId(record.getId())
            .indexStatus(record.getIndexStatus())
            .indexError(record.getIndexError())
            .indexedAt(record.getIndexedAt())
            .keywords(keywords)
            .jobs(jobs.stream().map(JobSummary::from).collect(Collectors.toList()))
            .build();
    }
    
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JobSummary {
        private UUID id;
        private String trigger;
        private String status;
        private Integer attempts;
        private Integer maxAttempts;
        private String lastError;
        private Instant nextAttemptAt;
        private Instant completedAt;
        
        static JobSummary from(IndexJob job) {
            return JobSummary.builder()
                .id(job.getId())
                .trigger(job.getTrigger())
                .status(job.getStatus())
                .attempts(job.getAttempts())
                .maxAttempts(job.getMaxAttempts())
                .lastError(job.getLastError())
                .nextAttemptAt(job.getNextAttemptAt())
                .completedAt(job.getCompletedAt())
                .build();
        }
    }
}
