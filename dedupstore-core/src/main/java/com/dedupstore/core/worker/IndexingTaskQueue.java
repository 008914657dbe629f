package com.dedupstore.core.worker;

import com.dedupstore.core.config.IndexingProperties;
import com.dedupstore.core.model.QueueStats;
import com.dedupstore.data.entity.IndexJob;
import com.dedupstore.data.repository.FileRecordRepository;
import com.dedupstore.data.repository.IndexJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Producer side of the durable index job queue. Jobs are rows, so enqueueing inside an upload
 * transaction commits or rolls back together with the upload.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndexingTaskQueue {
    
    private final IndexJobRepository jobRepository;
    private final FileRecordRepository fileRecordRepository;
    private final IndexingProperties indexingProperties;
    
    @Transactional
    public IndexJob enqueueIndex(UUID fileId, String trigger) {
        IndexJob job = jobRepository.save(IndexJob.builder()
            .fileId(fileId)
            .trigger(trigger)
            .maxAttempts(indexingProperties.getMaxAttempts())
            .build());
        log.debug("[INDEX] Job queued | jobId={} | fileId={} | trigger={}", job.getId(), fileId, trigger);
        return job;
    }
    
    /**
     * Queues a reindex of every live file.
     *
     * @return number of jobs queued
     */
    @Transactional
    public int reindexAll() {
        List<UUID> fileIds = fileRecordRepository.findLiveIds();
        for (UUID fileId : fileIds) {
            enqueueIndex(fileId, IndexJob.TRIGGER_REINDEX);
        }
        log.info("[INDEX] Reindex of all files queued | jobs={}", fileIds.size());
        return fileIds.size();
    }
    
    @Transactional(readOnly = true)
    public List<IndexJob> jobsForFile(UUID fileId) {
        return jobRepository.findByFileIdOrderByCreatedAtAsc(fileId);
    }
    
    @Transactional(readOnly = true)
    public QueueStats queueStats() {
        return QueueStats.builder()
            .queued(jobRepository.countByStatus(IndexJob.QUEUED))
            .processing(jobRepository.countByStatus(IndexJob.PROCESSING))
            .completed(jobRepository.countByStatus(IndexJob.COMPLETED))
            .failed(jobRepository.countByStatus(IndexJob.FAILED))
            .build();
    }
}
