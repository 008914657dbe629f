package com.dedupstore.core.worker;

import com.dedupstore.common.constants.IndexStatus;
import com.dedupstore.core.config.IndexingProperties;
import com.dedupstore.core.exception.PermanentTaskException;
import com.dedupstore.core.index.KeywordIndexer;
import com.dedupstore.core.model.IndexResult;
import com.dedupstore.data.entity.IndexJob;
import com.dedupstore.data.repository.FileRecordRepository;
import com.dedupstore.data.repository.IndexJobRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Drains the index job table. Each poll recovers expired leases, claims due jobs with a
 * compare-and-set update and indexes the claimed batch in parallel.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexJobWorker {
    
    private static final String WORKER_ID = "indexer-" + UUID.randomUUID().toString().substring(0, 8);
    private static final int MAX_ERROR_LENGTH = 2000;
    
    private final IndexJobRepository jobRepository;
    private final FileRecordRepository fileRecordRepository;
    private final KeywordIndexer keywordIndexer;
    private final IndexingProperties indexingProperties;
    
    private ExecutorService executorService;
    
    @PostConstruct
    public void start() {
        executorService = Executors.newFixedThreadPool(indexingProperties.getWorkerThreads());
        log.info("[WORKER] Index worker ready | workerId={} | threads={} | batchSize={}",
            WORKER_ID, indexingProperties.getWorkerThreads(), indexingProperties.getBatchSize());
    }
    
    @PreDestroy
    public void stop() throws InterruptedException {
        executorService.shutdown();
        if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
            log.warn("[WORKER] Index jobs still running at shutdown; their leases will expire and be retried");
            executorService.shutdownNow();
        }
    }
    
    @Scheduled(
        fixedDelayString = "${dedupstore.index.poll-interval-ms:3000}",
        initialDelayString = "${dedupstore.index.initial-delay-ms:5000}"
    )
    public void poll() {
        if (indexingProperties.isWorkerEnabled()) {
            processQueuedJobs();
        }
    }
    
    /**
     * Runs one poll cycle and blocks until the claimed batch is done.
     *
     * @return number of jobs claimed by this cycle
     */
    public int processQueuedJobs() {
        try {
            Instant now = Instant.now();
            int recovered = jobRepository.recoverExpiredLeases(now);
            if (recovered > 0) {
                log.warn("[WORKER] Recovered expired job leases | count={}", recovered);
            }
            
            List<IndexJob> dueJobs = jobRepository.findDueJobs(now, PageRequest.of(0, indexingProperties.getBatchSize()));
            if (dueJobs.isEmpty()) {
                return 0;
            }
            
            Instant lockedUntil = now.plusSeconds(indexingProperties.getLeaseSeconds());
            List<IndexJob> claimed = dueJobs.stream()
                .filter(job -> jobRepository.claim(job.getId(), WORKER_ID, now, lockedUntil) == 1)
                .collect(Collectors.toList());
            
            if (claimed.isEmpty()) {
                return 0;
            }
            log.info("[WORKER] Processing index jobs | claimed={} | due={} | workerId={}", claimed.size(), dueJobs.size(), WORKER_ID);
            
            List<CompletableFuture<Void>> futures = claimed.stream()
                // attempts was incremented by the claim
                .map(job -> CompletableFuture.runAsync(
                    () -> processJob(job.getId(), job.getFileId(), job.getAttempts() + 1, job.getMaxAttempts()),
                    executorService))
                .collect(Collectors.toList());
            
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .exceptionally(ex -> {
                    log.error("[WORKER] Error in index batch", ex);
                    return null;
                })
                .join();
            return claimed.size();
        } catch (Exception e) {
            log.error("[WORKER] Error in index job worker", e);
            return 0;
        }
    }
    
    private void processJob(UUID jobId, UUID fileId, int attempt, int maxAttempts) {
        try {
            IndexResult result = keywordIndexer.indexFile(fileId);
            jobRepository.markCompleted(jobId, Instant.now());
            log.debug("[WORKER] Job completed | jobId={} | fileId={} | status={} | keywords={}",
                jobId, fileId, result.getStatus(), result.getKeywordCount());
        } catch (PermanentTaskException e) {
            log.error("[WORKER] Job failed permanently | jobId={} | fileId={} | error={}", jobId, fileId, e.getMessage(), e);
            fail(jobId, fileId, e);
        } catch (Exception e) {
            if (attempt >= maxAttempts) {
                log.error("[WORKER] Job out of attempts | jobId={} | fileId={} | attempts={} | error={}",
                    jobId, fileId, attempt, e.getMessage(), e);
                fail(jobId, fileId, e);
            } else {
                Instant nextAttemptAt = Instant.now().plusMillis(indexingProperties.getRetryDelayMs() * attempt);
                log.warn("[WORKER] Job will be retried | jobId={} | fileId={} | attempt={}/{} | nextAttemptAt={} | error={}",
                    jobId, fileId, attempt, maxAttempts, nextAttemptAt, e.getMessage());
                jobRepository.requeue(jobId, errorMessage(e), nextAttemptAt);
            }
        }
    }
    
    private void fail(UUID jobId, UUID fileId, Exception e) {
        String error = errorMessage(e);
        Instant now = Instant.now();
        jobRepository.markFailed(jobId, error, now);
        keywordIndexer.removeFile(fileId);
        fileRecordRepository.updateIndexStatus(fileId, IndexStatus.FAILED, error, now);
    }
    
    private static String errorMessage(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isEmpty()) {
            message = e.getClass().getSimpleName();
        }
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }
}
