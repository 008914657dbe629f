package com.dedupstore.api.controller;

import com.dedupstore.core.model.QueueStats;
import com.dedupstore.core.worker.IndexingTaskQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/index")
@RequiredArgsConstructor
@Slf4j
public class IndexController {
    
    private final IndexingTaskQueue taskQueue;
    
    @PostMapping("/reindex")
    public ResponseEntity<Map<String, Object>> reindexAll() {
        int queued = taskQueue.reindexAll();
        log.info("Reindex requested | queued={}", queued);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
            "message", "Reindexing queued",
            "queued", queued
        ));
    }
    
    @GetMapping("/jobs")
    public ResponseEntity<QueueStats> queueStats() {
        return ResponseEntity.ok(taskQueue.queueStats());
    }
}
