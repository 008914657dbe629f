package com.dedupstore.api.controller;

import com.dedupstore.core.storage.BlobStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/health")
@RequiredArgsConstructor
@Slf4j
public class HealthController {
    
    private static final Instant START_TIME = Instant.now();
    
    private final DataSource dataSource;
    private final BlobStorage blobStorage;
    
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "dedupstore");
        return ResponseEntity.ok(response);
    }
    
    /**
     * Includes database connectivity and storage directory checks.
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", Instant.now().toString());
        response.put("service", "dedupstore");
        response.put("uptimeSeconds", Instant.now().getEpochSecond() - START_TIME.getEpochSecond());
        
        Map<String, Object> database = checkDatabase();
        boolean storageWritable = Files.isWritable(blobStorage.stagingDirectory());
        response.put("database", database);
        response.put("storage", Map.of("status", storageWritable ? "UP" : "DOWN"));
        
        boolean up = "UP".equals(database.get("status")) && storageWritable;
        response.put("status", up ? "UP" : "DEGRADED");
        return ResponseEntity.ok(response);
    }
    
    private Map<String, Object> checkDatabase() {
        Map<String, Object> database = new HashMap<>();
        long startTime = System.currentTimeMillis();
        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(5);
            database.put("status", valid ? "UP" : "DOWN");
            database.put("database", connection.getMetaData().getDatabaseProductName());
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            database.put("status", "DOWN");
            database.put("error", e.getMessage());
        }
        database.put("responseTimeMs", System.currentTimeMillis() - startTime);
        return database;
    }
}
