package com.dedupstore.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "dedupstore.storage")
@Getter
@Setter
public class StorageProperties {
    private String directory = "./data/storage"; // blobs/ and tmp/ are created below it
    private long quotaPerUser = 10L * 1024 * 1024; // 10MB, charged against actual usage
    private long maxFileSize = 10L * 1024 * 1024;
    private int uploadAttempts = 3; // commit retries after a fingerprint claim conflict
}
