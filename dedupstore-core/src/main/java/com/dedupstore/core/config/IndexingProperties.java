package com.dedupstore.core.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashSet;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "dedupstore.index")
@Getter
@Setter
public class IndexingProperties {
    private int minWordLength = 3;
    private int maxWordLength = 50;
    private Set<String> stopWords = new HashSet<>(Set.of(
        "the", "and", "for", "are", "but", "not", "you", "all", "any", "can", "had", "her",
        "was", "one", "our", "out", "has", "have", "his", "how", "its", "may", "new", "now",
        "old", "see", "two", "who", "did", "get", "him", "let", "she", "too", "use", "that",
        "with", "this", "from", "they", "been", "were", "will", "would", "there", "their",
        "what", "which", "when", "where", "about", "into", "than", "then", "them", "these",
        "those", "some", "such", "only", "also", "very", "just", "over", "your", "each"
    ));
    
    private boolean workerEnabled = true;
    private int workerThreads = 4;
    private int batchSize = 10;
    private int maxAttempts = 3;
    private long retryDelayMs = 60_000; // multiplied by the attempt number
    private long leaseSeconds = 300;
    
    private String ocrLanguage = "eng";
    private String ocrDataPath; // falls back to TESSDATA_PREFIX
}
