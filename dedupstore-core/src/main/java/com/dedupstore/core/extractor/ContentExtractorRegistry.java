package com.dedupstore.core.extractor;

import com.dedupstore.common.constants.FileTypes;
import com.dedupstore.core.extractor.impl.NoOpExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
public class ContentExtractorRegistry {
    
    private static final ContentExtractor NO_OP = new NoOpExtractor();
    
    private final Map<String, ContentExtractor> extractorsByType = new HashMap<>();
    
    public ContentExtractorRegistry(List<ContentExtractor> extractors) {
        for (ContentExtractor extractor : extractors) {
            for (String type : extractor.supportedTypes()) {
                ContentExtractor previous = extractorsByType.put(FileTypes.normalizeMimeType(type), extractor);
                if (previous != null && previous != extractor) {
                    throw new IllegalStateException("Mime type " + type + " claimed by both "
                        + previous.getClass().getSimpleName() + " and " + extractor.getClass().getSimpleName());
                }
            }
        }
        log.info("Registered {} content extractors for {} mime types", extractors.size(), extractorsByType.size());
    }
    
    public ContentExtractor getExtractor(String mimeType) {
        return extractorsByType.getOrDefault(FileTypes.normalizeMimeType(mimeType), NO_OP);
    }
    
    public boolean isSupported(String mimeType) {
        return extractorsByType.containsKey(FileTypes.normalizeMimeType(mimeType));
    }
}
