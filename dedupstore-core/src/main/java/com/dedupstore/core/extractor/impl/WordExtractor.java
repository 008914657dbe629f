package com.dedupstore.core.extractor.impl;

import com.dedupstore.core.exception.ExtractionException;
import com.dedupstore.core.extractor.ContentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hwpf.HWPFDocument;
import org.apache.poi.xwpf.extractor.XWPFWordExtractor;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;

@Component
@Slf4j
public class WordExtractor implements ContentExtractor {
    
    private static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    private static final String DOC = "application/msword";
    
    @Override
    public Set<String> supportedTypes() {
        return Set.of(DOCX, DOC);
    }
    
    @Override
    public String extract(byte[] content, String mimeType) {
        try {
            if (DOC.equals(mimeType)) {
                return extractFromDoc(content);
            }
            return extractFromDocx(content);
        } catch (IOException | RuntimeException e) {
            // POI signals malformed containers with unchecked exceptions as well
            throw new ExtractionException("Failed to read Word document: " + e.getMessage(), e);
        }
    }
    
    private String extractFromDocx(byte[] content) throws IOException {
        // Paragraphs and table cells, in document order
        try (XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(content));
             XWPFWordExtractor extractor = new XWPFWordExtractor(document)) {
            return extractor.getText();
        }
    }
    
    private String extractFromDoc(byte[] content) throws IOException {
        try (HWPFDocument document = new HWPFDocument(new ByteArrayInputStream(content));
             org.apache.poi.hwpf.extractor.WordExtractor extractor = new org.apache.poi.hwpf.extractor.WordExtractor(document)) {
            return extractor.getText();
        }
    }
}
