package com.dedupstore.core.extractor.impl;

import com.dedupstore.core.exception.ExtractionException;
import com.dedupstore.core.extractor.ContentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Set;

@Component
@Slf4j
public class PdfExtractor implements ContentExtractor {
    
    @Override
    public Set<String> supportedTypes() {
        return Set.of("application/pdf");
    }
    
    @Override
    public String extract(byte[] content, String mimeType) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            String text = stripper.getText(document);
            log.debug("[INDEX] Extracted PDF text | pages={} | chars={}", document.getNumberOfPages(), text.length());
            return text;
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read PDF: " + e.getMessage(), e);
        }
    }
}
