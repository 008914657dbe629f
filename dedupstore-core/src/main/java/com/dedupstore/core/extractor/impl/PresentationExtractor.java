package com.dedupstore.core.extractor.impl;

import com.dedupstore.core.exception.ExtractionException;
import com.dedupstore.core.extractor.ContentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.hslf.usermodel.HSLFSlide;
import org.apache.poi.hslf.usermodel.HSLFSlideShow;
import org.apache.poi.hslf.usermodel.HSLFTextParagraph;
import org.apache.poi.hslf.usermodel.HSLFTextRun;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.List;
import java.util.Set;

@Component
@Slf4j
public class PresentationExtractor implements ContentExtractor {
    
    private static final String PPTX = "application/vnd.openxmlformats-officedocument.presentationml.presentation";
    private static final String PPT = "application/vnd.ms-powerpoint";
    
    @Override
    public Set<String> supportedTypes() {
        return Set.of(PPTX, PPT);
    }
    
    @Override
    public String extract(byte[] content, String mimeType) {
        try {
            if (PPT.equals(mimeType)) {
                return extractFromPpt(content);
            }
            return extractFromPptx(content);
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read presentation: " + e.getMessage(), e);
        }
    }
    
    private String extractFromPptx(byte[] content) throws IOException {
        try (XMLSlideShow pptx = new XMLSlideShow(new ByteArrayInputStream(content))) {
            StringBuilder text = new StringBuilder();
            for (XSLFSlide slide : pptx.getSlides()) {
                for (XSLFShape shape : slide.getShapes()) {
                    if (shape instanceof XSLFTextShape) {
                        String shapeText = ((XSLFTextShape) shape).getText();
                        if (shapeText != null && !shapeText.isBlank()) {
                            text.append(shapeText).append("\n");
                        }
                    }
                }
            }
            log.debug("[INDEX] Extracted PPTX text | slides={} | chars={}", pptx.getSlides().size(), text.length());
            return text.toString();
        }
    }
    
    private String extractFromPpt(byte[] content) throws IOException {
        try (HSLFSlideShow ppt = new HSLFSlideShow(new ByteArrayInputStream(content))) {
            StringBuilder text = new StringBuilder();
            for (HSLFSlide slide : ppt.getSlides()) {
                for (List<HSLFTextParagraph> paragraphs : slide.getTextParagraphs()) {
                    for (HSLFTextParagraph paragraph : paragraphs) {
                        StringBuilder paragraphText = new StringBuilder();
                        for (HSLFTextRun run : paragraph.getTextRuns()) {
                            paragraphText.append(run.getRawText());
                        }
                        if (!paragraphText.toString().isBlank()) {
                            text.append(paragraphText).append("\n");
                        }
                    }
                }
            }
            log.debug("[INDEX] Extracted PPT text | slides={} | chars={}", ppt.getSlides().size(), text.length());
            return text.toString();
        }
    }
}
