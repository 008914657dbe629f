package com.dedupstore.core.extractor.impl;

import com.dedupstore.core.config.IndexingProperties;
import com.dedupstore.core.exception.ExtractionException;
import com.dedupstore.core.extractor.ContentExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;

/**
 * OCR through Tesseract. The native library is only touched when an image is actually
 * indexed, and each call gets its own engine instance since one is not thread-safe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ImageOcrExtractor implements ContentExtractor {
    
    private final IndexingProperties indexingProperties;
    
    @Override
    public Set<String> supportedTypes() {
        return Set.of("image/png", "image/jpeg", "image/gif", "image/bmp", "image/x-ms-bmp", "image/tiff");
    }
    
    @Override
    public String extract(byte[] content, String mimeType) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(content));
        } catch (IOException e) {
            throw new ExtractionException("Could not read image: " + e.getMessage(), e);
        }
        if (image == null) {
            throw new ExtractionException("Could not read image: no decoder for " + mimeType);
        }
        
        try {
            String text = newTesseract().doOCR(image);
            return text != null ? text.trim() : "";
        } catch (TesseractException e) {
            throw new ExtractionException("OCR failed: " + e.getMessage(), e);
        } catch (LinkageError e) {
            log.warn("Tesseract native library or language data unavailable. Install Tesseract OCR and set TESSDATA_PREFIX.");
            throw new ExtractionException("OCR engine unavailable: " + e.getMessage(), e);
        }
    }
    
    private Tesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        String dataPath = indexingProperties.getOcrDataPath() != null
            ? indexingProperties.getOcrDataPath()
            : System.getenv("TESSDATA_PREFIX");
        if (dataPath != null) {
            tesseract.setDatapath(dataPath);
        }
        tesseract.setLanguage(indexingProperties.getOcrLanguage());
        return tesseract;
    }
}
