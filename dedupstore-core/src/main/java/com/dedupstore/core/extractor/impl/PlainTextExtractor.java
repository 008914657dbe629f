package com.dedupstore.core.extractor.impl;

import com.dedupstore.core.extractor.ContentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;

@Component
@Slf4j
public class PlainTextExtractor implements ContentExtractor {
    
    private static final Set<String> TYPES = Set.of(
        "text/plain", "text/csv", "application/csv", "text/markdown", "text/html",
        "text/xml", "application/xml", "application/json",
        "text/yaml", "text/x-yaml", "application/x-yaml",
        "text/rtf", "application/rtf"
    );
    
    @Override
    public Set<String> supportedTypes() {
        return TYPES;
    }
    
    @Override
    public String extract(byte[] content, String mimeType) {
        String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content))
                .toString();
        } catch (CharacterCodingException e) {
            // Every byte sequence is valid Latin-1
            log.debug("[INDEX] Content is not valid UTF-8, decoding as ISO-8859-1 | type={}", mimeType);
            text = new String(content, StandardCharsets.ISO_8859_1);
        }
        
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }
}
