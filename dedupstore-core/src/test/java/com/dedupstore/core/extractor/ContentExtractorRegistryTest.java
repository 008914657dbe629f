package com.dedupstore.core.extractor;

import com.dedupstore.core.config.IndexingProperties;
import com.dedupstore.core.extractor.impl.ImageOcrExtractor;
import com.dedupstore.core.extractor.impl.NoOpExtractor;
import com.dedupstore.core.extractor.impl.PdfExtractor;
import com.dedupstore.core.extractor.impl.PlainTextExtractor;
import com.dedupstore.core.extractor.impl.PresentationExtractor;
import com.dedupstore.core.extractor.impl.SpreadsheetExtractor;
import com.dedupstore.core.extractor.impl.WordExtractor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentExtractorRegistryTest {
    
    private final ContentExtractorRegistry registry = new ContentExtractorRegistry(List.of(
        new PlainTextExtractor(),
        new PdfExtractor(),
        new WordExtractor(),
        new SpreadsheetExtractor(),
        new PresentationExtractor(),
        new ImageOcrExtractor(new IndexingProperties())
    ));
    
    @Test
    void dispatchesOnNormalizedMimeType() {
        assertThat(registry.getExtractor("text/plain; charset=UTF-8")).isInstanceOf(PlainTextExtractor.class);
        assertThat(registry.getExtractor("APPLICATION/PDF")).isInstanceOf(PdfExtractor.class);
        assertThat(registry.getExtractor("application/msword")).isInstanceOf(WordExtractor.class);
        assertThat(registry.getExtractor("application/vnd.ms-excel")).isInstanceOf(SpreadsheetExtractor.class);
        assertThat(registry.getExtractor("application/vnd.ms-powerpoint")).isInstanceOf(PresentationExtractor.class);
        assertThat(registry.getExtractor("image/png")).isInstanceOf(ImageOcrExtractor.class);
    }
    
    @Test
    void unknownTypesFallBackToNoOp() {
        assertThat(registry.isSupported("application/zip")).isFalse();
        assertThat(registry.getExtractor("application/zip")).isInstanceOf(NoOpExtractor.class);
        assertThat(registry.getExtractor(null).extract(new byte[] {1, 2, 3}, null)).isEmpty();
    }
    
    @Test
    void rejectsTwoExtractorsClaimingOneType() {
        assertThatThrownBy(() -> new ContentExtractorRegistry(List.of(new PdfExtractor(), new PdfExtractor())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("application/pdf");
    }
}
