package com.dedupstore.core.service;

import com.dedupstore.core.config.StorageProperties;
import com.dedupstore.core.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UploadValidatorTest {
    
    private final UploadValidator validator = new UploadValidator(new StorageProperties());
    
    @ParameterizedTest
    @ValueSource(strings = {"../secret.txt", "dir/file.txt", "dir\\file.txt", "CON.txt", "lpt1.pdf", " "})
    void rejectsUnsafeFilenames(String filename) {
        assertThatThrownBy(() -> validator.validateFilename(filename)).isInstanceOf(ValidationException.class);
    }
    
    @Test
    void rejectsOverlongFilename() {
        assertThatThrownBy(() -> validator.validateFilename("a".repeat(252) + ".txt"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("too long");
    }
    
    @Test
    void acceptsOrdinaryFilename() {
        assertThatCode(() -> validator.validateFilename("Quarterly report (final).pdf")).doesNotThrowAnyException();
    }
    
    @Test
    void rejectsDisallowedExtension() {
        assertThatThrownBy(() -> validator.resolveDeclaredType("setup.exe", "application/octet-stream"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("'.exe' is not allowed");
        assertThatThrownBy(() -> validator.resolveDeclaredType("README", "text/plain"))
            .isInstanceOf(ValidationException.class);
    }
    
    @Test
    void rejectsDeclaredTypeThatDoesNotMatchExtension() {
        assertThatThrownBy(() -> validator.resolveDeclaredType("photo.png", "application/pdf"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("mismatch");
    }
    
    @Test
    void normalizesDeclaredTypeAndFallsBackToExtension() {
        assertThat(validator.resolveDeclaredType("notes.txt", "Text/Plain; charset=UTF-8")).isEqualTo("text/plain");
        assertThat(validator.resolveDeclaredType("report.PDF", "application/octet-stream")).isEqualTo("application/pdf");
        assertThat(validator.resolveDeclaredType("data.csv", null)).isEqualTo("text/csv");
    }
    
    @Test
    void enforcesSizeBounds() {
        assertThatThrownBy(() -> validator.validateSize(0))
            .isInstanceOf(ValidationException.class)
            .hasMessage("File is empty");
        assertThatThrownBy(() -> validator.validateSize(10L * 1024 * 1024 + 1))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("(10 MB)");
        assertThatCode(() -> validator.validateSize(10L * 1024 * 1024)).doesNotThrowAnyException();
    }
    
    @ParameterizedTest
    @ValueSource(strings = {"ab", "user name", "user@example", ""})
    void rejectsMalformedUserIds(String userId) {
        assertThatThrownBy(() -> validator.validateUserId(userId)).isInstanceOf(ValidationException.class);
    }
    
    @Test
    void acceptsWellFormedUserId() {
        assertThatCode(() -> validator.validateUserId("user_42-a")).doesNotThrowAnyException();
    }
}
