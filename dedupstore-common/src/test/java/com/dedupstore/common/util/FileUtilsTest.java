package com.dedupstore.common.util;

import com.dedupstore.common.constants.FileTypes;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    @Test
    void extensionIsLowerCasedAndTakenFromLastDot() {
        assertEquals("pdf", FileUtils.getFileExtension("Report.Final.PDF"));
        assertEquals("", FileUtils.getFileExtension("README"));
        assertEquals("", FileUtils.getFileExtension("trailing."));
        assertEquals("", FileUtils.getFileExtension(null));
    }

    @Test
    void stripExtensionKeepsDotFiles() {
        assertEquals("report", FileUtils.stripExtension("report.pdf"));
        assertEquals(".profile", FileUtils.stripExtension(".profile"));
    }

    @Test
    void formatsSizesWithBinaryUnits() {
        assertEquals("0 Bytes", FileUtils.formatFileSize(0));
        assertEquals("11 Bytes", FileUtils.formatFileSize(11));
        assertEquals("1 KB", FileUtils.formatFileSize(1024));
        assertEquals("1.5 MB", FileUtils.formatFileSize(1024 * 1024 * 3 / 2));
        assertEquals("10 MB", FileUtils.formatFileSize(10L * 1024 * 1024));
    }

    @Test
    void mimeTypesAreNormalized() {
        assertEquals("text/plain", FileTypes.normalizeMimeType(" Text/Plain; charset=UTF-8"));
        assertEquals("", FileTypes.normalizeMimeType(null));
    }

    @Test
    void primaryMimeTypeFallsBackToOctetStream() {
        assertEquals("application/pdf", FileTypes.primaryMimeType("PDF"));
        assertEquals(FileTypes.OCTET_STREAM, FileTypes.primaryMimeType("exe"));
        assertTrue(FileTypes.isAllowedExtension("docx"));
        assertFalse(FileTypes.isAllowedExtension("exe"));
    }
}
