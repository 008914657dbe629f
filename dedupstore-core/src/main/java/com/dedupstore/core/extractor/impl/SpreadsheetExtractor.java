package com.dedupstore.core.extractor.impl;

import com.dedupstore.core.exception.ExtractionException;
import com.dedupstore.core.extractor.ContentExtractor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Set;

/**
 * Cell text of every sheet, one line per row. Formula cells contribute their cached result.
 */
@Component
@Slf4j
public class SpreadsheetExtractor implements ContentExtractor {
    
    @Override
    public Set<String> supportedTypes() {
        return Set.of(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
            "application/vnd.ms-excel"
        );
    }
    
    @Override
    public String extract(byte[] content, String mimeType) {
        DataFormatter formatter = new DataFormatter();
        try (Workbook workbook = WorkbookFactory.create(new ByteArrayInputStream(content))) {
            StringBuilder text = new StringBuilder();
            for (Sheet sheet : workbook) {
                text.append(sheet.getSheetName()).append("\n");
                for (Row row : sheet) {
                    StringBuilder line = new StringBuilder();
                    for (Cell cell : row) {
                        String value = cellText(cell, formatter);
                        if (!value.isBlank()) {
                            line.append(value).append(' ');
                        }
                    }
                    if (line.length() > 0) {
                        text.append(line.toString().trim()).append("\n");
                    }
                }
            }
            log.debug("[INDEX] Extracted spreadsheet text | sheets={} | chars={}", workbook.getNumberOfSheets(), text.length());
            return text.toString();
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException("Failed to read spreadsheet: " + e.getMessage(), e);
        }
    }
    
    private String cellText(Cell cell, DataFormatter formatter) {
        if (cell.getCellType() != CellType.FORMULA) {
            return formatter.formatCellValue(cell);
        }
        switch (cell.getCachedFormulaResultType()) {
            case STRING:
                return cell.getStringCellValue();
            case NUMERIC:
                return formatter.formatRawCellContents(cell.getNumericCellValue(),
                    cell.getCellStyle().getDataFormat(), cell.getCellStyle().getDataFormatString());
            case BOOLEAN:
                return String.valueOf(cell.getBooleanCellValue());
            default:
                return "";
        }
    }
}
