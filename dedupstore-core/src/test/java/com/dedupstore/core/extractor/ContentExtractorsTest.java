package com.dedupstore.core.extractor;

import com.dedupstore.core.config.IndexingProperties;
import com.dedupstore.core.exception.ExtractionException;
import com.dedupstore.core.extractor.impl.ImageOcrExtractor;
import com.dedupstore.core.extractor.impl.PdfExtractor;
import com.dedupstore.core.extractor.impl.PlainTextExtractor;
import com.dedupstore.core.extractor.impl.PresentationExtractor;
import com.dedupstore.core.extractor.impl.SpreadsheetExtractor;
import com.dedupstore.core.extractor.impl.WordExtractor;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentExtractorsTest {
    
    private static final String DOCX = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
    private static final String XLSX = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
    private static final String PPTX = "application/vnd.openxmlformats-officedocument.presentationml.presentation";
    
    @Test
    void plainTextDecodesUtf8AndStripsBom() {
        byte[] content = "\uFEFFgrüße aus köln".getBytes(StandardCharsets.UTF_8);
        
        assertThat(new PlainTextExtractor().extract(content, "text/plain")).isEqualTo("grüße aus köln");
    }
    
    @Test
    void plainTextFallsBackToLatin1ForInvalidUtf8() {
        byte[] content = "café crème".getBytes(StandardCharsets.ISO_8859_1);
        
        assertThat(new PlainTextExtractor().extract(content, "text/plain")).isEqualTo("café crème");
    }
    
    @Test
    void pdfTextIsExtracted() throws Exception {
        byte[] pdf;
        try (PDDocument document = new PDDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.beginText();
                stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                stream.newLineAtOffset(72, 700);
                stream.showText("Quarterly revenue summary");
                stream.endText();
            }
            document.save(out);
            pdf = out.toByteArray();
        }
        
        assertThat(new PdfExtractor().extract(pdf, "application/pdf")).contains("Quarterly revenue summary");
    }
    
    @Test
    void corruptPdfRaisesExtractionException() {
        byte[] garbage = "this is plain text, not a pdf document".getBytes(StandardCharsets.US_ASCII);
        
        assertThatThrownBy(() -> new PdfExtractor().extract(garbage, "application/pdf"))
            .isInstanceOf(ExtractionException.class);
    }
    
    @Test
    void uncheckedPdfParserFailureIsReportedAsExtractionFailure() {
        assertThatThrownBy(() -> new PdfExtractor().extract(null, "application/pdf"))
            .isInstanceOf(ExtractionException.class)
            .hasCauseInstanceOf(RuntimeException.class);
    }
    
    @Test
    void docxParagraphsAndTablesAreExtracted() throws Exception {
        byte[] docx;
        try (XWPFDocument document = new XWPFDocument(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            document.createParagraph().createRun().setText("Meeting minutes");
            XWPFTable table = document.createTable(1, 2);
            table.getRow(0).getCell(0).setText("budget");
            table.getRow(0).getCell(1).setText("approved");
            document.write(out);
            docx = out.toByteArray();
        }
        
        String text = new WordExtractor().extract(docx, DOCX);
        
        assertThat(text).contains("Meeting minutes").contains("budget").contains("approved");
    }
    
    @Test
    void corruptWordDocumentRaisesExtractionException() {
        assertThatThrownBy(() -> new WordExtractor().extract(new byte[] {1, 2, 3, 4}, DOCX))
            .isInstanceOf(ExtractionException.class);
        assertThatThrownBy(() -> new WordExtractor().extract(new byte[] {1, 2, 3, 4}, "application/msword"))
            .isInstanceOf(ExtractionException.class);
    }
    
    @Test
    void spreadsheetCellsAreExtracted() throws Exception {
        byte[] xlsx;
        try (XSSFWorkbook workbook = new XSSFWorkbook(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet("Inventory");
            Row header = sheet.createRow(0);
            header.createCell(0).setCellValue("widget");
            header.createCell(1).setCellValue(42);
            Row total = sheet.createRow(1);
            total.createCell(0).setCellValue("total");
            total.createCell(1).setCellFormula("B1*2");
            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
            workbook.write(out);
            xlsx = out.toByteArray();
        }
        
        String text = new SpreadsheetExtractor().extract(xlsx, XLSX);
        
        assertThat(text).contains("Inventory").contains("widget 42").contains("total 84");
    }
    
    @Test
    void presentationTextIsExtracted() throws Exception {
        byte[] pptx;
        try (XMLSlideShow slideShow = new XMLSlideShow(); ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XSLFSlide slide = slideShow.createSlide();
            XSLFTextBox box = slide.createTextBox();
            box.setText("Roadmap milestones");
            slideShow.write(out);
            pptx = out.toByteArray();
        }
        
        assertThat(new PresentationExtractor().extract(pptx, PPTX)).contains("Roadmap milestones");
    }
    
    @Test
    void unreadableImageRaisesExtractionExceptionWithoutOcr() {
        ImageOcrExtractor extractor = new ImageOcrExtractor(new IndexingProperties());
        
        assertThatThrownBy(() -> extractor.extract("not an image".getBytes(StandardCharsets.US_ASCII), "image/png"))
            .isInstanceOf(ExtractionException.class)
            .hasMessageContaining("Could not read image");
    }
}
