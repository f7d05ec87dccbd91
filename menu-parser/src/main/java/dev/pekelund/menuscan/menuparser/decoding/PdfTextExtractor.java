package dev.pekelund.menuscan.menuparser.decoding;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Reads the text layer of a PDF menu. Text is sorted by position so multi-column layouts come out in reading
 * order line by line.
 */
@Component
public class PdfTextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

    public String extractText(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new MenuDecodingException("Cannot parse an empty PDF document");
        }
        String text;
        int pages;
        try (PDDocument document = PDDocument.load(new ByteArrayInputStream(pdfBytes))) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            text = stripper.getText(document);
            pages = document.getNumberOfPages();
        } catch (IOException ex) {
            throw new MenuDecodingException("Failed to read PDF document", ex);
        }
        if (!StringUtils.hasText(text)) {
            throw new MenuDecodingException("PDF document did not contain any readable text");
        }
        LOGGER.info("Extracted {} characters of text from {} PDF pages", text.length(), pages);
        return text;
    }
}
