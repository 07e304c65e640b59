package com.vat.extraction.service;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.io.RandomAccessReadBuffer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Turns uploaded bytes into text. PDFs go through PDFBox; anything else
 * (CSV exports, plain text) is read as UTF-8. Unreadable content yields
 * an empty string so extraction can degrade instead of failing.
 */
@Component
@Slf4j
public class DocumentTextReader {

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};

    public String read(byte[] content, String fileName) {
        if (content == null || content.length == 0) {
            return "";
        }
        if (!isPdf(content)) {
            return new String(content, StandardCharsets.UTF_8);
        }

        try (PDDocument doc = Loader.loadPDF(new RandomAccessReadBuffer(content))) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(doc);
        } catch (IOException | RuntimeException e) {
            log.warn("Could not read PDF text from {}: {}", fileName, e.getMessage());
            return "";
        }
    }

    static boolean isPdf(byte[] content) {
        if (content.length < PDF_MAGIC.length) return false;
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (content[i] != PDF_MAGIC[i]) return false;
        }
        return true;
    }
}
