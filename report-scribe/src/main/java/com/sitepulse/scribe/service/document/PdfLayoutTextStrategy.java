package com.sitepulse.scribe.service.document;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Page-by-page extraction with glyphs sorted by position.
 *
 * Scanned-then-typed reports often have text objects written out of reading order,
 * which the default stripper returns garbled or not at all. A page that fails to
 * strip is skipped rather than failing the document.
 */
@Component
@Slf4j
@Order(2)
public class PdfLayoutTextStrategy implements DocumentTextStrategy {

    @Override
    public String name() {
        return "pdf-layout-stripper";
    }

    @Override
    public Optional<String> extract(byte[] document) throws IOException {
        try (PDDocument pdf = Loader.loadPDF(document)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setAddMoreFormatting(true);

            List<String> pages = new ArrayList<>();
            int totalPages = pdf.getNumberOfPages();
            for (int pageNum = 1; pageNum <= totalPages; pageNum++) {
                stripper.setStartPage(pageNum);
                stripper.setEndPage(pageNum);
                try {
                    pages.add(stripper.getText(pdf));
                } catch (IOException e) {
                    log.debug("Skipping page {} of {}: {}", pageNum, totalPages, e.getMessage());
                }
            }
            return Optional.of(String.join("\n", pages));
        }
    }
}
