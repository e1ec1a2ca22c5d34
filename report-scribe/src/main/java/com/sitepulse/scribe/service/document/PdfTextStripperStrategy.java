package com.sitepulse.scribe.service.document;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Optional;

/**
 * Fast path: PDFBox's default stripper over the whole document, in content-stream order.
 */
@Component
@Order(1)
public class PdfTextStripperStrategy implements DocumentTextStrategy {

    @Override
    public String name() {
        return "pdf-text-stripper";
    }

    @Override
    public Optional<String> extract(byte[] document) throws IOException {
        try (PDDocument pdf = Loader.loadPDF(document)) {
            PDFTextStripper stripper = new PDFTextStripper();
            return Optional.ofNullable(stripper.getText(pdf));
        }
    }
}
