package com.sitepulse.scribe.service.document;

import com.sitepulse.scribe.service.BlankText;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Last resort for fillable report templates that carry no page text: one
 * {@code name: value} line per filled AcroForm field, in field tree order.
 */
@Component
@Order(3)
public class PdfFormFieldStrategy implements DocumentTextStrategy {

    @Override
    public String name() {
        return "pdf-form-fields";
    }

    @Override
    public Optional<String> extract(byte[] document) throws IOException {
        try (PDDocument pdf = Loader.loadPDF(document)) {
            PDAcroForm acroForm = pdf.getDocumentCatalog().getAcroForm();
            if (acroForm == null) {
                return Optional.empty();
            }

            List<String> lines = new ArrayList<>();
            for (PDField field : acroForm.getFieldTree()) {
                String value = field.getValueAsString();
                if (BlankText.isBlank(value)) continue;
                String label = field.getPartialName() == null ? field.getFullyQualifiedName() : field.getPartialName();
                lines.add(label + ": " + value.trim());
            }
            return lines.isEmpty() ? Optional.empty() : Optional.of(String.join("\n\n", lines));
        }
    }
}
