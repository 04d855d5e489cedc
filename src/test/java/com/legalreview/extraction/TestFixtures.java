package com.legalreview.extraction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalreview.extraction.config.ReviewProperties;
import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.ExtractionTemplate;
import com.legalreview.extraction.model.SourceDocument;
import com.legalreview.extraction.service.TemplateLoader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static TemplateLoader templateLoader() {
        return new TemplateLoader(new DefaultResourceLoader(), new ObjectMapper());
    }

    public static ExtractionTemplate template(String json) {
        return templateLoader().load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "test");
    }

    public static ReviewProperties properties(String templatePath) {
        ReviewProperties properties = new ReviewProperties();
        properties.setTemplatePath(templatePath);
        return properties;
    }

    public static SourceDocument html(String id, String body) {
        String page = "<html><head><title>" + id + "</title></head><body>" + body + "</body></html>";
        return SourceDocument.builder()
                .id(id)
                .identifier(id + ".html")
                .rawBytes(page.getBytes(StandardCharsets.UTF_8))
                .format(DocumentFormat.HTML)
                .build();
    }

    public static SourceDocument pdf(String id, String... pages) {
        return SourceDocument.builder()
                .id(id)
                .identifier(id + ".pdf")
                .rawBytes(pdfBytes(pages))
                .format(DocumentFormat.PDF)
                .build();
    }

    /**
     * Builds a PDF with one page per argument; lines are separated by '\n'.
     */
    public static byte[] pdfBytes(String... pages) {
        try (PDDocument document = new PDDocument()) {
            PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
            for (String text : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(font, 10);
                    content.newLineAtOffset(40, 720);
                    for (String line : text.split("\n")) {
                        content.showText(line);
                        content.newLineAtOffset(0, -14);
                    }
                    content.endText();
                }
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
