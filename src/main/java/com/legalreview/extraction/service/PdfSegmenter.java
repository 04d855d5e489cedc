package com.legalreview.extraction.service;

import com.legalreview.extraction.exception.DocumentParseException;
import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.LocationType;
import com.legalreview.extraction.model.SegmentDraft;
import com.legalreview.extraction.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * One segment per PDF page. Empty pages are kept so page numbers stay aligned.
 */
@Component
@Slf4j
public class PdfSegmenter implements DocumentSegmenter {

    @Override
    public DocumentFormat getFormat() {
        return DocumentFormat.PDF;
    }

    @Override
    public List<SegmentDraft> split(SourceDocument document) {
        try (PDDocument pdf = Loader.loadPDF(document.getRawBytes())) {
            int pageCount = pdf.getNumberOfPages();
            if (pageCount == 0) {
                throw new DocumentParseException(document.getId(), "PDF has no pages");
            }

            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            List<SegmentDraft> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(new SegmentDraft(LocationType.PAGE, null, stripper.getText(pdf)));
            }

            log.debug("Read {} pages from {}", pageCount, document.getIdentifier());
            return pages;
        } catch (IOException e) {
            throw new DocumentParseException(document.getId(),
                    "Unreadable PDF " + document.getIdentifier() + ": " + e.getMessage(), e);
        }
    }
}
