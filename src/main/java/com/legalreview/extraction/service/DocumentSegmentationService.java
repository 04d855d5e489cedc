package com.legalreview.extraction.service;

import com.legalreview.extraction.exception.DocumentParseException;
import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.Segment;
import com.legalreview.extraction.model.SegmentDraft;
import com.legalreview.extraction.model.SegmentedDocument;
import com.legalreview.extraction.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes a document to the segmenter for its format and assembles the canonical text.
 *
 * Canonical text is the normalized segment texts joined by a blank line. Offsets are
 * computed on that text, so every segment maps back to an exact substring of it.
 */
@Service
@Slf4j
public class DocumentSegmentationService {

    static final String SEGMENT_SEPARATOR = "\n\n";

    private final Map<DocumentFormat, DocumentSegmenter> segmenters = new EnumMap<>(DocumentFormat.class);

    public DocumentSegmentationService(List<DocumentSegmenter> segmenters) {
        for (DocumentSegmenter segmenter : segmenters) {
            this.segmenters.put(segmenter.getFormat(), segmenter);
        }
    }

    public SegmentedDocument segment(SourceDocument document) {
        DocumentSegmenter segmenter = segmenters.get(document.getFormat());
        if (segmenter == null) {
            throw new DocumentParseException(document.getId(),
                    "Unsupported document format: " + document.getFormat());
        }

        List<SegmentDraft> drafts;
        try {
            drafts = segmenter.split(document);
        } catch (DocumentParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DocumentParseException(document.getId(),
                    "Failed to segment " + document.getIdentifier() + ": " + e.getMessage(), e);
        }

        return assemble(document, drafts);
    }

    SegmentedDocument assemble(SourceDocument document, List<SegmentDraft> drafts) {
        StringBuilder canonical = new StringBuilder();
        List<Segment> segments = new ArrayList<>(drafts.size());
        int location = 0;

        for (SegmentDraft draft : drafts) {
            if (location > 0) {
                canonical.append(SEGMENT_SEPARATOR);
            }
            location++;

            String text = TextCleaner.normalizeBlock(draft.getText());
            int start = canonical.length();
            canonical.append(text);

            segments.add(Segment.builder()
                    .locationType(draft.getLocationType())
                    .location(location)
                    .label(draft.getLabel())
                    .text(text)
                    .startOffset(start)
                    .endOffset(canonical.length())
                    .build());
        }

        log.debug("Segmented {} into {} segments ({} chars)",
                document.getIdentifier(), segments.size(), canonical.length());
        return new SegmentedDocument(document, canonical.toString(), List.copyOf(segments));
    }
}
