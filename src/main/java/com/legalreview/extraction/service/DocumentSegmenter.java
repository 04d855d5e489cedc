package com.legalreview.extraction.service;

import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.SegmentDraft;
import com.legalreview.extraction.model.SourceDocument;

import java.util.List;

/**
 * Splits one document format into ordered page or section drafts.
 * Implementations throw {@link com.legalreview.extraction.exception.DocumentParseException}
 * when the bytes cannot be read.
 */
public interface DocumentSegmenter {

    DocumentFormat getFormat();

    List<SegmentDraft> split(SourceDocument document);
}
