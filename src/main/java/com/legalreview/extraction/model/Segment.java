package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;

/**
 * A page- or section-bounded slice of a document's canonical text.
 * {@code canonicalText.substring(startOffset, endOffset)} equals {@link #getText()}.
 */
@Value
@Builder
public class Segment {

    LocationType locationType;
    int location;               // 1-based
    String label;               // section heading for HTML, null for pages
    String text;
    int startOffset;
    int endOffset;

    public boolean contains(int charStart, int charEnd) {
        return startOffset <= charStart && charStart <= charEnd && charEnd <= endOffset;
    }
}
