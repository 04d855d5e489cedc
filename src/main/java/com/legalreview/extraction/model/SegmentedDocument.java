package com.legalreview.extraction.model;

import lombok.Value;

import java.util.List;

@Value
public class SegmentedDocument {

    SourceDocument document;
    String canonicalText;
    List<Segment> segments;

    public String getDocumentId() {
        return document.getId();
    }
}
