package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DocumentSummary {

    String id;
    String identifier;
    DocumentFormat format;

    public static DocumentSummary of(SourceDocument document) {
        return new DocumentSummary(document.getId(), document.getIdentifier(), document.getFormat());
    }
}
