package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * A document as handed over by ingestion. Immutable for the duration of a run.
 */
@Value
@Builder
public class SourceDocument {

    String id;
    String identifier;          // human readable, usually the file name

    @ToString.Exclude
    byte[] rawBytes;

    DocumentFormat format;
}
