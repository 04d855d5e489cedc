package com.legalreview.extraction.model;

public enum ReasonCode {
    SINGLE_MATCH,
    MULTIPLE_MATCHES_REDUCED_CONFIDENCE,
    LOW_PRIORITY_PATTERN,
    NORMALIZATION_FAILED,
    NO_MATCH,
    PARSE_ERROR,
    EXTRACTION_ERROR
}
