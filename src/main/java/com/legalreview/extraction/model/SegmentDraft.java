package com.legalreview.extraction.model;

import lombok.Value;

/**
 * Text of one page or section as it comes out of a parser, before whitespace
 * normalization and offset assignment.
 */
@Value
public class SegmentDraft {

    LocationType locationType;
    String label;
    String text;
}
