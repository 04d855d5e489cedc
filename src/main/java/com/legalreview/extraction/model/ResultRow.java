package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One field's cells across all documents of a job, in document order.
 */
@Value
@Builder
public class ResultRow {

    String fieldKey;
    String fieldLabel;
    FieldType fieldType;
    List<Cell> cells;
}
