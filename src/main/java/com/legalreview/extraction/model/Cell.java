package com.legalreview.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The reviewable unit: one field's value for one document within one job.
 * {@code valueRaw} is written once, when the cell is materialized.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Cell {

    private String cellId;
    private String jobId;
    private String documentId;
    private String documentIdentifier;
    private String fieldKey;
    private String fieldLabel;
    private FieldType fieldType;

    private String value;
    private String valueRaw;
    private String valueNormalized;

    private double confidence;

    @Builder.Default
    private List<ReasonCode> confidenceReasons = new ArrayList<>();

    private ReviewState reviewState;
    private Citation citation;

    private long version;
}
