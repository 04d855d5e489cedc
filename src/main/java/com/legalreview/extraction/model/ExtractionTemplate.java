package com.legalreview.extraction.model;

import lombok.Value;

import java.util.List;

/**
 * Validated template. Built once per run by the template loader and never changed afterwards.
 */
@Value
public class ExtractionTemplate {

    String templateId;
    String description;
    List<FieldDefinition> fields;   // declaration order
}
