package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class FieldSummary {

    String key;
    String label;
    FieldType type;
}
