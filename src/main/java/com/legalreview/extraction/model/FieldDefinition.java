package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class FieldDefinition {

    String key;
    String label;
    FieldType type;
    List<PatternRule> rules;    // sorted by descending priority

    public int ruleCount() {
        return rules.size();
    }

    public FieldSummary summary() {
        return FieldSummary.builder().key(key).label(label).type(type).build();
    }
}
