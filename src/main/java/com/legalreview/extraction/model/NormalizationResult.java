package com.legalreview.extraction.model;

import lombok.Value;

@Value
public class NormalizationResult {

    String value;
    boolean success;

    public static NormalizationResult of(String value) {
        return new NormalizationResult(value, true);
    }

    public static NormalizationResult failed() {
        return new NormalizationResult(null, false);
    }
}
