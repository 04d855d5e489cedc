package com.legalreview.extraction.model;

import lombok.Value;

import java.util.List;

@Value
public class ConfidenceScore {

    double score;
    List<ReasonCode> reasons;   // evaluation order
}
