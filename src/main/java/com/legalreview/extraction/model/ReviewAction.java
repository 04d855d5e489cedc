package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A reviewer's request against one cell. Exactly one of {@code reviewState} and
 * {@code manualValue} is set; {@code expectedVersion} is the cell version the
 * reviewer last read.
 */
@Value
@Builder
@Jacksonized
public class ReviewAction {

    ReviewState reviewState;
    String manualValue;
    String reason;
    String actor;
    Long expectedVersion;
}
