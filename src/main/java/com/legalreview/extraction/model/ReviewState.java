package com.legalreview.extraction.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Reviewer-facing lifecycle of a cell.
 *
 * EXTRACTED and MISSING_DATA are creation states only; every review action
 * moves a cell to CONFIRMED, REJECTED or MANUAL_UPDATED.
 */
public enum ReviewState {
    EXTRACTED,
    CONFIRMED,
    REJECTED,
    MANUAL_UPDATED,
    MISSING_DATA;

    private static final Set<ReviewState> REVIEW_TARGETS = EnumSet.of(CONFIRMED, REJECTED, MANUAL_UPDATED);

    public boolean isInitial() {
        return this == EXTRACTED || this == MISSING_DATA;
    }

    public boolean canTransitionTo(ReviewState target) {
        return REVIEW_TARGETS.contains(target);
    }
}
