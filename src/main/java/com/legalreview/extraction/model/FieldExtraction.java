package com.legalreview.extraction.model;

import lombok.Value;

import java.util.List;

/**
 * Candidate set for one (document, field) pair, sorted so the primary match comes first.
 */
@Value
public class FieldExtraction {

    FieldDefinition field;
    List<MatchCandidate> candidates;

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    public MatchCandidate getPrimary() {
        return candidates.isEmpty() ? null : candidates.get(0);
    }

    public int candidateCount() {
        return candidates.size();
    }
}
