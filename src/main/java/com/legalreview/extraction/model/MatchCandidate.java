package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.util.Comparator;

/**
 * A raw pattern match for one field within one document. Offsets point into the
 * document's canonical text.
 */
@Value
@Builder
public class MatchCandidate {

    /**
     * Primary-match order: highest priority, earliest segment, earliest start, longest span.
     */
    public static final Comparator<MatchCandidate> PRIMARY_ORDER =
            Comparator.comparingInt(MatchCandidate::getPriority).reversed()
                    .thenComparingInt(c -> c.getSegment().getLocation())
                    .thenComparingInt(MatchCandidate::getCharStart)
                    .thenComparing(Comparator.comparingInt(MatchCandidate::span).reversed());

    String fieldKey;
    String documentId;
    Segment segment;
    String rawText;
    String normalizedValue;     // null when normalization failed
    int charStart;
    int charEnd;
    int priority;
    int ruleRank;

    public int span() {
        return charEnd - charStart;
    }

    public boolean isNormalized() {
        return normalizedValue != null;
    }
}
