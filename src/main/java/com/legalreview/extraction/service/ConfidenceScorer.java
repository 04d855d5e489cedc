package com.legalreview.extraction.service;

import com.legalreview.extraction.model.ConfidenceScore;
import com.legalreview.extraction.model.FieldExtraction;
import com.legalreview.extraction.model.MatchCandidate;
import com.legalreview.extraction.model.ReasonCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic confidence for a field's candidate set.
 *
 * <pre>
 *   base       = 0.55 + 0.40 * (ruleCount - rank) / ruleCount     rank 0 = field's best rule
 *   k > 1      : score *= 0.5 + 0.5 / k                              MULTIPLE_MATCHES_REDUCED_CONFIDENCE
 *   rank > 0   : score -= 0.10                                       LOW_PRIORITY_PATTERN
 *   not normalized : score -= 0.10                                   NORMALIZATION_FAILED
 * </pre>
 *
 * A matched field never scores below {@link #MIN_MATCHED_SCORE}; only an empty candidate
 * set scores exactly zero.
 */
@Service
@Slf4j
public class ConfidenceScorer {

    static final double BASE_FLOOR = 0.55;
    static final double BASE_RANGE = 0.40;
    static final double MULTIPLE_MATCH_FLOOR = 0.5;
    static final double LOW_PRIORITY_PENALTY = 0.10;
    static final double NORMALIZATION_PENALTY = 0.10;
    static final double MIN_MATCHED_SCORE = 0.05;
    static final int SCALE = 4;

    public ConfidenceScore score(FieldExtraction extraction) {
        MatchCandidate primary = extraction.getPrimary();
        if (primary == null) {
            return noMatch();
        }

        int ruleCount = Math.max(1, extraction.getField().ruleCount());
        int candidates = extraction.candidateCount();
        List<ReasonCode> reasons = new ArrayList<>();

        double score = BASE_FLOOR + BASE_RANGE * (ruleCount - primary.getRuleRank()) / ruleCount;

        if (candidates == 1) {
            reasons.add(ReasonCode.SINGLE_MATCH);
        } else {
            score *= MULTIPLE_MATCH_FLOOR + (1.0 - MULTIPLE_MATCH_FLOOR) / candidates;
            reasons.add(ReasonCode.MULTIPLE_MATCHES_REDUCED_CONFIDENCE);
        }

        if (primary.getRuleRank() > 0) {
            score -= LOW_PRIORITY_PENALTY;
            reasons.add(ReasonCode.LOW_PRIORITY_PATTERN);
        }

        if (!primary.isNormalized()) {
            score -= NORMALIZATION_PENALTY;
            reasons.add(ReasonCode.NORMALIZATION_FAILED);
        }

        double clamped = round(Math.min(1.0, Math.max(MIN_MATCHED_SCORE, score)));
        log.debug("Scored field '{}' at {} ({} candidates, rank {}) {}",
                extraction.getField().getKey(), clamped, candidates, primary.getRuleRank(), reasons);
        return new ConfidenceScore(clamped, List.copyOf(reasons));
    }

    public ConfidenceScore noMatch() {
        return new ConfidenceScore(0.0, List.of(ReasonCode.NO_MATCH));
    }

    /**
     * Score for a cell whose extraction could not run (parse or extraction error).
     */
    public ConfidenceScore failed(ReasonCode reason) {
        return new ConfidenceScore(0.0, List.of(reason));
    }

    private static double round(double value) {
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
