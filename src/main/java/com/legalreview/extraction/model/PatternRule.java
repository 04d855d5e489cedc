package com.legalreview.extraction.model;

import com.legalreview.extraction.service.ValueNormalizer;
import lombok.Builder;
import lombok.Value;

import java.util.regex.Pattern;

/**
 * One compiled pattern of a field. {@code rank} is the rule's position once the
 * field's rules are sorted by descending priority (0 = the field's best rule).
 */
@Value
@Builder(toBuilder = true)
public class PatternRule {

    Pattern pattern;
    int priority;
    int group;
    ValueNormalizer normalizer;
    int rank;
}
