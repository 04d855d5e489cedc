package com.legalreview.extraction.service;

import com.legalreview.extraction.exception.ExtractionException;
import com.legalreview.extraction.model.FieldDefinition;
import com.legalreview.extraction.model.FieldExtraction;
import com.legalreview.extraction.model.FieldType;
import com.legalreview.extraction.model.MatchCandidate;
import com.legalreview.extraction.model.NormalizationResult;
import com.legalreview.extraction.model.PatternRule;
import com.legalreview.extraction.model.Segment;
import com.legalreview.extraction.model.SegmentedDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Applies a field's pattern rules to a document's segments and collects every match.
 *
 * Segments are scanned in order and, within a segment, rules in priority order; each
 * rule contributes all of its non-overlapping matches. When two rules hit exactly the
 * same span only the higher-priority one is kept.
 */
@Service
@Slf4j
public class FieldExtractor {

    static final String COMPOSITE_SEPARATOR = " / ";

    public FieldExtraction extract(SegmentedDocument document, List<Segment> segments, FieldDefinition field) {
        try {
            List<MatchCandidate> candidates = collect(document, segments, field);
            candidates.sort(MatchCandidate.PRIMARY_ORDER);
            log.debug("Field '{}' on {}: {} candidates",
                    field.getKey(), document.getDocument().getIdentifier(), candidates.size());
            return new FieldExtraction(field, List.copyOf(candidates));
        } catch (RuntimeException | StackOverflowError e) {
            // catastrophic backtracking and normalizer bugs stay scoped to this cell
            throw new ExtractionException(document.getDocumentId(), field.getKey(), e);
        }
    }

    private List<MatchCandidate> collect(SegmentedDocument document, List<Segment> segments, FieldDefinition field) {
        List<MatchCandidate> candidates = new ArrayList<>();
        Set<Long> seenSpans = new HashSet<>();

        for (Segment segment : segments) {
            for (PatternRule rule : field.getRules()) {
                Matcher m = rule.getPattern().matcher(segment.getText());
                while (m.find()) {
                    ValueSpan span = field.getType() == FieldType.COMPOSITE
                            ? mergedGroups(m)
                            : singleGroup(m, rule.getGroup());
                    if (span == null) continue;

                    int charStart = segment.getStartOffset() + span.start;
                    int charEnd = segment.getStartOffset() + span.end;
                    if (!seenSpans.add(((long) charStart << 32) | charEnd)) continue;

                    NormalizationResult normalized = rule.getNormalizer().normalize(span.text);
                    candidates.add(MatchCandidate.builder()
                            .fieldKey(field.getKey())
                            .documentId(document.getDocumentId())
                            .segment(segment)
                            .rawText(span.text)
                            .normalizedValue(normalized.isSuccess() ? normalized.getValue() : null)
                            .charStart(charStart)
                            .charEnd(charEnd)
                            .priority(rule.getPriority())
                            .ruleRank(rule.getRank())
                            .build());
                }
            }
        }
        return candidates;
    }

    private ValueSpan singleGroup(Matcher m, int group) {
        if (m.start(group) < 0) return null;        // optional group did not participate
        String text = TextCleaner.compact(m.group(group));
        return text.isEmpty() ? null : new ValueSpan(text, m.start(group), m.end(group));
    }

    /**
     * Composite value: every participating, non-blank capture group in group order,
     * joined by {@value #COMPOSITE_SEPARATOR}. The span covers the first to the last of them.
     */
    private ValueSpan mergedGroups(Matcher m) {
        if (m.groupCount() == 0) {
            return singleGroup(m, 0);
        }
        List<String> parts = new ArrayList<>();
        int start = -1;
        int end = -1;
        for (int g = 1; g <= m.groupCount(); g++) {
            if (m.start(g) < 0) continue;
            String part = TextCleaner.compact(m.group(g));
            if (part.isEmpty()) continue;
            parts.add(part);
            start = start < 0 ? m.start(g) : Math.min(start, m.start(g));
            end = Math.max(end, m.end(g));
        }
        return parts.isEmpty() ? null : new ValueSpan(String.join(COMPOSITE_SEPARATOR, parts), start, end);
    }

    private static final class ValueSpan {
        final String text;
        final int start;
        final int end;

        ValueSpan(String text, int start, int end) {
            this.text = text;
            this.start = start;
            this.end = end;
        }
    }
}
