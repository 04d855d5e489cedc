package com.legalreview.extraction.service;

import com.legalreview.extraction.model.AuditAction;
import com.legalreview.extraction.model.AuditEntry;
import com.legalreview.extraction.model.Cell;
import com.legalreview.extraction.model.CellSnapshot;
import com.legalreview.extraction.model.ConfidenceScore;
import com.legalreview.extraction.model.FieldDefinition;
import com.legalreview.extraction.model.FieldExtraction;
import com.legalreview.extraction.model.MatchCandidate;
import com.legalreview.extraction.model.ReasonCode;
import com.legalreview.extraction.model.ReviewAction;
import com.legalreview.extraction.model.ReviewOutcome;
import com.legalreview.extraction.model.ReviewState;
import com.legalreview.extraction.model.SourceDocument;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;

/**
 * Builds cells from extraction output and applies review transitions to them.
 *
 * Both operations are pure: persistence, locking and version checks belong to the caller.
 */
@Service
public class CellMaterializer {

    private final ConfidenceScorer scorer;
    private final CitationBuilder citationBuilder;

    public CellMaterializer(ConfidenceScorer scorer, CitationBuilder citationBuilder) {
        this.scorer = scorer;
        this.citationBuilder = citationBuilder;
    }

    public Cell materialize(String jobId, SourceDocument document, FieldExtraction extraction) {
        ConfidenceScore score = scorer.score(extraction);
        MatchCandidate primary = extraction.getPrimary();
        Cell.CellBuilder cell = baseCell(jobId, document, extraction.getField())
                .confidence(score.getScore())
                .confidenceReasons(new ArrayList<>(score.getReasons()));

        if (primary == null) {
            return cell.reviewState(ReviewState.MISSING_DATA).build();
        }

        String value = primary.isNormalized() ? primary.getNormalizedValue() : primary.getRawText();
        return cell
                .value(value)
                .valueRaw(primary.getRawText())
                .valueNormalized(primary.getNormalizedValue())
                .reviewState(ReviewState.EXTRACTED)
                .citation(citationBuilder.build(document, primary))
                .build();
    }

    /**
     * Placeholder cell for a field that could not be evaluated at all.
     */
    public Cell failed(String jobId, SourceDocument document, FieldDefinition field, ReasonCode reason) {
        ConfidenceScore score = scorer.failed(reason);
        return baseCell(jobId, document, field)
                .confidence(score.getScore())
                .confidenceReasons(new ArrayList<>(score.getReasons()))
                .reviewState(ReviewState.MISSING_DATA)
                .build();
    }

    /**
     * Applies a validated review action. The returned cell carries the next version and the
     * audit entry the given sequence number.
     */
    public ReviewOutcome review(Cell current, ReviewAction action, long sequence, Instant timestamp) {
        ReviewState target = action.getManualValue() != null ? ReviewState.MANUAL_UPDATED : action.getReviewState();
        if (!current.getReviewState().canTransitionTo(target)) {
            throw new IllegalStateException("No transition " + current.getReviewState() + " -> " + target);
        }

        Cell.CellBuilder next = current.toBuilder()
                .reviewState(target)
                .version(current.getVersion() + 1);
        if (target == ReviewState.MANUAL_UPDATED) {
            next.value(action.getManualValue());
        }
        Cell updated = next.build();

        AuditEntry entry = AuditEntry.builder()
                .cellId(current.getCellId())
                .sequence(sequence)
                .actor(action.getActor())
                .timestamp(timestamp)
                .action(auditAction(target))
                .reason(action.getReason())
                .before(CellSnapshot.of(current))
                .after(CellSnapshot.of(updated))
                .build();
        return new ReviewOutcome(updated, entry);
    }

    private Cell.CellBuilder baseCell(String jobId, SourceDocument document, FieldDefinition field) {
        return Cell.builder()
                .cellId(UUID.randomUUID().toString().replace("-", ""))
                .jobId(jobId)
                .documentId(document.getId())
                .documentIdentifier(document.getIdentifier())
                .fieldKey(field.getKey())
                .fieldLabel(field.getLabel())
                .fieldType(field.getType())
                .version(0L);
    }

    private static AuditAction auditAction(ReviewState target) {
        return switch (target) {
            case CONFIRMED -> AuditAction.CONFIRM;
            case REJECTED -> AuditAction.REJECT;
            default -> AuditAction.MANUAL_EDIT;
        };
    }
}
