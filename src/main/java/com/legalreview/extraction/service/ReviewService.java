package com.legalreview.extraction.service;

import com.legalreview.extraction.exception.ResourceNotFoundException;
import com.legalreview.extraction.exception.ReviewValidationException;
import com.legalreview.extraction.exception.StaleCellException;
import com.legalreview.extraction.model.AuditEntry;
import com.legalreview.extraction.model.Cell;
import com.legalreview.extraction.model.ReviewAction;
import com.legalreview.extraction.model.ReviewOutcome;
import com.legalreview.extraction.model.ReviewState;
import com.legalreview.extraction.repository.ReviewStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies reviewer actions to cells.
 *
 * Actions against one cell are serialized by a lock taken from a fixed set of stripes,
 * so unknown or rarely reviewed ids never accumulate lock objects. Under that lock the
 * caller's expected version is checked, the audit sequence is assigned and the cell is
 * stored together with its audit entry in one {@link ReviewStore#saveReview} call.
 */
@Service
@Slf4j
public class ReviewService {

    private final ReviewStore store;
    private final CellMaterializer materializer;
    private final Clock clock;

    static final int LOCK_STRIPES = 64;

    private final ReentrantLock[] cellLocks = new ReentrantLock[LOCK_STRIPES];

    public ReviewService(ReviewStore store, CellMaterializer materializer, Clock clock) {
        this.store = store;
        this.materializer = materializer;
        this.clock = clock;
        for (int i = 0; i < cellLocks.length; i++) {
            cellLocks[i] = new ReentrantLock();
        }
    }

    public Cell review(String cellId, ReviewAction action) {
        validate(action);
        getCell(cellId);     // unknown ids fail before any lock is taken

        ReentrantLock lock = lockFor(cellId);
        lock.lock();
        try {
            Cell current = getCell(cellId);
            if (current.getVersion() != action.getExpectedVersion()) {
                throw new StaleCellException(cellId, action.getExpectedVersion(), current.getVersion());
            }

            List<AuditEntry> history = store.findAudit(cellId);
            long sequence = history.isEmpty() ? 1 : history.get(history.size() - 1).getSequence() + 1;

            ReviewOutcome outcome = materializer.review(current, action, sequence, clock.instant());
            store.saveReview(outcome.getCell(), outcome.getAuditEntry());

            log.info("Cell {} {} -> {} by {} (v{})", cellId, current.getReviewState(),
                    outcome.getCell().getReviewState(), action.getActor(), outcome.getCell().getVersion());
            return outcome.getCell();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(String cellId) {
        return cellLocks[Math.floorMod(cellId.hashCode(), LOCK_STRIPES)];
    }

    public Cell getCell(String cellId) {
        return store.findCell(cellId).orElseThrow(() -> new ResourceNotFoundException("Cell", cellId));
    }

    public List<AuditEntry> history(String cellId) {
        getCell(cellId);
        return store.findAudit(cellId);
    }

    private void validate(ReviewAction action) {
        if (action == null) {
            throw new ReviewValidationException("review action is required");
        }
        if (action.getActor() == null || action.getActor().isBlank()) {
            throw new ReviewValidationException("actor is required");
        }
        boolean hasState = action.getReviewState() != null;
        boolean hasValue = action.getManualValue() != null;
        if (hasState == hasValue) {
            throw new ReviewValidationException("exactly one of review_state or manual_value must be set");
        }
        if (hasState && action.getReviewState() != ReviewState.CONFIRMED
                && action.getReviewState() != ReviewState.REJECTED) {
            throw new ReviewValidationException("review_state must be CONFIRMED or REJECTED, got "
                    + action.getReviewState() + "; use manual_value for edits");
        }
        if (hasValue && action.getManualValue().isBlank()) {
            throw new ReviewValidationException("manual_value must not be blank");
        }
        if (action.getExpectedVersion() == null) {
            throw new ReviewValidationException("expected_version is required");
        }
    }
}
