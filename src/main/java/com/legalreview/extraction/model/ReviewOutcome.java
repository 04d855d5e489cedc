package com.legalreview.extraction.model;

import lombok.Value;

/**
 * Result of one review transition: the updated cell and the audit entry recording it.
 */
@Value
public class ReviewOutcome {

    Cell cell;
    AuditEntry auditEntry;
}
