package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One review transition of a cell. Entries are appended, never changed.
 */
@Value
@Builder
public class AuditEntry {

    String cellId;
    long sequence;              // 1, 2, 3 ... per cell
    String actor;
    Instant timestamp;
    AuditAction action;
    String reason;
    CellSnapshot before;
    CellSnapshot after;
}
