package com.legalreview.extraction.entity;

import com.legalreview.extraction.model.AuditAction;
import com.legalreview.extraction.model.ReviewState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Append-only audit row. No column is updatable.
 */
@Entity
@Table(name = "cell_audit_log",
       uniqueConstraints = @UniqueConstraint(columnNames = {"cell_id", "seq_no"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "cell_id", nullable = false, updatable = false, length = 64)
    private String cellId;

    @Column(name = "seq_no", nullable = false, updatable = false)
    private long sequence;

    @Column(name = "actor", nullable = false, updatable = false)
    private String actor;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "audit_action", nullable = false, updatable = false)
    private AuditAction action;

    @Column(name = "reason", length = 2000, updatable = false)
    private String reason;

    @Column(name = "before_value", length = 20000, updatable = false)
    private String beforeValue;

    @Column(name = "before_value_raw", length = 20000, updatable = false)
    private String beforeValueRaw;

    @Enumerated(EnumType.STRING)
    @Column(name = "before_state", nullable = false, updatable = false)
    private ReviewState beforeState;

    @Column(name = "after_value", length = 20000, updatable = false)
    private String afterValue;

    @Column(name = "after_value_raw", length = 20000, updatable = false)
    private String afterValueRaw;

    @Enumerated(EnumType.STRING)
    @Column(name = "after_state", nullable = false, updatable = false)
    private ReviewState afterState;
}
