package com.legalreview.extraction.repository;

import com.legalreview.extraction.model.AuditEntry;
import com.legalreview.extraction.model.Cell;
import com.legalreview.extraction.model.Job;
import com.legalreview.extraction.model.JobStatus;

import java.util.List;
import java.util.Optional;

/**
 * Persistence capability handed to the job orchestrator and the review service.
 * Implementations must be safe for concurrent use.
 */
public interface ReviewStore {

    void saveJob(Job job);

    Optional<Job> findJob(String jobId);

    Optional<Job> findLatestJob(JobStatus status);

    /**
     * Stores the cells produced by a run. The list order is the canonical order
     * returned by {@link #load(String)}.
     */
    void saveAll(List<Cell> cells);

    /**
     * Stores the new state of an existing cell.
     */
    void save(Cell cell);

    Optional<Cell> findCell(String cellId);

    /**
     * Cells of a job in canonical order.
     */
    List<Cell> load(String jobId);

    /**
     * Appends an audit entry. Its sequence must directly follow the cell's last one.
     */
    void append(AuditEntry entry);

    List<AuditEntry> findAudit(String cellId);

    /**
     * Stores a reviewed cell together with the audit entry describing the change. Either
     * both are written or neither is; an out-of-sequence entry leaves the cell untouched.
     */
    void saveReview(Cell cell, AuditEntry entry);
}
