package com.legalreview.extraction.repository;

import com.legalreview.extraction.model.AuditEntry;
import com.legalreview.extraction.model.Cell;
import com.legalreview.extraction.model.Job;
import com.legalreview.extraction.model.JobStatus;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. Objects are copied on the way in and out so callers never share
 * mutable state with the store.
 */
@Repository
@ConditionalOnProperty(prefix = "review", name = "store", havingValue = "memory")
public class InMemoryReviewStore implements ReviewStore {

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();
    private final Map<String, Cell> cells = new ConcurrentHashMap<>();
    private final Map<String, List<String>> cellIdsByJob = new ConcurrentHashMap<>();
    private final Map<String, List<AuditEntry>> auditByCell = new ConcurrentHashMap<>();

    @Override
    public void saveJob(Job job) {
        jobs.put(job.getId(), copy(job));
    }

    @Override
    public Optional<Job> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(InMemoryReviewStore::copy);
    }

    @Override
    public Optional<Job> findLatestJob(JobStatus status) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == status && j.getFinishedAt() != null)
                .max(Comparator.comparing(Job::getFinishedAt))
                .map(InMemoryReviewStore::copy);
    }

    @Override
    public void saveAll(List<Cell> batch) {
        for (Cell cell : batch) {
            cells.put(cell.getCellId(), copy(cell));
            List<String> ids = cellIdsByJob.computeIfAbsent(cell.getJobId(), id -> new ArrayList<>());
            synchronized (ids) {
                ids.add(cell.getCellId());
            }
        }
    }

    @Override
    public void save(Cell cell) {
        if (cells.replace(cell.getCellId(), copy(cell)) == null) {
            saveAll(List.of(cell));
        }
    }

    @Override
    public Optional<Cell> findCell(String cellId) {
        return Optional.ofNullable(cells.get(cellId)).map(InMemoryReviewStore::copy);
    }

    @Override
    public List<Cell> load(String jobId) {
        List<String> ids = cellIdsByJob.getOrDefault(jobId, List.of());
        synchronized (ids) {
            return ids.stream().map(cells::get).filter(Objects::nonNull).map(InMemoryReviewStore::copy).toList();
        }
    }

    @Override
    public void append(AuditEntry entry) {
        List<AuditEntry> entries = auditByCell.computeIfAbsent(entry.getCellId(), id -> new ArrayList<>());
        synchronized (entries) {
            checkSequence(entries, entry);
            entries.add(entry);
        }
    }

    @Override
    public void saveReview(Cell cell, AuditEntry entry) {
        List<AuditEntry> entries = auditByCell.computeIfAbsent(entry.getCellId(), id -> new ArrayList<>());
        synchronized (entries) {
            checkSequence(entries, entry);
            save(cell);
            entries.add(entry);
        }
    }

    private static void checkSequence(List<AuditEntry> entries, AuditEntry entry) {
        long expected = entries.isEmpty() ? 1 : entries.get(entries.size() - 1).getSequence() + 1;
        if (entry.getSequence() != expected) {
            throw new IllegalStateException("Audit sequence " + entry.getSequence()
                    + " for cell " + entry.getCellId() + " does not follow " + (expected - 1));
        }
    }

    @Override
    public List<AuditEntry> findAudit(String cellId) {
        List<AuditEntry> entries = auditByCell.getOrDefault(cellId, List.of());
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    private static Cell copy(Cell cell) {
        return cell.toBuilder().confidenceReasons(new ArrayList<>(cell.getConfidenceReasons())).build();
    }

    private static Job copy(Job job) {
        return job.toBuilder()
                .documentErrors(new ArrayList<>(job.getDocumentErrors()))
                .documents(new ArrayList<>(job.getDocuments()))
                .fields(new ArrayList<>(job.getFields()))
                .build();
    }
}
