package com.legalreview.extraction.repository;

import com.legalreview.extraction.entity.AuditRecord;
import com.legalreview.extraction.entity.CellRecord;
import com.legalreview.extraction.entity.JobRecord;
import com.legalreview.extraction.model.AuditEntry;
import com.legalreview.extraction.model.Cell;
import com.legalreview.extraction.model.CellSnapshot;
import com.legalreview.extraction.model.Job;
import com.legalreview.extraction.model.JobStatus;
import com.legalreview.extraction.model.ReasonCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link ReviewStore} backed by Spring Data JPA. Maps between the domain model and the
 * persistence records; the domain objects never leave this class attached.
 */
@Repository
@ConditionalOnProperty(prefix = "review", name = "store", havingValue = "jpa", matchIfMissing = true)
@Slf4j
public class JpaReviewStore implements ReviewStore {

    private final JobRecordRepository jobRepo;
    private final CellRecordRepository cellRepo;
    private final AuditRecordRepository auditRepo;

    public JpaReviewStore(JobRecordRepository jobRepo,
                          CellRecordRepository cellRepo,
                          AuditRecordRepository auditRepo) {
        this.jobRepo = jobRepo;
        this.cellRepo = cellRepo;
        this.auditRepo = auditRepo;
    }

    @Override
    @Transactional
    public void saveJob(Job job) {
        jobRepo.save(toRecord(job));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> findJob(String jobId) {
        return jobRepo.findById(jobId).map(JpaReviewStore::toJob);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Job> findLatestJob(JobStatus status) {
        return jobRepo.findFirstByStatusOrderByFinishedAtDesc(status).map(JpaReviewStore::toJob);
    }

    @Override
    @Transactional
    public void saveAll(List<Cell> cells) {
        if (cells.isEmpty()) return;

        int position = (int) cellRepo.countByJobId(cells.get(0).getJobId());
        List<CellRecord> records = new ArrayList<>(cells.size());
        for (Cell cell : cells) {
            records.add(toRecord(cell, position++));
        }
        cellRepo.saveAll(records);
        log.debug("Stored {} cells for job {}", records.size(), cells.get(0).getJobId());
    }

    @Override
    @Transactional
    public void save(Cell cell) {
        Optional<CellRecord> existing = cellRepo.findById(cell.getCellId());
        if (existing.isEmpty()) {
            saveAll(List.of(cell));
            return;
        }
        CellRecord record = existing.get();
        record.setValue(cell.getValue());
        record.setValueNormalized(cell.getValueNormalized());
        record.setReviewState(cell.getReviewState());
        record.setVersion(cell.getVersion());
        cellRepo.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Cell> findCell(String cellId) {
        return cellRepo.findById(cellId).map(JpaReviewStore::toCell);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Cell> load(String jobId) {
        return cellRepo.findByJobIdOrderByPositionAsc(jobId).stream().map(JpaReviewStore::toCell).toList();
    }

    @Override
    @Transactional
    public void append(AuditEntry entry) {
        checkSequence(entry);
        auditRepo.save(toRecord(entry));
    }

    /**
     * One transaction for both rows: a failed audit insert rolls the cell update back.
     */
    @Override
    @Transactional
    public void saveReview(Cell cell, AuditEntry entry) {
        checkSequence(entry);
        save(cell);
        auditRepo.save(toRecord(entry));
    }

    private void checkSequence(AuditEntry entry) {
        long last = auditRepo.findFirstByCellIdOrderBySequenceDesc(entry.getCellId())
                .map(AuditRecord::getSequence)
                .orElse(0L);
        if (entry.getSequence() != last + 1) {
            throw new IllegalStateException("Audit sequence " + entry.getSequence()
                    + " for cell " + entry.getCellId() + " does not follow " + last);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEntry> findAudit(String cellId) {
        return auditRepo.findByCellIdOrderBySequenceAsc(cellId).stream().map(JpaReviewStore::toEntry).toList();
    }

    // ─── MAPPING ───────────────────────────────────────────────────────

    private static JobRecord toRecord(Job job) {
        return JobRecord.builder()
                .id(job.getId())
                .mode(job.getMode())
                .status(job.getStatus())
                .templateId(job.getTemplateId())
                .templatePath(job.getTemplatePath())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .finishedAt(job.getFinishedAt())
                .errorMessage(job.getErrorMessage())
                .documentErrors(new ArrayList<>(job.getDocumentErrors()))
                .documents(new ArrayList<>(job.getDocuments()))
                .fields(new ArrayList<>(job.getFields()))
                .build();
    }

    private static Job toJob(JobRecord record) {
        return Job.builder()
                .id(record.getId())
                .mode(record.getMode())
                .status(record.getStatus())
                .templateId(record.getTemplateId())
                .templatePath(record.getTemplatePath())
                .createdAt(record.getCreatedAt())
                .startedAt(record.getStartedAt())
                .finishedAt(record.getFinishedAt())
                .errorMessage(record.getErrorMessage())
                .documentErrors(copyOf(record.getDocumentErrors()))
                .documents(copyOf(record.getDocuments()))
                .fields(copyOf(record.getFields()))
                .build();
    }

    private static CellRecord toRecord(Cell cell, int position) {
        return CellRecord.builder()
                .id(cell.getCellId())
                .jobId(cell.getJobId())
                .position(position)
                .documentId(cell.getDocumentId())
                .documentIdentifier(cell.getDocumentIdentifier())
                .fieldKey(cell.getFieldKey())
                .fieldLabel(cell.getFieldLabel())
                .fieldType(cell.getFieldType())
                .value(cell.getValue())
                .valueRaw(cell.getValueRaw())
                .valueNormalized(cell.getValueNormalized())
                .confidence(cell.getConfidence())
                .confidenceReasons(cell.getConfidenceReasons().stream().map(Enum::name)
                        .collect(Collectors.toCollection(ArrayList::new)))
                .reviewState(cell.getReviewState())
                .citation(cell.getCitation())
                .version(cell.getVersion())
                .build();
    }

    private static Cell toCell(CellRecord record) {
        return Cell.builder()
                .cellId(record.getId())
                .jobId(record.getJobId())
                .documentId(record.getDocumentId())
                .documentIdentifier(record.getDocumentIdentifier())
                .fieldKey(record.getFieldKey())
                .fieldLabel(record.getFieldLabel())
                .fieldType(record.getFieldType())
                .value(record.getValue())
                .valueRaw(record.getValueRaw())
                .valueNormalized(record.getValueNormalized())
                .confidence(record.getConfidence())
                .confidenceReasons(copyOf(record.getConfidenceReasons()).stream().map(ReasonCode::valueOf)
                        .collect(Collectors.toCollection(ArrayList::new)))
                .reviewState(record.getReviewState())
                .citation(record.getCitation())
                .version(record.getVersion())
                .build();
    }

    private static AuditRecord toRecord(AuditEntry entry) {
        return AuditRecord.builder()
                .cellId(entry.getCellId())
                .sequence(entry.getSequence())
                .actor(entry.getActor())
                .recordedAt(entry.getTimestamp())
                .action(entry.getAction())
                .reason(entry.getReason())
                .beforeValue(entry.getBefore().getValue())
                .beforeValueRaw(entry.getBefore().getValueRaw())
                .beforeState(entry.getBefore().getReviewState())
                .afterValue(entry.getAfter().getValue())
                .afterValueRaw(entry.getAfter().getValueRaw())
                .afterState(entry.getAfter().getReviewState())
                .build();
    }

    private static AuditEntry toEntry(AuditRecord record) {
        return AuditEntry.builder()
                .cellId(record.getCellId())
                .sequence(record.getSequence())
                .actor(record.getActor())
                .timestamp(record.getRecordedAt())
                .action(record.getAction())
                .reason(record.getReason())
                .before(CellSnapshot.builder()
                        .value(record.getBeforeValue())
                        .valueRaw(record.getBeforeValueRaw())
                        .reviewState(record.getBeforeState())
                        .build())
                .after(CellSnapshot.builder()
                        .value(record.getAfterValue())
                        .valueRaw(record.getAfterValueRaw())
                        .reviewState(record.getAfterState())
                        .build())
                .build();
    }

    // Hibernate leaves converted columns null when the stored value was null
    private static <T> List<T> copyOf(List<T> list) {
        return list == null ? new ArrayList<>() : new ArrayList<>(list);
    }
}
