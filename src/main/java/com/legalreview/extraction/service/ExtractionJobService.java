package com.legalreview.extraction.service;

import com.legalreview.extraction.config.ReviewProperties;
import com.legalreview.extraction.exception.DocumentParseException;
import com.legalreview.extraction.exception.ExtractionException;
import com.legalreview.extraction.exception.ResourceNotFoundException;
import com.legalreview.extraction.exception.TemplateValidationException;
import com.legalreview.extraction.model.*;
import com.legalreview.extraction.repository.ReviewStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs extraction jobs: PENDING, then RUNNING, then SUCCEEDED or FAILED.
 *
 * A job executes on {@code jobExecutor}; its documents fan out on {@code documentExecutor}.
 * Each document is segmented, every selected field is extracted, scored, cited and
 * materialized into a cell. Cells are sorted into field-then-document order before they are
 * stored, whatever order the workers finished in.
 *
 * Parse and extraction errors stay scoped to their document or cell. A job only fails when
 * the template is rejected, there is nothing to process, or the store itself fails.
 */
@Service
@Slf4j
public class ExtractionJobService {

    private final ReviewStore store;
    private final DocumentSource documentSource;
    private final TemplateLoader templateLoader;
    private final DocumentSegmentationService segmentationService;
    private final FieldExtractor extractor;
    private final CellMaterializer materializer;
    private final ReviewProperties properties;
    private final Clock clock;
    private final Executor jobExecutor;
    private final Executor documentExecutor;

    public ExtractionJobService(ReviewStore store,
                                DocumentSource documentSource,
                                TemplateLoader templateLoader,
                                DocumentSegmentationService segmentationService,
                                FieldExtractor extractor,
                                CellMaterializer materializer,
                                ReviewProperties properties,
                                Clock clock,
                                @Qualifier("jobExecutor") Executor jobExecutor,
                                @Qualifier("documentExecutor") Executor documentExecutor) {
        this.store = store;
        this.documentSource = documentSource;
        this.templateLoader = templateLoader;
        this.segmentationService = segmentationService;
        this.extractor = extractor;
        this.materializer = materializer;
        this.properties = properties;
        this.clock = clock;
        this.jobExecutor = jobExecutor;
        this.documentExecutor = documentExecutor;
    }

    // ─── ACCESSORS ─────────────────────────────────────────────────────

    public JobHandle submit(JobMode mode) {
        return submit(mode, null);
    }

    /**
     * Creates a PENDING job and starts it on a worker. Returns immediately.
     *
     * @param templatePath Spring resource location of the template for this run, or
     *                     {@code null} for the configured default
     */
    public JobHandle submit(JobMode mode, String templatePath) {
        Job job = Job.builder()
                .id(UUID.randomUUID().toString().replace("-", ""))
                .mode(mode)
                .status(JobStatus.PENDING)
                .templatePath(templatePath == null || templatePath.isBlank()
                        ? properties.getTemplatePath()
                        : templatePath.trim())
                .createdAt(clock.instant())
                .build();
        store.saveJob(job);
        log.info("Submitted {} job {} with template {}", mode, job.getId(), job.getTemplatePath());

        CompletableFuture<Job> completion = CompletableFuture.supplyAsync(() -> run(job), jobExecutor);
        return new JobHandle(job.getId(), completion);
    }

    /**
     * Submits a job and blocks until it is terminal, then returns its result.
     */
    public JobResult runAndWait(JobMode mode) {
        return runAndWait(mode, null);
    }

    public JobResult runAndWait(JobMode mode, String templatePath) {
        Job finished = submit(mode, templatePath).await();
        return result(finished.getId());
    }

    public Job job(String jobId) {
        return store.findJob(jobId).orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    }

    public JobStatus status(String jobId) {
        return job(jobId).getStatus();
    }

    public Optional<Job> latestSucceededJob() {
        return store.findLatestJob(JobStatus.SUCCEEDED);
    }

    /**
     * Result table of a job: one row per field, each holding that field's cells in
     * document order. Jobs that have not succeeded yield no rows.
     */
    public JobResult result(String jobId) {
        Job job = job(jobId);
        if (job.getStatus() != JobStatus.SUCCEEDED) {
            return JobResult.empty(job);
        }

        Map<String, List<Cell>> cellsByField = store.load(jobId).stream()
                .collect(Collectors.groupingBy(Cell::getFieldKey, LinkedHashMap::new, Collectors.toList()));

        List<ResultRow> rows = job.getFields().stream()
                .map(field -> ResultRow.builder()
                        .fieldKey(field.getKey())
                        .fieldLabel(field.getLabel())
                        .fieldType(field.getType())
                        .cells(cellsByField.getOrDefault(field.getKey(), List.of()))
                        .build())
                .toList();

        return JobResult.builder()
                .job(job)
                .documents(job.getDocuments())
                .fields(job.getFields())
                .rows(rows)
                .build();
    }

    // ─── RUN ───────────────────────────────────────────────────────────

    Job run(Job job) {
        job.setStatus(JobStatus.RUNNING);
        job.setStartedAt(clock.instant());
        store.saveJob(job);

        try {
            ExtractionTemplate template;
            try {
                template = templateLoader.load(job.getTemplatePath());
            } catch (TemplateValidationException e) {
                return fail(job, e.getMessage());
            }
            job.setTemplateId(template.getTemplateId());

            List<SourceDocument> available = documentSource.listDocuments();
            if (available.isEmpty()) {
                return fail(job, "No documents available to process");
            }

            ExtractionScope scope = ExtractionScope.forMode(job.getMode(), properties);
            List<SourceDocument> documents = scope.selectDocuments(available);
            List<FieldDefinition> fields = scope.selectFields(template.getFields());

            List<CompletableFuture<DocumentOutcome>> futures = documents.stream()
                    .map(doc -> CompletableFuture.supplyAsync(
                            () -> extractDocument(job.getId(), doc, fields, scope), documentExecutor))
                    .toList();
            List<DocumentOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

            List<Cell> cells = outcomes.stream().flatMap(o -> o.cells.stream())
                    .sorted(canonicalOrder(documents, fields))
                    .toList();
            store.saveAll(cells);

            job.setDocuments(documents.stream().map(DocumentSummary::of).collect(Collectors.toCollection(ArrayList::new)));
            job.setFields(fields.stream().map(FieldDefinition::summary).collect(Collectors.toCollection(ArrayList::new)));
            job.setDocumentErrors(outcomes.stream().flatMap(o -> o.errors.stream())
                    .collect(Collectors.toCollection(ArrayList::new)));
            job.setStatus(JobStatus.SUCCEEDED);
            job.setFinishedAt(clock.instant());
            store.saveJob(job);

            log.info("Job {} succeeded: {} documents, {} fields, {} cells, {} errors",
                    job.getId(), documents.size(), fields.size(), cells.size(), job.getDocumentErrors().size());
            return job;
        } catch (RuntimeException e) {
            log.error("Job {} aborted", job.getId(), e);
            return fail(job, "Unexpected failure: " + e.getMessage());
        }
    }

    private Job fail(Job job, String message) {
        job.setStatus(JobStatus.FAILED);
        job.setErrorMessage(message);
        job.setFinishedAt(clock.instant());
        store.saveJob(job);
        log.error("Job {} failed: {}", job.getId(), message);
        return job;
    }

    private DocumentOutcome extractDocument(String jobId, SourceDocument document,
                                            List<FieldDefinition> fields, ExtractionScope scope) {
        DocumentOutcome outcome = new DocumentOutcome();

        SegmentedDocument segmented;
        try {
            segmented = segmentationService.segment(document);
        } catch (DocumentParseException e) {
            log.warn("Could not parse {}: {}", document.getIdentifier(), e.getMessage());
            outcome.errors.add(DocumentError.builder()
                    .documentId(document.getId())
                    .documentIdentifier(document.getIdentifier())
                    .reason(ReasonCode.PARSE_ERROR)
                    .message(e.getMessage())
                    .build());
            for (FieldDefinition field : fields) {
                outcome.cells.add(materializer.failed(jobId, document, field, ReasonCode.PARSE_ERROR));
            }
            return outcome;
        }

        List<Segment> segments = scope.selectSegments(segmented.getSegments());
        for (FieldDefinition field : fields) {
            try {
                FieldExtraction extraction = extractor.extract(segmented, segments, field);
                outcome.cells.add(materializer.materialize(jobId, document, extraction));
            } catch (ExtractionException e) {
                log.warn("Field '{}' failed on {}: {}", field.getKey(), document.getIdentifier(), e.getMessage());
                outcome.errors.add(DocumentError.builder()
                        .documentId(document.getId())
                        .documentIdentifier(document.getIdentifier())
                        .fieldKey(field.getKey())
                        .reason(ReasonCode.EXTRACTION_ERROR)
                        .message(e.getMessage())
                        .build());
                outcome.cells.add(materializer.failed(jobId, document, field, ReasonCode.EXTRACTION_ERROR));
            }
        }
        return outcome;
    }

    /**
     * Field declaration order, then document ingestion order.
     */
    private static Comparator<Cell> canonicalOrder(List<SourceDocument> documents, List<FieldDefinition> fields) {
        Map<String, Integer> fieldIndex = indexOf(fields, FieldDefinition::getKey);
        Map<String, Integer> documentIndex = indexOf(documents, SourceDocument::getId);
        return Comparator.<Cell>comparingInt(c -> fieldIndex.get(c.getFieldKey()))
                .thenComparingInt(c -> documentIndex.get(c.getDocumentId()));
    }

    private static <T> Map<String, Integer> indexOf(List<T> items, Function<T, String> key) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < items.size(); i++) {
            index.putIfAbsent(key.apply(items.get(i)), i);
        }
        return index;
    }

    private static final class DocumentOutcome {
        final List<Cell> cells = new ArrayList<>();
        final List<DocumentError> errors = new ArrayList<>();
    }
}
