package com.legalreview.extraction.controller;

import com.legalreview.extraction.exception.DocumentUploadException;
import com.legalreview.extraction.exception.ResourceNotFoundException;
import com.legalreview.extraction.exception.ReviewValidationException;
import com.legalreview.extraction.exception.StaleCellException;
import com.legalreview.extraction.model.*;
import com.legalreview.extraction.service.DocumentSource;
import com.legalreview.extraction.service.DocumentUploadService;
import com.legalreview.extraction.service.ExtractionJobService;
import com.legalreview.extraction.service.ReviewService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Slf4j
public class ReviewController {

    private final ExtractionJobService jobService;
    private final ReviewService reviewService;
    private final DocumentSource documentSource;
    private final DocumentUploadService uploadService;

    public ReviewController(ExtractionJobService jobService,
                            ReviewService reviewService,
                            DocumentSource documentSource,
                            DocumentUploadService uploadService) {
        this.jobService = jobService;
        this.reviewService = reviewService;
        this.documentSource = documentSource;
        this.uploadService = uploadService;
    }

    @GetMapping("/documents")
    public List<DocumentSummary> documents() {
        return documentSource.listDocuments().stream().map(DocumentSummary::of).toList();
    }

    /**
     * Upload a PDF or HTML document. It takes part in every run started afterwards.
     */
    @PostMapping("/documents/upload")
    public DocumentSummary upload(@RequestParam("file") MultipartFile file) {
        return uploadService.store(file);
    }

    /**
     * Starts a run. With {@code wait=true} the response is sent once the job is terminal.
     */
    @PostMapping("/runs")
    public ResponseEntity<Job> run(@RequestBody(required = false) RunRequest request) {
        RunRequest run = request == null ? new RunRequest() : request;
        if (run.isWait()) {
            return ResponseEntity.ok(jobService.runAndWait(run.getMode(), run.getTemplatePath()).getJob());
        }
        JobHandle handle = jobService.submit(run.getMode(), run.getTemplatePath());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(jobService.job(handle.getJobId()));
    }

    @GetMapping("/jobs/{jobId}")
    public Job job(@PathVariable String jobId) {
        return jobService.job(jobId);
    }

    /**
     * Result table of a job; the most recent successful job when none is given.
     */
    @GetMapping("/results")
    public JobResult results(@RequestParam(name = "job_id", required = false) String jobId) {
        if (jobId != null) {
            return jobService.result(jobId);
        }
        return jobService.latestSucceededJob()
                .map(job -> jobService.result(job.getId()))
                .orElseGet(() -> JobResult.empty(null));
    }

    @PatchMapping("/cells/{cellId}")
    public Cell review(@PathVariable String cellId, @RequestBody ReviewAction action) {
        return reviewService.review(cellId, action);
    }

    @GetMapping("/cells/{cellId}/audit")
    public List<AuditEntry> audit(@PathVariable String cellId) {
        return reviewService.history(cellId);
    }

    // ─── ERRORS ────────────────────────────────────────────────────────

    @ExceptionHandler({ReviewValidationException.class, DocumentUploadException.class})
    public ResponseEntity<Map<String, String>> badRequest(RuntimeException e) {
        return error(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ResourceNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(StaleCellException.class)
    public ResponseEntity<Map<String, String>> conflict(StaleCellException e) {
        return error(HttpStatus.CONFLICT, e);
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, RuntimeException e) {
        log.warn("Request rejected ({}): {}", status.value(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of("status", "ERROR", "message", e.getMessage()));
    }
}
