package com.legalreview.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String id;
    private JobMode mode;
    private JobStatus status;
    private String templateId;
    private String templatePath;                    // resource the run loads its template from

    private Instant createdAt;
    private Instant startedAt;
    private Instant finishedAt;

    private String errorMessage;                    // job-level failure summary

    @Builder.Default
    private List<DocumentError> documentErrors = new ArrayList<>();

    // What the run actually processed, in canonical order
    @Builder.Default
    private List<DocumentSummary> documents = new ArrayList<>();

    @Builder.Default
    private List<FieldSummary> fields = new ArrayList<>();
}
