package com.legalreview.extraction.entity;

import com.legalreview.extraction.model.DocumentError;
import com.legalreview.extraction.model.DocumentSummary;
import com.legalreview.extraction.model.FieldSummary;
import com.legalreview.extraction.model.JobMode;
import com.legalreview.extraction.model.JobStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "extraction_jobs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {

    @Id
    @Column(length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(name = "job_mode", nullable = false)
    private JobMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private JobStatus status;

    @Column(name = "template_id")
    private String templateId;

    @Column(name = "template_path", length = 1000)
    private String templatePath;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Convert(converter = DocumentErrorListConverter.class)
    @Column(name = "document_errors", length = 100000)
    @Builder.Default
    private List<DocumentError> documentErrors = new ArrayList<>();

    @Convert(converter = DocumentSummaryListConverter.class)
    @Column(name = "documents", length = 100000)
    @Builder.Default
    private List<DocumentSummary> documents = new ArrayList<>();

    @Convert(converter = FieldSummaryListConverter.class)
    @Column(name = "fields", length = 100000)
    @Builder.Default
    private List<FieldSummary> fields = new ArrayList<>();
}
