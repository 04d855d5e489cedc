package com.legalreview.extraction.entity;

import com.legalreview.extraction.model.Citation;
import com.legalreview.extraction.model.FieldType;
import com.legalreview.extraction.model.ReviewState;
import jakarta.persistence.*;
import lombok.*;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "review_cells",
       uniqueConstraints = @UniqueConstraint(columnNames = {"job_id", "document_id", "field_key"}),
       indexes = @Index(name = "idx_review_cells_job", columnList = "job_id, cell_order"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CellRecord {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "job_id", nullable = false, length = 64)
    private String jobId;

    @Column(name = "cell_order", nullable = false)
    private int position;               // canonical order within the job

    @Column(name = "document_id", nullable = false)
    private String documentId;

    @Column(name = "document_identifier", nullable = false)
    private String documentIdentifier;

    @Column(name = "field_key", nullable = false)
    private String fieldKey;

    @Column(name = "field_label")
    private String fieldLabel;

    @Enumerated(EnumType.STRING)
    @Column(name = "field_type", nullable = false)
    private FieldType fieldType;

    @Column(name = "cell_value", length = 20000)
    private String value;

    @Column(name = "value_raw", length = 20000, updatable = false)
    private String valueRaw;

    @Column(name = "value_normalized", length = 20000)
    private String valueNormalized;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Convert(converter = JsonListConverter.class)
    @Column(name = "confidence_reasons", nullable = false, length = 100000)
    @Builder.Default
    private List<String> confidenceReasons = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "review_state", nullable = false)
    private ReviewState reviewState;

    @Convert(converter = CitationConverter.class)
    @Column(name = "citation", length = 100000)
    private Citation citation;

    @Column(name = "row_version", nullable = false)
    private long version;
}
