package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class JobResult {

    Job job;
    List<DocumentSummary> documents;
    List<FieldSummary> fields;
    List<ResultRow> rows;

    public static JobResult empty(Job job) {
        return new JobResult(job, List.of(), List.of(), List.of());
    }

    /**
     * Cells of every row, flattened in canonical order (field, then document).
     */
    public List<Cell> allCells() {
        return rows.stream().flatMap(r -> r.getCells().stream()).toList();
    }
}
