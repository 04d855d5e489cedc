package com.legalreview.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.legalreview.extraction.model.DocumentSummary;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class DocumentSummaryListConverter extends JsonAttributeConverter<List<DocumentSummary>> {

    public DocumentSummaryListConverter() {
        super(new TypeReference<List<DocumentSummary>>() {});
    }

    @Override
    protected List<DocumentSummary> emptyValue() {
        return new ArrayList<>();
    }
}
