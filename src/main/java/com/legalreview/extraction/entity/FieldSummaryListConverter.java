package com.legalreview.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.legalreview.extraction.model.FieldSummary;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class FieldSummaryListConverter extends JsonAttributeConverter<List<FieldSummary>> {

    public FieldSummaryListConverter() {
        super(new TypeReference<List<FieldSummary>>() {});
    }

    @Override
    protected List<FieldSummary> emptyValue() {
        return new ArrayList<>();
    }
}
