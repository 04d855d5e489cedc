package com.legalreview.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.legalreview.extraction.model.Citation;
import jakarta.persistence.Converter;

@Converter
public class CitationConverter extends JsonAttributeConverter<Citation> {

    public CitationConverter() {
        super(new TypeReference<Citation>() {});
    }

    @Override
    protected Citation emptyValue() {
        return null;
    }
}
