package com.legalreview.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import com.legalreview.extraction.model.DocumentError;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class DocumentErrorListConverter extends JsonAttributeConverter<List<DocumentError>> {

    public DocumentErrorListConverter() {
        super(new TypeReference<List<DocumentError>>() {});
    }

    @Override
    protected List<DocumentError> emptyValue() {
        return new ArrayList<>();
    }
}
