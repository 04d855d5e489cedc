package com.legalreview.extraction.entity;

import com.fasterxml.jackson.core.type.TypeReference;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.List;

@Converter
public class JsonListConverter extends JsonAttributeConverter<List<String>> {

    public JsonListConverter() {
        super(new TypeReference<List<String>>() {});
    }

    @Override
    protected List<String> emptyValue() {
        return new ArrayList<>();
    }
}
