package com.legalreview.extraction.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.legalreview.extraction.service.ValueNormalizer;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed set of field types. Each type carries the normalizer used when a
 * template does not name one explicitly.
 */
public enum FieldType {
    TEXT(ValueNormalizer.TEXT),
    DATE(ValueNormalizer.DATE),
    CURRENCY(ValueNormalizer.CURRENCY),
    COMPOSITE(ValueNormalizer.TEXT);

    private final ValueNormalizer defaultNormalizer;

    FieldType(ValueNormalizer defaultNormalizer) {
        this.defaultNormalizer = defaultNormalizer;
    }

    public ValueNormalizer getDefaultNormalizer() {
        return defaultNormalizer;
    }

    @JsonValue
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<FieldType> fromId(String id) {
        return Arrays.stream(values())
                .filter(t -> t.id().equalsIgnoreCase(id.trim()))
                .findFirst();
    }
}
