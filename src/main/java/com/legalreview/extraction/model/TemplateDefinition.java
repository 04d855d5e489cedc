package com.legalreview.extraction.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw shape of a template file, as read from JSON. Nothing here is validated yet.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateDefinition {

    @JsonProperty("template_id")
    private String templateId;

    private String description;

    private List<FieldSpec> fields = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FieldSpec {
        private String key;
        private String label;
        private String type;
        private String normalizer;
        private List<PatternSpec> patterns = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PatternSpec {
        private String regex;
        private Integer priority;
        private Integer group;
        private String normalizer;
    }
}
