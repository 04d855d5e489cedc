package com.legalreview.extraction.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.legalreview.extraction.exception.TemplateValidationException;
import com.legalreview.extraction.model.ExtractionTemplate;
import com.legalreview.extraction.model.FieldDefinition;
import com.legalreview.extraction.model.FieldType;
import com.legalreview.extraction.model.PatternRule;
import com.legalreview.extraction.model.TemplateDefinition;
import com.legalreview.extraction.model.TemplateDefinition.FieldSpec;
import com.legalreview.extraction.model.TemplateDefinition.PatternSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Reads a template file and turns it into a validated, compiled {@link ExtractionTemplate}.
 *
 * Every problem found is collected and reported together; a template with any
 * problem is rejected as a whole.
 */
@Service
@Slf4j
public class TemplateLoader {

    static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;
    private static final int IMPLICIT_PRIORITY_STEP = 10;

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public TemplateLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    /**
     * @param location a Spring resource location, e.g. {@code classpath:templates/x.json} or {@code file:/...}
     */
    public ExtractionTemplate load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new TemplateValidationException(location, List.of("template file not found"));
        }
        try (InputStream in = resource.getInputStream()) {
            return load(in, location);
        } catch (IOException e) {
            throw new TemplateValidationException(location, "unreadable template: " + e.getMessage(), e);
        }
    }

    public ExtractionTemplate load(InputStream in, String source) {
        TemplateDefinition definition;
        try {
            definition = objectMapper.readValue(in, TemplateDefinition.class);
        } catch (IOException e) {
            throw new TemplateValidationException(source, "malformed template JSON: " + e.getMessage(), e);
        }
        ExtractionTemplate template = compile(definition, source);
        log.info("Loaded template '{}' with {} fields from {}",
                template.getTemplateId(), template.getFields().size(), source);
        return template;
    }

    ExtractionTemplate compile(TemplateDefinition definition, String source) {
        List<String> problems = new ArrayList<>();
        if (definition == null || definition.getFields() == null || definition.getFields().isEmpty()) {
            throw new TemplateValidationException(source, List.of("template declares no fields"));
        }

        Set<String> keys = new HashSet<>();
        List<FieldDefinition> fields = new ArrayList<>();

        for (int i = 0; i < definition.getFields().size(); i++) {
            FieldSpec spec = definition.getFields().get(i);
            String where = "fields[" + i + "]";

            if (spec == null) {
                problems.add(where + ": empty field entry");
                continue;
            }
            if (spec.getKey() == null || spec.getKey().isBlank()) {
                problems.add(where + ": missing key");
                continue;
            }
            String key = spec.getKey().trim();
            where = "field '" + key + "'";
            if (!keys.add(key)) {
                problems.add(where + ": duplicate key");
            }

            FieldType type = resolveType(spec, where, problems);
            Optional<FieldDefinition> field = compileField(spec, key, type, where, problems);
            field.ifPresent(fields::add);
        }

        if (!problems.isEmpty()) {
            throw new TemplateValidationException(source, problems);
        }

        String templateId = definition.getTemplateId() == null || definition.getTemplateId().isBlank()
                ? source
                : definition.getTemplateId();
        return new ExtractionTemplate(templateId, definition.getDescription(), List.copyOf(fields));
    }

    private FieldType resolveType(FieldSpec spec, String where, List<String> problems) {
        if (spec.getType() == null || spec.getType().isBlank()) {
            return FieldType.TEXT;
        }
        Optional<FieldType> type = FieldType.fromId(spec.getType());
        if (type.isEmpty()) {
            problems.add(where + ": unknown type '" + spec.getType() + "'");
            return FieldType.TEXT;
        }
        return type.get();
    }

    private Optional<FieldDefinition> compileField(FieldSpec spec, String key, FieldType type,
                                                   String where, List<String> problems) {
        ValueNormalizer fieldNormalizer = type.getDefaultNormalizer();
        if (spec.getNormalizer() != null) {
            Optional<ValueNormalizer> named = ValueNormalizer.fromId(spec.getNormalizer());
            if (named.isEmpty()) {
                problems.add(where + ": unknown normalizer '" + spec.getNormalizer() + "'");
            } else {
                fieldNormalizer = named.get();
            }
        }

        List<PatternSpec> patterns = spec.getPatterns() == null ? List.of() : spec.getPatterns();
        if (patterns.isEmpty()) {
            problems.add(where + ": no patterns");
            return Optional.empty();
        }

        int problemsBefore = problems.size();
        Set<Integer> priorities = new HashSet<>();
        List<PatternRule> rules = new ArrayList<>();

        for (int p = 0; p < patterns.size(); p++) {
            PatternSpec patternSpec = patterns.get(p);
            String patternWhere = where + " patterns[" + p + "]";

            if (patternSpec == null || patternSpec.getRegex() == null || patternSpec.getRegex().isEmpty()) {
                problems.add(patternWhere + ": missing regex");
                continue;
            }

            Pattern compiled;
            try {
                compiled = Pattern.compile(patternSpec.getRegex(), PATTERN_FLAGS);
            } catch (PatternSyntaxException e) {
                problems.add(patternWhere + ": regex does not compile (" + e.getDescription() + ")");
                continue;
            }

            int groupCount = compiled.matcher("").groupCount();
            int group;
            if (type == FieldType.COMPOSITE) {
                // composite values merge every capture group
                if (patternSpec.getGroup() != null) {
                    problems.add(patternWhere + ": group is not used by composite fields, all groups are merged");
                    continue;
                }
                group = 0;
            } else {
                group = patternSpec.getGroup() != null ? patternSpec.getGroup() : (groupCount > 0 ? 1 : 0);
            }
            if (group < 0 || group > groupCount) {
                problems.add(patternWhere + ": group " + group + " but regex has " + groupCount + " groups");
                continue;
            }

            // Unspecified priorities follow declaration order, first pattern highest
            int priority = patternSpec.getPriority() != null
                    ? patternSpec.getPriority()
                    : (patterns.size() - p) * IMPLICIT_PRIORITY_STEP;
            if (!priorities.add(priority)) {
                problems.add(patternWhere + ": duplicate priority " + priority);
                continue;
            }

            ValueNormalizer normalizer = fieldNormalizer;
            if (patternSpec.getNormalizer() != null) {
                Optional<ValueNormalizer> named = ValueNormalizer.fromId(patternSpec.getNormalizer());
                if (named.isEmpty()) {
                    problems.add(patternWhere + ": unknown normalizer '" + patternSpec.getNormalizer() + "'");
                    continue;
                }
                normalizer = named.get();
            }

            rules.add(PatternRule.builder()
                    .pattern(compiled)
                    .priority(priority)
                    .group(group)
                    .normalizer(normalizer)
                    .build());
        }

        if (problems.size() > problemsBefore) {
            return Optional.empty();
        }

        List<PatternRule> sorted = rules.stream()
                .sorted(Comparator.comparingInt(PatternRule::getPriority).reversed())
                .toList();
        List<PatternRule> ranked = new ArrayList<>(sorted.size());
        for (int rank = 0; rank < sorted.size(); rank++) {
            ranked.add(sorted.get(rank).toBuilder().rank(rank).build());
        }

        String label = spec.getLabel() == null || spec.getLabel().isBlank() ? key : spec.getLabel();
        return Optional.of(FieldDefinition.builder()
                .key(key)
                .label(label)
                .type(type)
                .rules(List.copyOf(ranked))
                .build());
    }
}
