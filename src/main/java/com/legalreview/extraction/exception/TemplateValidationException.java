package com.legalreview.extraction.exception;

import java.util.List;

/**
 * Raised while loading an extraction template. Fatal for the run that tried to load it.
 */
public class TemplateValidationException extends RuntimeException {

    private final List<String> problems;

    public TemplateValidationException(String source, List<String> problems) {
        super("Invalid template '" + source + "': " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public TemplateValidationException(String source, String problem, Throwable cause) {
        super("Invalid template '" + source + "': " + problem, cause);
        this.problems = List.of(problem);
    }

    public List<String> getProblems() {
        return problems;
    }
}
