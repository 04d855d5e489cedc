package com.legalreview.extraction.model;

import java.util.Locale;
import java.util.Optional;

public enum DocumentFormat {
    PDF,
    HTML;

    /**
     * Resolves the format from a file name extension (.pdf, .html, .htm).
     */
    public static Optional<DocumentFormat> fromFileName(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) return Optional.of(PDF);
        if (lower.endsWith(".html") || lower.endsWith(".htm")) return Optional.of(HTML);
        return Optional.empty();
    }
}
