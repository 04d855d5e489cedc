package com.legalreview.extraction.service;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Whitespace rules shared by the segmenters, the extractor and the citation builder.
 */
public final class TextCleaner {

    private static final Pattern ANY_WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final Pattern INLINE_WHITESPACE = Pattern.compile("[ \\t\\f\\u000B\\u00A0]+");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r\\n?");

    private TextCleaner() {
    }

    /**
     * Collapses every whitespace run (line breaks included) to a single space and trims.
     */
    public static String compact(String text) {
        if (text == null) return "";
        return ANY_WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Canonical form of a page or section: unix line breaks, single spaces inside
     * lines, trimmed lines, no blank lines.
     */
    public static String normalizeBlock(String text) {
        if (text == null || text.isEmpty()) return "";
        String unix = LINE_BREAK.matcher(text).replaceAll("\n");
        return Arrays.stream(unix.split("\n"))
                .map(line -> INLINE_WHITESPACE.matcher(line).replaceAll(" ").trim())
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }
}
