package com.legalreview.extraction.service;

import com.legalreview.extraction.model.NormalizationResult;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The closed set of value normalizers a template may reference by id.
 */
@Slf4j
public enum ValueNormalizer {

    TEXT("text") {
        @Override
        public NormalizationResult normalize(String raw) {
            String cleaned = TextCleaner.compact(raw);
            return cleaned.isEmpty() ? NormalizationResult.failed() : NormalizationResult.of(cleaned);
        }
    },

    /** Month-name, numeric US and ISO dates, rendered as ISO-8601. */
    DATE("date") {
        @Override
        public NormalizationResult normalize(String raw) {
            String cleaned = TextCleaner.compact(raw);
            if (cleaned.isEmpty()) return NormalizationResult.failed();

            Optional<LocalDate> whole = parseDate(cleaned);
            if (whole.isPresent()) {
                return NormalizationResult.of(whole.get().toString());
            }
            // Date embedded in surrounding words, e.g. "effective as of March 3, 2021"
            Matcher m = DATE_TOKEN.matcher(cleaned);
            while (m.find()) {
                Optional<LocalDate> embedded = parseDate(m.group());
                if (embedded.isPresent()) {
                    return NormalizationResult.of(embedded.get().toString());
                }
            }
            return NormalizationResult.failed();
        }
    },

    /** "USD $1,250.50" becomes "$1250.50". */
    CURRENCY("currency") {
        @Override
        public NormalizationResult normalize(String raw) {
            Matcher m = AMOUNT.matcher(raw == null ? "" : raw);
            if (!m.find()) return NormalizationResult.failed();

            String symbol = m.group("symbol") == null ? "" : m.group("symbol");
            String amount = m.group("amount").replace(",", "");
            return NormalizationResult.of(symbol + amount);
        }
    };

    private static final Pattern AMOUNT = Pattern.compile(
            "(?<symbol>\\$)?\\s*(?<amount>[0-9]{1,3}(?:,[0-9]{3})+(?:\\.[0-9]+)?|[0-9]+(?:\\.[0-9]+)?)");

    private static final Pattern DATE_TOKEN = Pattern.compile(
            "(?i)\\b(?:[A-Z][a-z]{2,8}\\.?\\s+\\d{1,2}(?:st|nd|rd|th)?,?\\s+\\d{4}"
                    + "|\\d{1,2}(?:st|nd|rd|th)?\\s+(?:day\\s+of\\s+)?[A-Z][a-z]{2,8},?\\s+\\d{4}"
                    + "|\\d{4}-\\d{2}-\\d{2}"
                    + "|\\d{1,2}/\\d{1,2}/\\d{4})\\b");

    private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(?i)(\\d)(st|nd|rd|th)\\b");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            formatter("MMMM d, uuuu"),
            formatter("MMMM d uuuu"),
            formatter("MMM d, uuuu"),
            formatter("MMM d uuuu"),
            formatter("MMM. d, uuuu"),
            formatter("d MMMM uuuu"),
            formatter("d MMMM, uuuu"),
            formatter("d 'day of' MMMM, uuuu"),
            formatter("d 'day of' MMMM uuuu"),
            formatter("M/d/uuuu"),
            formatter("uuuu-MM-dd"));

    private final String id;

    ValueNormalizer(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public abstract NormalizationResult normalize(String raw);

    public static Optional<ValueNormalizer> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(n -> n.id.equalsIgnoreCase(id.trim()))
                .findFirst();
    }

    private static DateTimeFormatter formatter(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.US)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    private static Optional<LocalDate> parseDate(String text) {
        String candidate = ORDINAL_SUFFIX.matcher(text.trim()).replaceAll("$1");
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return Optional.of(LocalDate.parse(candidate, format));
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match date format {}", candidate, format);
            }
        }
        return Optional.empty();
    }
}
