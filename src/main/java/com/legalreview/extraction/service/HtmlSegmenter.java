package com.legalreview.extraction.service;

import com.legalreview.extraction.exception.DocumentParseException;
import com.legalreview.extraction.model.DocumentFormat;
import com.legalreview.extraction.model.LocationType;
import com.legalreview.extraction.model.SegmentDraft;
import com.legalreview.extraction.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits HTML filings into sections at ARTICLE / Section / numbered headings.
 *
 * A heading only opens a new section once the current one holds more than
 * {@value #MIN_SECTION_CHARS} characters, so a table of contents does not
 * explode into one section per line.
 */
@Component
@Slf4j
public class HtmlSegmenter implements DocumentSegmenter {

    static final int MIN_SECTION_CHARS = 250;
    private static final int MAX_LABEL_CHARS = 120;

    private static final Pattern SECTION_HEADING = Pattern.compile(
            "^(ARTICLE\\s+[IVXLC0-9]+\\b.*|Section\\s+[0-9A-Za-z.\\-]+\\b.*|\\d{1,2}\\.\\s+.+)$",
            Pattern.CASE_INSENSITIVE);

    // Browser-extension markup that ends up in saved filings
    private static final List<String> NOISE_MARKERS = List.of("screenity", "boomerang", "chrome-extension://");

    @Override
    public DocumentFormat getFormat() {
        return DocumentFormat.HTML;
    }

    @Override
    public List<SegmentDraft> split(SourceDocument document) {
        Document html = Jsoup.parse(new String(document.getRawBytes(), StandardCharsets.UTF_8));
        html.select("script, style, noscript").remove();
        html.select("[class*=screenity], [id*=screenity]").remove();

        List<String> lines = Arrays.stream(blockText(html.body()).split("\n"))
                .map(TextCleaner::compact)
                .filter(line -> !line.isEmpty() && !isNoise(line))
                .toList();

        if (lines.isEmpty()) {
            throw new DocumentParseException(document.getId(),
                    "HTML document " + document.getIdentifier() + " contains no extractable text");
        }

        List<SegmentDraft> sections = toSections(lines);
        log.debug("Split {} into {} sections", document.getIdentifier(), sections.size());
        return sections;
    }

    private List<SegmentDraft> toSections(List<String> lines) {
        List<SegmentDraft> sections = new ArrayList<>();
        List<String> current = new ArrayList<>();
        String currentLabel = null;
        int currentChars = 0;

        for (String line : lines) {
            if (SECTION_HEADING.matcher(line).matches() && currentChars > MIN_SECTION_CHARS) {
                sections.add(new SegmentDraft(LocationType.SECTION, currentLabel, String.join("\n", current)));
                current = new ArrayList<>();
                currentChars = 0;
                currentLabel = line.length() > MAX_LABEL_CHARS ? line.substring(0, MAX_LABEL_CHARS) : line;
            }
            current.add(line);
            currentChars += line.length() + 1;
        }

        if (!current.isEmpty()) {
            sections.add(new SegmentDraft(LocationType.SECTION, currentLabel, String.join("\n", current)));
        }
        return sections;
    }

    /**
     * Flattens the DOM to text with a line break around every block element.
     */
    private String blockText(Element root) {
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    out.append(((TextNode) node).text());
                } else if (node instanceof Element && breaksLine((Element) node)) {
                    out.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && breaksLine((Element) node)) {
                    out.append('\n');
                }
            }
        }, root);
        return out.toString();
    }

    private static boolean breaksLine(Element element) {
        return element.isBlock() || "br".equals(element.normalName());
    }

    private static boolean isNoise(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        return NOISE_MARKERS.stream().anyMatch(lower::contains);
    }
}
