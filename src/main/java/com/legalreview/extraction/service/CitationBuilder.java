package com.legalreview.extraction.service;

import com.legalreview.extraction.config.ReviewProperties;
import com.legalreview.extraction.model.Citation;
import com.legalreview.extraction.model.MatchCandidate;
import com.legalreview.extraction.model.Segment;
import com.legalreview.extraction.model.SourceDocument;
import org.springframework.stereotype.Service;

/**
 * Turns a primary match into a citation. The snippet never leaves the match's segment;
 * "..." marks text cut off on either side.
 */
@Service
public class CitationBuilder {

    static final String ELLIPSIS = "...";

    private final int snippetRadius;

    public CitationBuilder(ReviewProperties properties) {
        this.snippetRadius = properties.getSnippetRadius();
    }

    public Citation build(SourceDocument document, MatchCandidate match) {
        Segment segment = match.getSegment();
        return Citation.builder()
                .documentId(document.getId())
                .documentIdentifier(document.getIdentifier())
                .locationType(segment.getLocationType())
                .location(segment.getLocation())
                .snippet(snippet(segment, match))
                .charStart(match.getCharStart())
                .charEnd(match.getCharEnd())
                .build();
    }

    String snippet(Segment segment, MatchCandidate match) {
        String text = segment.getText();
        int relativeStart = match.getCharStart() - segment.getStartOffset();
        int relativeEnd = match.getCharEnd() - segment.getStartOffset();

        int from = Math.max(0, relativeStart - snippetRadius);
        int to = Math.min(text.length(), relativeEnd + snippetRadius);

        StringBuilder snippet = new StringBuilder();
        if (from > 0) snippet.append(ELLIPSIS);
        snippet.append(TextCleaner.compact(text.substring(from, to)));
        if (to < text.length()) snippet.append(ELLIPSIS);
        return snippet.toString();
    }
}
