package com.legalreview.extraction.service;

import com.legalreview.extraction.TestFixtures;
import com.legalreview.extraction.config.ReviewProperties;
import com.legalreview.extraction.model.Citation;
import com.legalreview.extraction.model.LocationType;
import com.legalreview.extraction.model.MatchCandidate;
import com.legalreview.extraction.model.Segment;
import com.legalreview.extraction.model.SegmentDraft;
import com.legalreview.extraction.model.SegmentedDocument;
import com.legalreview.extraction.model.SourceDocument;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CitationBuilderTest {

    private static final String PAGE_ONE = "Cover page of the Master Services Agreement between Alpha and Beta.";
    private static final String PAGE_TWO = "Delaware law applies. This Agreement is governed by the laws of Delaware.\n"
            + "Notices go to the addresses listed above.";

    private SourceDocument document;
    private SegmentedDocument segmented;

    @BeforeEach
    void setUp() {
        document = TestFixtures.html("msa-1", "<p>unused</p>");
        segmented = new DocumentSegmentationService(List.of()).assemble(document, List.of(
                new SegmentDraft(LocationType.PAGE, null, PAGE_ONE),
                new SegmentDraft(LocationType.PAGE, null, PAGE_TWO)));
    }

    private static CitationBuilder builderWithRadius(int radius) {
        ReviewProperties properties = new ReviewProperties();
        properties.setSnippetRadius(radius);
        return new CitationBuilder(properties);
    }

    private MatchCandidate matchOf(String needle, int pageIndex, int occurrence) {
        Segment segment = segmented.getSegments().get(pageIndex);
        int at = -1;
        for (int i = 0; i <= occurrence; i++) {
            at = segment.getText().indexOf(needle, at + 1);
        }
        return MatchCandidate.builder()
                .fieldKey("governing_law")
                .documentId(document.getId())
                .segment(segment)
                .rawText(needle)
                .normalizedValue(needle)
                .charStart(segment.getStartOffset() + at)
                .charEnd(segment.getStartOffset() + at + needle.length())
                .priority(100)
                .build();
    }

    @Test
    void shouldLocateCitationOnMatchPage() {
        MatchCandidate match = matchOf("Delaware", 1, 1);

        Citation citation = builderWithRadius(80).build(document, match);

        assertThat(citation.getDocumentId()).isEqualTo("msa-1");
        assertThat(citation.getDocumentIdentifier()).isEqualTo("msa-1.html");
        assertThat(citation.getLocationType()).isEqualTo(LocationType.PAGE);
        assertThat(citation.getLocation()).isEqualTo(2);
        assertThat(citation.getCharStart()).isEqualTo(match.getCharStart());
        assertThat(citation.getCharEnd()).isEqualTo(match.getCharEnd());
        assertThat(citation.getCoordinates()).isNull();
        assertThat(segmented.getCanonicalText().substring(citation.getCharStart(), citation.getCharEnd()))
                .isEqualTo("Delaware");
    }

    @Test
    void shouldMarkTruncationOnBothSides() {
        // GIVEN
        MatchCandidate match = matchOf("Delaware", 1, 1);

        // WHEN
        String snippet = builderWithRadius(10).build(document, match).getSnippet();

        // THEN
        assertThat(snippet).isEqualTo("...e laws of Delaware. Notices...");
    }

    @Test
    void shouldNotMarkEllipsisWhenSegmentFits() {
        MatchCandidate match = matchOf("Delaware", 1, 0);

        String snippet = builderWithRadius(500).build(document, match).getSnippet();

        assertThat(snippet)
                .isEqualTo("Delaware law applies. This Agreement is governed by the laws of Delaware. "
                        + "Notices go to the addresses listed above.")
                .doesNotContain(CitationBuilder.ELLIPSIS);
    }

    @Test
    void snippetShouldStayWithinMatchSegment() {
        MatchCandidate match = matchOf("Delaware", 1, 0);

        String snippet = builderWithRadius(40).build(document, match).getSnippet();

        assertThat(snippet).startsWith("Delaware law applies.").endsWith(CitationBuilder.ELLIPSIS);
        assertThat(snippet).doesNotContain("Alpha and Beta");
    }
}
