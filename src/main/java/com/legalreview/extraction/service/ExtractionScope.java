package com.legalreview.extraction.service;

import com.legalreview.extraction.config.ReviewProperties;
import com.legalreview.extraction.model.JobMode;
import com.legalreview.extraction.model.LocationType;
import com.legalreview.extraction.model.Segment;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic input slice for a job mode. Quick mode keeps the first documents,
 * the first fields and the first pages; full mode keeps everything.
 *
 * Section segments (HTML) are not page-bounded and are never dropped by the page limit.
 */
@Value
public class ExtractionScope {

    private static final int UNLIMITED = Integer.MAX_VALUE;

    int maxDocuments;
    int maxFields;
    int maxPages;

    public static ExtractionScope full() {
        return new ExtractionScope(UNLIMITED, UNLIMITED, UNLIMITED);
    }

    public static ExtractionScope quick(ReviewProperties.Quick quick) {
        return new ExtractionScope(quick.getMaxDocuments(), quick.getMaxFields(), quick.getMaxPages());
    }

    public static ExtractionScope forMode(JobMode mode, ReviewProperties properties) {
        return mode == JobMode.QUICK ? quick(properties.getQuick()) : full();
    }

    public <T> List<T> selectDocuments(List<T> documents) {
        return head(documents, maxDocuments);
    }

    public <T> List<T> selectFields(List<T> fields) {
        return head(fields, maxFields);
    }

    public List<Segment> selectSegments(List<Segment> segments) {
        if (maxPages == UNLIMITED) return segments;

        List<Segment> selected = new ArrayList<>(segments.size());
        int pages = 0;
        for (Segment segment : segments) {
            if (segment.getLocationType() == LocationType.PAGE) {
                if (pages >= maxPages) continue;
                pages++;
            }
            selected.add(segment);
        }
        return selected;
    }

    private static <T> List<T> head(List<T> items, int limit) {
        return items.size() <= limit ? items : items.subList(0, limit);
    }
}
