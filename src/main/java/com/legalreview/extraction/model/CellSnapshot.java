package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CellSnapshot {

    String value;
    String valueRaw;
    ReviewState reviewState;

    public static CellSnapshot of(Cell cell) {
        return new CellSnapshot(cell.getValue(), cell.getValueRaw(), cell.getReviewState());
    }
}
