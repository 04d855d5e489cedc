package com.legalreview.extraction.exception;

/**
 * The caller acted on a cell version that is no longer current. Re-read and retry.
 */
public class StaleCellException extends RuntimeException {

    private final String cellId;
    private final long expectedVersion;
    private final long actualVersion;

    public StaleCellException(String cellId, long expectedVersion, long actualVersion) {
        super("Cell " + cellId + " is at version " + actualVersion
                + " but the review was based on version " + expectedVersion);
        this.cellId = cellId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getCellId() {
        return cellId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
