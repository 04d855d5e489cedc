package com.legalreview.extraction.exception;

/**
 * A single document could not be segmented. The job records it and moves on.
 */
public class DocumentParseException extends RuntimeException {

    private final String documentId;

    public DocumentParseException(String documentId, String message) {
        super(message);
        this.documentId = documentId;
    }

    public DocumentParseException(String documentId, String message, Throwable cause) {
        super(message, cause);
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }
}
