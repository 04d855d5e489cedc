package com.legalreview.extraction.exception;

/**
 * Unexpected failure while evaluating one field against one document.
 */
public class ExtractionException extends RuntimeException {

    private final String documentId;
    private final String fieldKey;

    public ExtractionException(String documentId, String fieldKey, Throwable cause) {
        super("Extraction of field '" + fieldKey + "' failed for document " + documentId
                + ": " + cause.getMessage(), cause);
        this.documentId = documentId;
        this.fieldKey = fieldKey;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getFieldKey() {
        return fieldKey;
    }
}
