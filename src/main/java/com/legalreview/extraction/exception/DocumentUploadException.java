package com.legalreview.extraction.exception;

/**
 * An uploaded file was refused before it reached the document directory.
 */
public class DocumentUploadException extends RuntimeException {

    public DocumentUploadException(String message) {
        super(message);
    }
}
