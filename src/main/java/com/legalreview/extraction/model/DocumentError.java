package com.legalreview.extraction.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A failure recorded against a job for one document (and, for extraction errors, one field).
 */
@Value
@Builder
@Jacksonized
public class DocumentError {

    String documentId;
    String documentIdentifier;
    String fieldKey;            // null for parse errors
    ReasonCode reason;
    String message;
}
