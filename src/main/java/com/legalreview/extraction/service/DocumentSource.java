package com.legalreview.extraction.service;

import com.legalreview.extraction.model.SourceDocument;

import java.util.List;

/**
 * Ingestion collaborator: supplies the documents a job runs over, in ingestion order.
 */
@FunctionalInterface
public interface DocumentSource {

    List<SourceDocument> listDocuments();
}
