package com.legalreview.extraction.exception;

public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
