package com.legalreview.extraction.exception;

public class ReviewValidationException extends RuntimeException {

    public ReviewValidationException(String message) {
        super(message);
    }
}
