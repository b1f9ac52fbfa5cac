package com.legacyforms.analyzer.service;

public class FormExtractionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FormExtractionException(String message) {
        super(message);
    }

    public FormExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
