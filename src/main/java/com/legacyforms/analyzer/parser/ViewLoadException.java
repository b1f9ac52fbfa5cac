package com.legacyforms.analyzer.parser;

/**
 * Raised when a view file cannot be read or is not well-formed markup.
 */
public class ViewLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ViewLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
