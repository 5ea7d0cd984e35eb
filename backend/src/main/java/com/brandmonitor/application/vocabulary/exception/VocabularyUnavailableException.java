package com.brandmonitor.application.vocabulary.exception;

public class VocabularyUnavailableException extends RuntimeException {
    public VocabularyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
