package com.brandmonitor.application.vocabulary.exception;

public class InvalidKeywordException extends RuntimeException {
    public InvalidKeywordException(String message) {
        super(message);
    }
}
