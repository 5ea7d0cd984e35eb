package com.brandmonitor.infrastructure.vocabulary;

public class VocabularyStorageException extends RuntimeException {

    public VocabularyStorageException(String message) {
        super(message);
    }

    public VocabularyStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
