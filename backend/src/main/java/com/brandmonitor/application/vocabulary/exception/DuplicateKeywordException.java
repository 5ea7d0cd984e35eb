package com.brandmonitor.application.vocabulary.exception;

public class DuplicateKeywordException extends RuntimeException {
    public DuplicateKeywordException(String term, String tier) {
        super(String.format("Keyword \"%s\" already exists in %s", term, tier));
    }
}
