package com.brandmonitor.application.vocabulary.exception;

public class KeywordNotFoundException extends RuntimeException {
    public KeywordNotFoundException(String term, String tier) {
        super(String.format("Keyword \"%s\" not found in %s", term, tier));
    }
}
