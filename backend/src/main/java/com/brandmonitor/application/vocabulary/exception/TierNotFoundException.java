package com.brandmonitor.application.vocabulary.exception;

public class TierNotFoundException extends RuntimeException {
    public TierNotFoundException(String tier) {
        super(String.format("Category %s not found", tier));
    }
}
