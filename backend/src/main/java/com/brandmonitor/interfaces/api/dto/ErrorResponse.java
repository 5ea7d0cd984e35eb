package com.brandmonitor.interfaces.api.dto;

public record ErrorResponse(
        String error,
        String code
) {}
