package com.tapas.sitestats.stats.api;

public record ApiError(
        int status,
        String error,
        String message
) {
}
