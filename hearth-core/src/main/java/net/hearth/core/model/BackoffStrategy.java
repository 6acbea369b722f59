package net.hearth.core.model;

import net.hearth.core.error.InvalidSourceException;

/** Retry delays grow as {@code initialDelayMs * factor^attempt}, capped at {@code maxDelayMs}. */
public record BackoffStrategy(long initialDelayMs, long maxDelayMs, double factor, int maxRetries) {

    public BackoffStrategy {
        if (initialDelayMs <= 0) throw new InvalidSourceException("backoff initialDelayMs must be positive: " + initialDelayMs);
        if (maxDelayMs < initialDelayMs) {
            throw new InvalidSourceException("backoff maxDelayMs (" + maxDelayMs + ") is below initialDelayMs (" + initialDelayMs + ")");
        }
        if (Double.isNaN(factor) || factor < 1.0) throw new InvalidSourceException("backoff factor must be >= 1: " + factor);
        if (maxRetries <= 0) throw new InvalidSourceException("backoff maxRetries must be positive: " + maxRetries);
    }
}
