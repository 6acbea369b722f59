package net.hearth.core.service;

import java.time.Duration;

/** Either a delay before the next retry, or exhaustion ({@code delay == null}). */
public record RetryDecision(Duration delay) {
    private static final RetryDecision EXHAUSTED = new RetryDecision(null);

    public static RetryDecision after(Duration delay) { return new RetryDecision(delay); }

    public static RetryDecision exhausted() { return EXHAUSTED; }

    public boolean isExhausted() { return delay == null; }
}
