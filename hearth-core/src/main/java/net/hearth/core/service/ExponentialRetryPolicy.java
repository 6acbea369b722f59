package net.hearth.core.service;

import net.hearth.core.model.BackoffStrategy;

import java.time.Duration;
import java.util.Objects;

/** {@code min(maxDelayMs, initialDelayMs * factor^attempt)}, exhausted once {@code attempt >= maxRetries}. */
final class ExponentialRetryPolicy implements RetryPolicy {
    private final BackoffStrategy strategy;

    ExponentialRetryPolicy(BackoffStrategy strategy) { this.strategy = Objects.requireNonNull(strategy); }

    @Override
    public RetryDecision nextRetry(int attempt) {
        return nextRetryDelay(strategy, attempt);
    }

    static RetryDecision nextRetryDelay(BackoffStrategy strategy, int attempt) {
        if (attempt < 0) throw new IllegalArgumentException("attempt must not be negative: " + attempt);
        if (attempt >= strategy.maxRetries()) return RetryDecision.exhausted();

        double raw = strategy.initialDelayMs() * Math.pow(strategy.factor(), attempt);
        long delayMs = raw >= strategy.maxDelayMs() ? strategy.maxDelayMs() : (long) raw;
        return RetryDecision.after(Duration.ofMillis(delayMs));
    }
}
