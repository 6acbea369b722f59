package net.hearth.core.service;

import net.hearth.core.model.BackoffStrategy;

public interface RetryPolicy {
    /** @param attempt retries already made in the current cycle, starting at 0 */
    RetryDecision nextRetry(int attempt);

    /** Never retries; the source waits for its next natural run. */
    static RetryPolicy none() {
        return attempt -> RetryDecision.exhausted();
    }

    static RetryPolicy exponential(BackoffStrategy strategy) {
        return new ExponentialRetryPolicy(strategy);
    }

    static RetryPolicy of(BackoffStrategy strategy) {
        return strategy == null ? none() : exponential(strategy);
    }
}
