package net.hearth.core.spi;

import net.hearth.core.model.SourceState;
import net.hearth.core.model.WarmRun;
import net.hearth.core.model.WarmTrigger;

import java.time.Instant;

/**
 * Telemetry hooks. Callbacks run on scheduler or worker threads and must not block;
 * an exception thrown here is logged and otherwise ignored.
 */
public interface WarmingListener {
    default void onStateChanged(String sourceId, SourceState from, SourceState to) {}

    default void onScheduled(String sourceId, Instant nextRunAt) {}

    default void onWarmStarted(String sourceId, WarmTrigger trigger) {}

    default void onWarmCompleted(WarmRun run) {}

    default void onRetryScheduled(String sourceId, int attempt, Instant retryAt) {}

    default void onRetriesExhausted(String sourceId, int consecutiveFailures) {}
}
