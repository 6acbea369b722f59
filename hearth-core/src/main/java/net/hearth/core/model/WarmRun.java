package net.hearth.core.model;

import java.time.Duration;
import java.time.Instant;

/** Outcome of one warming execution. {@code id} is null until the run is stored. */
public record WarmRun(
        Long id,
        String sourceId,
        String namespace,
        WarmTrigger trigger,
        WarmStatus status,
        int keyCount,
        Instant startedAt,
        Instant finishedAt,
        String error
) {
    public static WarmRun succeeded(String sourceId, String namespace, WarmTrigger trigger,
                                    int keyCount, Instant startedAt, Instant finishedAt) {
        return new WarmRun(null, sourceId, namespace, trigger, WarmStatus.SUCCEEDED, keyCount, startedAt, finishedAt, null);
    }

    public static WarmRun failed(String sourceId, String namespace, WarmTrigger trigger,
                                 Instant startedAt, Instant finishedAt, String error) {
        return new WarmRun(null, sourceId, namespace, trigger, WarmStatus.FAILED, 0, startedAt, finishedAt, error);
    }

    public static WarmRun skipped(String sourceId, String namespace, WarmTrigger trigger, Instant at, String reason) {
        return new WarmRun(null, sourceId, namespace, trigger, WarmStatus.SKIPPED, 0, at, at, reason);
    }

    public WarmRun withId(long newId) {
        return new WarmRun(newId, sourceId, namespace, trigger, status, keyCount, startedAt, finishedAt, error);
    }

    public boolean succeeded() { return status == WarmStatus.SUCCEEDED; }

    public Duration elapsed() { return Duration.between(startedAt, finishedAt); }
}
