package net.hearth.core.model;

import java.time.Instant;

/** Point-in-time view of a source's runtime state. */
public record SourceStatus(
        String sourceId,
        SourceState state,
        Instant nextRunAt,
        Instant retryAt,
        int consecutiveFailures,
        WarmStatus lastStatus,
        Instant lastRunAt,
        String lastError
) {}
