package net.hearth.core.model;

import net.hearth.core.error.InvalidSourceException;
import net.hearth.core.schedule.JitterOptions;
import net.hearth.core.schedule.TimezoneInfo;
import net.hearth.core.spi.Fetcher;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Static definition of a cache-populating unit. {@code schedule} is cron text (or a macro) and is only
 * read for {@link WarmingStrategy#SCHEDULED} sources. A {@code ttlSeconds} of 0 leaves expiry to the cache backend.
 */
public record WarmingSource(
        String id,
        String name,
        String namespace,
        long ttlSeconds,
        WarmingStrategy strategy,
        String schedule,
        TimezoneInfo timezone,
        JitterOptions jitter,
        BackoffStrategy backoff,
        Set<String> dependencies,
        Fetcher fetcher,
        String description
) {
    public static final String DEFAULT_NAMESPACE = "default";

    public WarmingSource {
        if (id == null || id.isBlank()) throw new InvalidSourceException("source id is required");
        if (strategy == null) throw new InvalidSourceException("strategy is required for source " + id);
        if (fetcher == null) throw new InvalidSourceException("fetcher is required for source " + id);
        if (ttlSeconds < 0) throw new InvalidSourceException("ttlSeconds must not be negative for source " + id);
        if (strategy == WarmingStrategy.SCHEDULED && (schedule == null || schedule.isBlank())) {
            throw new InvalidSourceException("schedule is required for scheduled source " + id);
        }
        if (name == null || name.isBlank()) name = id;
        if (namespace == null || namespace.isBlank()) namespace = DEFAULT_NAMESPACE;
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
    }

    public boolean scheduled() { return strategy == WarmingStrategy.SCHEDULED; }

    public static Builder builder(String id) { return new Builder(id); }

    public static final class Builder {
        private final String id;
        private String name;
        private String namespace;
        private long ttlSeconds;
        private WarmingStrategy strategy = WarmingStrategy.ON_DEMAND;
        private String schedule;
        private TimezoneInfo timezone;
        private JitterOptions jitter;
        private BackoffStrategy backoff;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private Fetcher fetcher;
        private String description;

        private Builder(String id) { this.id = id; }

        public Builder name(String name) { this.name = name; return this; }
        public Builder namespace(String namespace) { this.namespace = namespace; return this; }
        public Builder ttlSeconds(long ttlSeconds) { this.ttlSeconds = ttlSeconds; return this; }
        public Builder strategy(WarmingStrategy strategy) { this.strategy = strategy; return this; }
        public Builder timezone(TimezoneInfo timezone) { this.timezone = timezone; return this; }
        public Builder jitter(JitterOptions jitter) { this.jitter = jitter; return this; }
        public Builder backoff(BackoffStrategy backoff) { this.backoff = backoff; return this; }
        public Builder fetcher(Fetcher fetcher) { this.fetcher = fetcher; return this; }
        public Builder description(String description) { this.description = description; return this; }

        /** Sets the cron schedule and switches the strategy to {@link WarmingStrategy#SCHEDULED}. */
        public Builder schedule(String schedule) {
            this.schedule = schedule;
            this.strategy = WarmingStrategy.SCHEDULED;
            return this;
        }

        public Builder dependsOn(String... ids) {
            Collections.addAll(dependencies, ids);
            return this;
        }

        public Builder dependsOn(Collection<String> ids) {
            dependencies.addAll(ids);
            return this;
        }

        public WarmingSource build() {
            return new WarmingSource(id, name, namespace, ttlSeconds, strategy, schedule, timezone,
                    jitter, backoff, dependencies, fetcher, description);
        }
    }
}
