package net.hearth.core.service;

import net.hearth.core.error.CacheWriteException;
import net.hearth.core.error.FetchException;
import net.hearth.core.model.WarmRun;
import net.hearth.core.model.WarmTrigger;
import net.hearth.core.model.WarmingSource;
import net.hearth.core.spi.CacheWriter;
import net.hearth.core.spi.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Runs one warm: fetch on the worker pool (bounded by the caller's timeout), then write every entry to the cache.
 * The returned future always completes normally; failures are folded into a {@code FAILED} {@link WarmRun}.
 */
final class WarmDispatcher {
    private static final Logger log = LoggerFactory.getLogger(WarmDispatcher.class);

    private final Executor workers;
    private final CacheWriter cache;
    private final Clock clock;
    private final Duration fetchTimeout;

    WarmDispatcher(Executor workers, CacheWriter cache, Clock clock, Duration fetchTimeout) {
        this.workers = workers;
        this.cache = cache;
        this.clock = clock;
        this.fetchTimeout = fetchTimeout;
    }

    /** @param discarded checked before writing; true means the source was removed and the result is dropped */
    CompletableFuture<WarmRun> execute(WarmingSource source, WarmTrigger trigger, BooleanSupplier discarded) {
        Instant startedAt = clock.now();
        CompletableFuture<Map<String, ?>> fetched = CompletableFuture.supplyAsync(() -> fetch(source), workers);
        if (fetchTimeout != null && !fetchTimeout.isZero() && !fetchTimeout.isNegative()) {
            fetched = fetched.orTimeout(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return fetched
                .thenApplyAsync(data -> discarded.getAsBoolean() ? -1 : write(source, data), workers)
                .handle((keyCount, err) -> {
                    Instant finishedAt = clock.now();
                    if (err != null) {
                        Throwable cause = unwrap(source, err);
                        log.warn("Warming failed for source {} ({}): {}", source.id(), trigger, cause.getMessage());
                        return WarmRun.failed(source.id(), source.namespace(), trigger, startedAt, finishedAt, describe(cause));
                    }
                    if (keyCount < 0) {
                        log.info("Discarding result of removed source {}", source.id());
                        return WarmRun.skipped(source.id(), source.namespace(), trigger, finishedAt, "source removed");
                    }
                    log.info("Warmed source {} ({}): {} keys in {} ms", source.id(), trigger, keyCount,
                            Duration.between(startedAt, finishedAt).toMillis());
                    return WarmRun.succeeded(source.id(), source.namespace(), trigger, keyCount, startedAt, finishedAt);
                });
    }

    private static Map<String, ?> fetch(WarmingSource source) {
        Map<String, ?> data;
        try {
            data = source.fetcher().fetch();
        } catch (Exception e) {
            throw new FetchException(source.id(), "Fetch failed for source " + source.id() + ": " + e.getMessage(), e);
        }
        if (data == null) throw new FetchException(source.id(), "Fetcher of source " + source.id() + " returned null", null);
        return data;
    }

    private int write(WarmingSource source, Map<String, ?> data) {
        for (Map.Entry<String, ?> e : data.entrySet()) {
            try {
                cache.write(source.namespace(), e.getKey(), e.getValue(), source.ttlSeconds());
            } catch (Exception ex) {
                throw new CacheWriteException(source.id(), e.getKey(), ex);
            }
        }
        return data.size();
    }

    private Throwable unwrap(WarmingSource source, Throwable err) {
        Throwable t = err;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof TimeoutException) {
            return new FetchException(source.id(), "Fetch for source " + source.id() + " timed out after " + fetchTimeout, t);
        }
        return t;
    }

    private static String describe(Throwable t) {
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : msg;
    }
}
