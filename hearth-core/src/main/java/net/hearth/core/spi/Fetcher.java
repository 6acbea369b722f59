package net.hearth.core.spi;

import java.util.Map;

/**
 * Produces the entries a source warms into the cache, keyed by cache key.
 * Must be safe to call repeatedly; a failed or timed-out call is simply retried later.
 */
@FunctionalInterface
public interface Fetcher {
    Map<String, ?> fetch() throws Exception;
}
