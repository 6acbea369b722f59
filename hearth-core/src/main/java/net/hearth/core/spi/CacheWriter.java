package net.hearth.core.spi;

/** Write side of the cache backend. The engine never reads the cache. */
@FunctionalInterface
public interface CacheWriter {
    void write(String namespace, String key, Object value, long ttlSeconds) throws Exception;
}
