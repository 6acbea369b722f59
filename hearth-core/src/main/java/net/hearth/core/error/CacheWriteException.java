package net.hearth.core.error;

/** Cache backend rejected a write. Counts as a fetch-stage failure for backoff. */
public final class CacheWriteException extends WarmingException {
    private final String sourceId;
    private final String key;

    public CacheWriteException(String sourceId, String key, Throwable cause) {
        super("Cache write failed for source " + sourceId + " key " + key, cause);
        this.sourceId = sourceId;
        this.key = key;
    }

    public String sourceId() { return sourceId; }
    public String key() { return key; }
}
