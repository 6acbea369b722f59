package net.hearth.core.error;

/** A fetch failed or timed out. Transient: retried per the source's backoff. */
public final class FetchException extends WarmingException {
    private final String sourceId;

    public FetchException(String sourceId, String message, Throwable cause) {
        super(message, cause);
        this.sourceId = sourceId;
    }

    public String sourceId() { return sourceId; }
}
