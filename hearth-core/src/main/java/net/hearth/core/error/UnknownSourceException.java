package net.hearth.core.error;

public final class UnknownSourceException extends WarmingException {
    private final String sourceId;

    public UnknownSourceException(String sourceId) {
        this(sourceId, "Unknown warming source: " + sourceId);
    }

    public UnknownSourceException(String sourceId, String message) {
        super(message);
        this.sourceId = sourceId;
    }

    public String sourceId() { return sourceId; }
}
