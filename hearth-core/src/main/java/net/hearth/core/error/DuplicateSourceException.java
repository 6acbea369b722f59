package net.hearth.core.error;

public final class DuplicateSourceException extends WarmingException {
    public DuplicateSourceException(String sourceId) {
        super("Warming source already registered: " + sourceId);
    }
}
