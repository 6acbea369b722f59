package net.hearth.core.error;

public final class InvalidSourceException extends WarmingException {
    public InvalidSourceException(String message) { super(message); }
}
