package net.hearth.core.error;

/** Root of every error raised by the warming engine. */
public class WarmingException extends RuntimeException {
    public WarmingException(String message) { super(message); }
    public WarmingException(String message, Throwable cause) { super(message, cause); }
}
