package net.hearth.core.error;

/** No reachable next run for an expression (e.g. Feb 30). */
public final class ScheduleException extends WarmingException {
    public ScheduleException(String message) { super(message); }
}
