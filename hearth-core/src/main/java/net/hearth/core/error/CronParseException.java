package net.hearth.core.error;

import net.hearth.core.cron.CronFieldType;

/** Malformed cron text. {@code field} is null when the error is not tied to one field (e.g. field count). */
public final class CronParseException extends WarmingException {
    private final CronFieldType field;
    private final String reason;

    public CronParseException(CronFieldType field, String reason) {
        super(field == null ? reason : field.label() + ": " + reason);
        this.field = field;
        this.reason = reason;
    }

    public CronFieldType field() { return field; }
    public String reason() { return reason; }
}
