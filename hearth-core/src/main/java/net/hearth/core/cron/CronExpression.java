package net.hearth.core.cron;

import java.util.List;

/**
 * Parsed 5-field cron expression. {@code source} is the text as written (macro included), kept for diagnostics.
 * Use {@link #sameScheduleAs(CronExpression)} to compare schedules regardless of how they were written.
 */
public record CronExpression(String source,
                             CronField minute,
                             CronField hour,
                             CronField dayOfMonth,
                             CronField month,
                             CronField dayOfWeek) {

    public List<CronField> fields() {
        return List.of(minute, hour, dayOfMonth, month, dayOfWeek);
    }

    public boolean sameScheduleAs(CronExpression other) {
        return other != null && fields().equals(other.fields());
    }

    public String format() {
        return String.join(" ",
                minute.format(), hour.format(), dayOfMonth.format(), month.format(), dayOfWeek.format());
    }

    @Override
    public String toString() { return source; }
}
