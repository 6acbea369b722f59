package net.hearth.core.spi;

import net.hearth.core.cron.CronExpression;
import net.hearth.core.schedule.TimezoneInfo;

import java.time.Instant;

public interface CronCalculator {
    /** First matching instant strictly after {@code after}, evaluated in {@code zone}'s local calendar. */
    Instant next(CronExpression expr, TimezoneInfo zone, Instant after);
}
