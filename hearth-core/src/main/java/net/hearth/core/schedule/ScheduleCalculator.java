package net.hearth.core.schedule;

import net.hearth.core.cron.CronExpression;
import net.hearth.core.cron.CronField;
import net.hearth.core.error.ScheduleException;
import net.hearth.core.spi.CronCalculator;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * Built-in next-run calculator.
 * <p>
 * Walks the zone's local calendar forward from the next whole minute and returns the first minute whose
 * month, day, hour and minute all match. Non-matching months, days and hours are skipped whole, which
 * yields the same instant a minute-by-minute scan would. Day-of-month and day-of-week are OR-ed when
 * both are restricted, as in classic cron.
 */
public final class ScheduleCalculator implements CronCalculator {
    static final int SEARCH_YEARS = 4;

    private static final long MINUTE_MS = 60_000L;
    private static final long HOUR_MS = 60 * MINUTE_MS;
    private static final long DAY_MS = 24 * HOUR_MS;

    @Override
    public Instant next(CronExpression expr, TimezoneInfo zone, Instant after) {
        return nextRun(expr, zone, after);
    }

    public static Instant nextRun(CronExpression expr, TimezoneInfo zone, Instant after) {
        ZoneOffset offset = zone == null ? ZoneOffset.UTC : zone.offset();
        LocalDateTime t = LocalDateTime.ofInstant(after, offset).truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        LocalDateTime limit = t.plusYears(SEARCH_YEARS);

        while (!t.isAfter(limit)) {
            if (!expr.month().matches(t.getMonthValue())) {
                t = t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1).plusMonths(1);
                continue;
            }
            if (!dayMatches(expr, t.toLocalDate())) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!expr.hour().matches(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            int minute = expr.minute().nextOrSame(t.getMinute());
            if (minute < 0) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            return t.withMinute(minute).toInstant(offset);
        }
        throw new ScheduleException("No run of '" + expr.source() + "' within " + SEARCH_YEARS
                + " years after " + after);
    }

    static boolean dayMatches(CronExpression expr, LocalDate date) {
        CronField dom = expr.dayOfMonth();
        CronField dow = expr.dayOfWeek();
        boolean domHit = dom.matches(date.getDayOfMonth());
        boolean dowHit = dow.matches(date.getDayOfWeek().getValue() % 7); // Sunday = 0

        if (dom.restricted() && dow.restricted()) return domHit || dowHit;
        if (dom.restricted()) return domHit;
        if (dow.restricted()) return dowHit;
        return true;
    }

    /**
     * Shortest possible spacing between two runs, in milliseconds.
     * Only a restricted minute or hour field with several values decides at its own level;
     * a bare {@code *} falls through to the next coarser field. All five unrestricted is one minute.
     */
    public static long minimumIntervalMs(CronExpression expr) {
        CronField minute = expr.minute();
        CronField hour = expr.hour();
        if (minute.restricted() && !minute.singleValue()) return minute.minimumGap() * MINUTE_MS;
        if (hour.restricted() && !hour.singleValue()) return hour.minimumGap() * HOUR_MS;

        CronField dom = expr.dayOfMonth();
        CronField dow = expr.dayOfWeek();
        if (!minute.restricted() && !hour.restricted() && !dom.restricted() && !dow.restricted()
                && !expr.month().restricted()) {
            return MINUTE_MS;
        }
        if (!dom.restricted() && !dow.restricted()) return DAY_MS;

        long best = Long.MAX_VALUE;
        if (dow.restricted()) {
            best = dow.minimumGap() * DAY_MS;
        }
        if (dom.restricted()) {
            long byDay;
            if (!dom.singleValue()) {
                byDay = dom.minimumGap() * DAY_MS;
            } else if (expr.month().singleValue()) {
                byDay = 365 * DAY_MS;
            } else {
                byDay = expr.month().minimumGap() * 30 * DAY_MS;
            }
            best = Math.min(best, byDay);
        }
        return best;
    }
}
