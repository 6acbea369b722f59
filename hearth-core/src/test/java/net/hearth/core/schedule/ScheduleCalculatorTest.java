package net.hearth.core.schedule;

import net.hearth.core.cron.CronParser;
import net.hearth.core.error.ScheduleException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

class ScheduleCalculatorTest {

    private final ScheduleCalculator calc = new ScheduleCalculator();

    private static Instant utc(int y, int mo, int d, int h, int mi) {
        return ZonedDateTime.of(y, mo, d, h, mi, 0, 0, ZoneOffset.UTC).toInstant();
    }

    @Test
    void next_is_strictly_after_and_on_the_step() {
        Instant after = utc(2024, 3, 10, 12, 0).plusSeconds(17);
        Instant next = calc.next(CronParser.parse("*/5 * * * *"), TimezoneInfo.utc(), after);
        assertEquals(utc(2024, 3, 10, 12, 5), next);

        // exactly on a match: the match itself is not returned
        Instant onMatch = utc(2024, 3, 10, 12, 5);
        assertEquals(utc(2024, 3, 10, 12, 10), calc.next(CronParser.parse("*/5 * * * *"), TimezoneInfo.utc(), onMatch));
    }

    @Test
    void results_match_every_field() {
        var expr = CronParser.parse("15 3 * * *");
        Instant t = utc(2024, 1, 1, 0, 0);
        for (int i = 0; i < 40; i++) {
            Instant n = calc.next(expr, TimezoneInfo.utc(), t);
            assertTrue(n.isAfter(t));
            var z = n.atZone(ZoneOffset.UTC);
            assertEquals(15, z.getMinute());
            assertEquals(3, z.getHour());
            t = n;
        }
    }

    @Test
    void rolls_over_hour_day_month_and_year() {
        assertEquals(utc(2024, 3, 10, 13, 0), calc.next(CronParser.parse("0 * * * *"), TimezoneInfo.utc(), utc(2024, 3, 10, 12, 30)));
        assertEquals(utc(2024, 3, 11, 0, 0), calc.next(CronParser.parse("@daily"), TimezoneInfo.utc(), utc(2024, 3, 10, 23, 59)));
        assertEquals(utc(2025, 1, 1, 0, 0), calc.next(CronParser.parse("@yearly"), TimezoneInfo.utc(), utc(2024, 3, 10, 0, 0)));
        assertEquals(utc(2024, 4, 1, 0, 0), calc.next(CronParser.parse("@monthly"), TimezoneInfo.utc(), utc(2024, 3, 1, 0, 0)));
    }

    @Test
    void leap_day_is_found() {
        assertEquals(utc(2028, 2, 29, 0, 0), calc.next(CronParser.parse("0 0 29 2 *"), TimezoneInfo.utc(), utc(2024, 3, 1, 0, 0)));
    }

    @Test
    void evaluated_in_the_source_zone() {
        var seoul = new TimezoneInfo("Asia/Seoul", 9 * 60);
        // 09:00 in Seoul is 00:00 UTC
        Instant next = calc.next(CronParser.parse("0 9 * * *"), seoul, utc(2024, 3, 10, 1, 0));
        assertEquals(utc(2024, 3, 11, 0, 0), next);

        var ny = new TimezoneInfo("America/New_York", -5 * 60);
        assertEquals(utc(2024, 1, 15, 5, 0), calc.next(CronParser.parse("@daily"), ny, utc(2024, 1, 14, 12, 0)));
    }

    @Test
    void day_of_week_is_sunday_zero() {
        // 2024-03-10 is a Sunday
        assertEquals(utc(2024, 3, 10, 8, 0), calc.next(CronParser.parse("0 8 * * 0"), TimezoneInfo.utc(), utc(2024, 3, 9, 12, 0)));
        assertEquals(utc(2024, 3, 16, 8, 0), calc.next(CronParser.parse("0 8 * * 6"), TimezoneInfo.utc(), utc(2024, 3, 10, 12, 0)));
    }

    /** Classic cron OR semantics when both day fields are restricted. */
    @Test
    void day_of_month_and_day_of_week_are_or_ed_when_both_restricted() {
        // 13th of the month OR Friday. 2024-09-06 is a Friday, before 2024-09-13.
        var expr = CronParser.parse("0 0 13 * 5");
        assertEquals(utc(2024, 9, 6, 0, 0), calc.next(expr, TimezoneInfo.utc(), utc(2024, 9, 1, 0, 0)));
        assertEquals(utc(2024, 9, 13, 0, 0), calc.next(expr, TimezoneInfo.utc(), utc(2024, 9, 12, 0, 0)));
        // 2024-09-14 is a Saturday: the next hit is Friday the 20th
        assertEquals(utc(2024, 9, 20, 0, 0), calc.next(expr, TimezoneInfo.utc(), utc(2024, 9, 13, 0, 0)));
    }

    @Test
    void impossible_date_has_no_next_run() {
        var ex = assertThrows(ScheduleException.class,
                () -> calc.next(CronParser.parse("0 0 30 2 *"), TimezoneInfo.utc(), utc(2024, 1, 1, 0, 0)));
        assertTrue(ex.getMessage().contains("0 0 30 2 *"));
    }

    @Test
    void minimum_interval_follows_the_finest_varying_field() {
        assertEquals(300_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("*/5 * * * *")));
        assertEquals(900_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("@every_15_minutes")));
        assertEquals(900_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("0,15,30,45 * * * *")));
        assertEquals(120_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("1-10/2 * * * *")));
        assertEquals(120_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("0,2,30 * * * *")));
        assertEquals(60_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("* * * * *")));
        assertEquals(3_600_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("0 * * * *")));
        assertEquals(3 * 3_600_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("0 */3 * * *")));
        assertEquals(86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("@daily")));
        assertEquals(7 * 86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("@weekly")));
        assertEquals(86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("0 0 * * 1-5")));
        assertEquals(30 * 86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("@monthly")));
        assertEquals(365 * 86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("@yearly")));
        assertEquals(14 * 86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("0 0 1,15 * *")));
    }

    @Test
    void unrestricted_minute_falls_through_to_coarser_fields() {
        assertEquals(2 * 3_600_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("* */2 * * *")));
        assertEquals(86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("* 3 * * *")));
        assertEquals(86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("* * * * 1-5")));
        assertEquals(7 * 86_400_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("* * * * 1")));
        assertEquals(60_000L, ScheduleCalculator.minimumIntervalMs(CronParser.parse("* * * * *")));
    }
}
