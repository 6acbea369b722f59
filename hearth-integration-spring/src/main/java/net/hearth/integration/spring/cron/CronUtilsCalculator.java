package net.hearth.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import net.hearth.core.cron.CronExpression;
import net.hearth.core.error.ScheduleException;
import net.hearth.core.schedule.ScheduleCalculator;
import net.hearth.core.schedule.TimezoneInfo;
import net.hearth.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link CronCalculator} backed by cron-utils' UNIX definition. Expressions are handed over in their
 * normalized form, so macros and steps never reach cron-utils.
 * <p>
 * cron-utils and the built-in calculator agree whenever at most one of day-of-month/day-of-week is restricted.
 */
public final class CronUtilsCalculator implements CronCalculator {
    static final CronParser PARSER = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final Map<String, ExecutionTime> cache;

    public CronUtilsCalculator() {
        this(256);
    }

    public CronUtilsCalculator(int cacheSize) {
        this.cache = new LruMap<>(cacheSize);
    }

    @Override
    public Instant next(CronExpression expr, TimezoneInfo zone, Instant after) {
        String text = expr.format();
        ExecutionTime et;
        synchronized (cache) {
            et = cache.get(text);
        }
        if (et == null) {
            // unreachable dates are rejected by the built-in search before cron-utils sees them
            ScheduleCalculator.nextRun(expr, zone, after);
            et = ExecutionTime.forCron(PARSER.parse(text));
            synchronized (cache) {
                cache.put(text, et);
            }
        }
        ZonedDateTime base = after.atZone(zone == null ? TimezoneInfo.utc().offset() : zone.offset());
        return et.nextExecution(base)
                .map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new ScheduleException("No next execution for '" + expr.source() + "' after " + after));
    }

    int cachedExpressions() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
