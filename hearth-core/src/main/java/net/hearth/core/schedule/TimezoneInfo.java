package net.hearth.core.schedule;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A named zone pinned to a fixed UTC offset. DST is not followed: the offset is a snapshot,
 * so a source must be re-registered when its zone changes offset.
 */
public record TimezoneInfo(String name, int offsetMinutes) {
    private static final int MAX_OFFSET_MINUTES = 18 * 60;

    public TimezoneInfo {
        Objects.requireNonNull(name, "name");
        if (Math.abs(offsetMinutes) > MAX_OFFSET_MINUTES) {
            throw new IllegalArgumentException("offsetMinutes out of range: " + offsetMinutes);
        }
    }

    public static TimezoneInfo utc() { return new TimezoneInfo("UTC", 0); }

    /** Resolves the offset {@code zone} has at {@code at}. */
    public static TimezoneInfo of(ZoneId zone, Instant at) {
        int seconds = zone.getRules().getOffset(at).getTotalSeconds();
        return new TimezoneInfo(zone.getId(), seconds / 60);
    }

    public ZoneOffset offset() { return ZoneOffset.ofTotalSeconds(offsetMinutes * 60); }
}
