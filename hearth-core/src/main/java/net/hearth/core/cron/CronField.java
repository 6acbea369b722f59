package net.hearth.core.cron;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Resolved values of one cron position.
 * {@code values} is sorted, deduplicated and within the type's bounds; {@code restricted} is false only for a bare {@code *}.
 */
public record CronField(CronFieldType type, List<Integer> values, boolean restricted) {

    public CronField {
        values = List.copyOf(new TreeSet<>(values));
        if (values.isEmpty()) throw new IllegalArgumentException(type.label() + " resolved to no values");
        for (int v : values) {
            if (!type.contains(v)) throw new IllegalArgumentException(type.label() + " value out of range: " + v);
        }
    }

    public static CronField unrestricted(CronFieldType type) {
        var all = new ArrayList<Integer>(type.period());
        for (int v = type.min(); v <= type.max(); v++) all.add(v);
        return new CronField(type, all, false);
    }

    public boolean matches(int value) {
        return Collections.binarySearch(values, value) >= 0;
    }

    /** Smallest value {@code >= from}, or -1 when none is left in this period. */
    public int nextOrSame(int from) {
        for (int v : values) {
            if (v >= from) return v;
        }
        return -1;
    }

    public int first() { return values.get(0); }

    public boolean singleValue() { return values.size() == 1; }

    /** Minimum distance between consecutive values, treating the field as circular. */
    public int minimumGap() {
        int gap = type.period() - values.get(values.size() - 1) + values.get(0);
        for (int i = 1; i < values.size(); i++) {
            gap = Math.min(gap, values.get(i) - values.get(i - 1));
        }
        return gap;
    }

    /** Normalized text: {@code *} when unrestricted, otherwise a comma list. */
    public String format() {
        if (!restricted) return "*";
        return values.stream().map(String::valueOf).collect(Collectors.joining(","));
    }
}
