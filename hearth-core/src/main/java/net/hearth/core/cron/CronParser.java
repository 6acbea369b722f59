package net.hearth.core.cron;

import net.hearth.core.error.CronParseException;

import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Parser for 5-field cron text ({@code minute hour day-of-month month day-of-week}).
 * <p>
 * Each field is a comma list of terms: {@code *}, {@code n}, {@code a-b}, {@code a-b/s}, {@code *}{@code /s}
 * or {@code n/s}. The usual macros ({@code @hourly}, {@code @daily}, {@code @every_5_minutes}, ...) are expanded first.
 * {@code L}, {@code W}, {@code #} and {@code ?} are rejected.
 */
public final class CronParser {
    private CronParser() {}

    private static final Map<String, String> MACROS = Map.ofEntries(
            Map.entry("@yearly", "0 0 1 1 *"),
            Map.entry("@annually", "0 0 1 1 *"),
            Map.entry("@monthly", "0 0 1 * *"),
            Map.entry("@weekly", "0 0 * * 0"),
            Map.entry("@daily", "0 0 * * *"),
            Map.entry("@midnight", "0 0 * * *"),
            Map.entry("@hourly", "0 * * * *"),
            Map.entry("@every_minute", "* * * * *"),
            Map.entry("@every_5_minutes", "*/5 * * * *"),
            Map.entry("@every_10_minutes", "*/10 * * * *"),
            Map.entry("@every_15_minutes", "*/15 * * * *"),
            Map.entry("@every_30_minutes", "*/30 * * * *")
    );

    public static CronExpression parse(String text) {
        if (text == null || text.isBlank()) throw new CronParseException(null, "cron expression is blank");
        String trimmed = text.trim();
        String body = trimmed;
        if (trimmed.startsWith("@")) {
            body = MACROS.get(trimmed.toLowerCase(Locale.ROOT));
            if (body == null) throw new CronParseException(null, "unknown macro '" + trimmed + "'");
        }

        String[] parts = body.split("\\s+");
        if (parts.length != 5) {
            throw new CronParseException(null, "expected 5 fields but found " + parts.length + " in '" + trimmed + "'");
        }
        CronFieldType[] types = CronFieldType.values();
        CronField[] fields = new CronField[5];
        for (int i = 0; i < 5; i++) fields[i] = parseField(types[i], parts[i]);

        return new CronExpression(trimmed, fields[0], fields[1], fields[2], fields[3], fields[4]);
    }

    public static boolean isValid(String text) {
        try {
            parse(text);
            return true;
        } catch (CronParseException e) {
            return false;
        }
    }

    static CronField parseField(CronFieldType type, String text) {
        if ("*".equals(text)) return CronField.unrestricted(type);

        var values = new TreeSet<Integer>();
        for (String term : text.split(",", -1)) {
            if (term.isEmpty()) throw new CronParseException(type, "empty list element in '" + text + "'");
            addTerm(type, term, values);
        }
        if (values.isEmpty()) throw new CronParseException(type, "'" + text + "' matches no values");
        return new CronField(type, values.stream().toList(), true);
    }

    private static void addTerm(CronFieldType type, String term, TreeSet<Integer> out) {
        int step = 1;
        String range = term;
        int slash = term.indexOf('/');
        if (slash >= 0) {
            range = term.substring(0, slash);
            step = number(type, term.substring(slash + 1));
            if (step < 1) throw new CronParseException(type, "step must be positive in '" + term + "'");
        }

        int start;
        int end;
        if ("*".equals(range)) {
            start = type.min();
            end = type.max();
        } else {
            int dash = range.indexOf('-');
            if (dash >= 0) {
                start = bounded(type, number(type, range.substring(0, dash)));
                end = bounded(type, number(type, range.substring(dash + 1)));
                if (start > end) throw new CronParseException(type, "range start exceeds end in '" + term + "'");
            } else {
                start = bounded(type, number(type, range));
                // "n/s" runs to the end of the field; a plain "n" is a single value
                end = slash >= 0 ? type.max() : start;
            }
        }
        for (int v = start; v <= end; v += step) out.add(v);
    }

    private static int number(CronFieldType type, String token) {
        if (token.isEmpty()) throw new CronParseException(type, "missing number");
        for (int i = 0; i < token.length(); i++) {
            char ch = token.charAt(i);
            if (ch < '0' || ch > '9') {
                throw new CronParseException(type, "unsupported token '" + token + "'");
            }
        }
        if (token.length() > 4) throw new CronParseException(type, "value out of range: " + token);
        return Integer.parseInt(token);
    }

    private static int bounded(CronFieldType type, int value) {
        if (!type.contains(value)) {
            throw new CronParseException(type,
                    "value " + value + " outside [" + type.min() + "," + type.max() + "]");
        }
        return value;
    }
}
