package net.hearth.core.cron;

/** The five cron positions, in text order, with their inclusive bounds. */
public enum CronFieldType {
    MINUTE("minute", 0, 59),
    HOUR("hour", 0, 23),
    DAY_OF_MONTH("day-of-month", 1, 31),
    MONTH("month", 1, 12),
    DAY_OF_WEEK("day-of-week", 0, 6);

    private final String label;
    private final int min;
    private final int max;

    CronFieldType(String label, int min, int max) {
        this.label = label;
        this.min = min;
        this.max = max;
    }

    public String label() { return label; }
    public int min() { return min; }
    public int max() { return max; }

    /** Number of distinct values; the wrap-around distance used for circular gaps. */
    public int period() { return max - min + 1; }

    public boolean contains(int value) { return value >= min && value <= max; }
}
