package net.hearth.core.schedule;

public record JitterOptions(boolean enabled, double maxPercent) {

    public JitterOptions {
        if (Double.isNaN(maxPercent) || maxPercent < 0.0 || maxPercent > 1.0) {
            throw new IllegalArgumentException("maxPercent must be within [0,1]: " + maxPercent);
        }
    }

    public static JitterOptions disabled() { return new JitterOptions(false, 0.0); }

    public static JitterOptions upTo(double maxPercent) { return new JitterOptions(true, maxPercent); }

    public boolean active() { return enabled && maxPercent > 0.0; }
}
