package net.hearth.core.schedule;

import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Spreads fire times of sources sharing a schedule. Apply once per scheduling decision;
 * re-applying on every check would make a source's fire time drift.
 */
public final class JitterApplicator {
    private final DoubleSupplier unitRandom;

    public JitterApplicator() {
        this(() -> ThreadLocalRandom.current().nextDouble());
    }

    /** @param unitRandom uniform source in {@code [0,1)} */
    public JitterApplicator(DoubleSupplier unitRandom) {
        this.unitRandom = Objects.requireNonNull(unitRandom);
    }

    public long applyJitter(long baseDelayMs, JitterOptions options) {
        if (options == null || !options.active()) return baseDelayMs;
        double f = (unitRandom.getAsDouble() * 2.0 - 1.0) * options.maxPercent();
        return Math.max(0L, Math.round(baseDelayMs * (1.0 + f)));
    }
}
