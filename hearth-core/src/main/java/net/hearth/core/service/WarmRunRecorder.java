package net.hearth.core.service;

import net.hearth.core.model.WarmRun;
import net.hearth.core.spi.WarmRunRepository;
import net.hearth.core.spi.WarmingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Persists every completed warm into a {@link WarmRunRepository}. Storage errors are logged, never propagated. */
public final class WarmRunRecorder implements WarmingListener {
    private static final Logger log = LoggerFactory.getLogger(WarmRunRecorder.class);

    private final WarmRunRepository runs;

    public WarmRunRecorder(WarmRunRepository runs) { this.runs = runs; }

    @Override
    public void onWarmCompleted(WarmRun run) {
        try {
            runs.save(run);
        } catch (Exception e) {
            log.warn("Could not record warm run of source {}: {}", run.sourceId(), e.getMessage());
        }
    }
}
