package net.hearth.core.spi;

import net.hearth.core.model.WarmRun;

import java.time.Instant;
import java.util.List;

/** Run history store. Not used for scheduling decisions. */
public interface WarmRunRepository {
    /** @return the generated run id */
    long save(WarmRun run) throws Exception;

    /** Most recent first. */
    List<WarmRun> findRecent(String sourceId, int limit) throws Exception;

    /** Deletes runs that finished before {@code threshold}; returns the number removed. */
    int purgeFinishedBefore(Instant threshold) throws Exception;
}
