package net.hearth.integration.spring.sched;

import net.hearth.core.service.WarmingScheduler;
import net.hearth.core.spi.Clock;
import net.hearth.core.spi.WarmRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

/** Drives {@link WarmingScheduler#tick()} and history housekeeping from Spring's task scheduler. */
public class HearthSchedulers {
    private static final Logger log = LoggerFactory.getLogger(HearthSchedulers.class);

    private final WarmingScheduler scheduler;
    private final WarmRunRepository history;
    private final Clock clock;

    private Duration retention = Duration.ofDays(7);

    /** @param history may be null when run history is off */
    public HearthSchedulers(WarmingScheduler scheduler, WarmRunRepository history, Clock clock) {
        this.scheduler = scheduler;
        this.history = history;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${hearth.scheduler.tick-delay-ms:1000}")
    public void tick() {
        scheduler.tick();
    }

    @Scheduled(fixedDelayString = "${hearth.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() throws Exception {
        if (history == null) return;
        int purged = history.purgeFinishedBefore(clock.now().minus(retention));
        if (purged > 0) log.info("Purged {} warm runs older than {}", purged, retention);
    }

    public void setRetention(Duration retention) {
        this.retention = retention;
    }
}
