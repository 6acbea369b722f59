package net.hearth.bootstrap.catalog;

import net.hearth.bootstrap.props.HearthProperties;
import net.hearth.core.error.CycleException;
import net.hearth.core.error.InvalidSourceException;
import net.hearth.core.model.BackoffStrategy;
import net.hearth.core.model.WarmingSource;
import net.hearth.core.model.WarmingStrategy;
import net.hearth.core.registry.RegisteredSource;
import net.hearth.core.schedule.JitterOptions;
import net.hearth.core.schedule.TimezoneInfo;
import net.hearth.core.service.WarmingScheduler;
import net.hearth.core.spi.Clock;
import net.hearth.core.spi.Fetcher;
import net.hearth.integration.spring.cron.ScheduleDescriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.BeanFactory;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Registers the sources declared under {@code hearth.catalog.sources}, dependencies first. */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final WarmingScheduler scheduler;
    private final BeanFactory beans;
    private final ScheduleDescriber describer;
    private final Clock clock;

    public CatalogRegistrar(WarmingScheduler scheduler, BeanFactory beans, ScheduleDescriber describer, Clock clock) {
        this.scheduler = scheduler;
        this.beans = beans;
        this.describer = describer;
        this.clock = clock;
    }

    public List<RegisteredSource> register(HearthProperties.Catalog catalog) {
        var registered = new ArrayList<RegisteredSource>();
        for (var def : dependencyOrder(catalog.getSources())) {
            RegisteredSource reg = scheduler.register(toSource(def));
            registered.add(reg);
            if (reg.scheduled()) {
                log.info("Catalog source '{}': {} [{}]", reg.id(), describer.describe(reg.cron()), reg.zone().name());
            } else {
                log.info("Catalog source '{}': {}", reg.id(), reg.source().strategy());
            }
        }
        log.info("Catalog registered: {} sources", registered.size());
        return registered;
    }

    WarmingSource toSource(HearthProperties.SourceDef def) {
        if (def.getId() == null || def.getId().isBlank()) throw new InvalidSourceException("catalog source id is required");

        WarmingStrategy strategy = def.getStrategy();
        if (strategy == null) strategy = def.getSchedule() != null ? WarmingStrategy.SCHEDULED : WarmingStrategy.ON_DEMAND;

        return WarmingSource.builder(def.getId())
                .name(def.getName())
                .namespace(def.getNamespace())
                .ttlSeconds(def.getTtl() == null ? 0 : def.getTtl().toSeconds())
                .schedule(def.getSchedule())
                .strategy(strategy)
                .timezone(timezone(def.getTimezone()))
                .jitter(def.getJitter() == null ? null : new JitterOptions(def.getJitter().isEnabled(), def.getJitter().getMaxPercent()))
                .backoff(backoff(def.getBackoff()))
                .dependsOn(def.getDependencies() == null ? List.of() : def.getDependencies())
                .fetcher(fetcher(def))
                .description(def.getDescription())
                .build();
    }

    private TimezoneInfo timezone(HearthProperties.TimezoneDef tz) {
        if (tz == null || tz.getName() == null) return null;
        if (tz.getOffsetMinutes() != null) return new TimezoneInfo(tz.getName(), tz.getOffsetMinutes());
        return TimezoneInfo.of(ZoneId.of(tz.getName()), clock.now());
    }

    private static BackoffStrategy backoff(HearthProperties.BackoffDef b) {
        if (b == null) return null;
        return new BackoffStrategy(b.getInitialDelay().toMillis(), b.getMaxDelay().toMillis(), b.getFactor(), b.getMaxRetries());
    }

    private Fetcher fetcher(HearthProperties.SourceDef def) {
        String bean = def.getFetcher() != null ? def.getFetcher() : def.getId();
        try {
            return beans.getBean(bean, Fetcher.class);
        } catch (BeansException e) {
            throw new InvalidSourceException("No Fetcher bean '" + bean + "' for catalog source " + def.getId());
        }
    }

    /** Orders definitions so every dependency declared in the catalog precedes its dependents. */
    static List<HearthProperties.SourceDef> dependencyOrder(List<HearthProperties.SourceDef> defs) {
        Map<String, HearthProperties.SourceDef> byId = new LinkedHashMap<>();
        for (var d : defs) byId.put(d.getId(), d);

        var out = new ArrayList<HearthProperties.SourceDef>();
        var done = new HashSet<String>();
        for (var d : defs) visit(d, byId, done, new ArrayList<>(), out);
        return out;
    }

    private static void visit(HearthProperties.SourceDef def, Map<String, HearthProperties.SourceDef> byId,
                              Set<String> done, List<String> path, List<HearthProperties.SourceDef> out) {
        if (done.contains(def.getId())) return;
        int at = path.indexOf(def.getId());
        if (at >= 0) {
            var cycle = new ArrayList<>(path.subList(at, path.size()));
            cycle.add(def.getId());
            throw new CycleException(cycle);
        }
        path.add(def.getId());
        if (def.getDependencies() != null) {
            for (String dep : def.getDependencies()) {
                // unknown ids are left for the registry to report
                var d = byId.get(dep);
                if (d != null) visit(d, byId, done, path, out);
            }
        }
        path.remove(path.size() - 1);
        done.add(def.getId());
        out.add(def);
    }
}
