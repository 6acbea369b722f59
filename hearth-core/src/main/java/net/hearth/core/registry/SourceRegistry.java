package net.hearth.core.registry;

import net.hearth.core.cron.CronExpression;
import net.hearth.core.cron.CronParser;
import net.hearth.core.error.CycleException;
import net.hearth.core.error.DuplicateSourceException;
import net.hearth.core.error.SourceInUseException;
import net.hearth.core.error.UnknownSourceException;
import net.hearth.core.model.WarmingSource;
import net.hearth.core.schedule.ScheduleCalculator;
import net.hearth.core.schedule.TimezoneInfo;
import net.hearth.core.spi.Clock;
import net.hearth.core.spi.CronCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Owns every registered source and the dependency graph between them.
 * Reads (including a whole tick's planning via {@link #read(Supplier)}) share the lock; register/remove are exclusive.
 */
public final class SourceRegistry {
    private static final Logger log = LoggerFactory.getLogger(SourceRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, RegisteredSource> sources = new LinkedHashMap<>();
    private final Clock clock;
    private final ZoneId defaultZone;
    private final CronCalculator calculator;

    public SourceRegistry() {
        this(Clock.system(), ZoneOffset.UTC, new ScheduleCalculator());
    }

    public SourceRegistry(Clock clock, ZoneId defaultZone, CronCalculator calculator) {
        this.clock = clock;
        this.defaultZone = defaultZone;
        this.calculator = calculator;
    }

    /**
     * Validates and adds a source. On any failure the registry is left untouched.
     *
     * @throws net.hearth.core.error.CronParseException bad schedule text
     * @throws net.hearth.core.error.ScheduleException   schedule never fires
     * @throws CycleException                            the source would close a dependency cycle
     * @throws UnknownSourceException                    a dependency is not registered yet
     * @throws DuplicateSourceException                  the id is taken
     */
    public RegisteredSource register(WarmingSource source) {
        lock.writeLock().lock();
        try {
            if (sources.containsKey(source.id())) throw new DuplicateSourceException(source.id());

            List<String> cycle = findCycle(source);
            if (cycle != null) throw new CycleException(cycle);

            for (String dep : source.dependencies()) {
                if (!sources.containsKey(dep)) {
                    throw new UnknownSourceException(dep,
                            "Source " + source.id() + " depends on unregistered source " + dep);
                }
            }

            TimezoneInfo zone = source.timezone() != null
                    ? source.timezone()
                    : TimezoneInfo.of(defaultZone, clock.now());
            CronExpression cron = null;
            if (source.scheduled()) {
                cron = CronParser.parse(source.schedule());
                // fails fast with ScheduleException for expressions that never fire
                calculator.next(cron, zone, clock.now());
            }

            var registered = new RegisteredSource(source, cron, zone);
            sources.put(source.id(), registered);
            log.debug("Registered source {} (deps={})", source.id(), source.dependencies());
            return registered;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Dependency-first order covering {@code sourceId} and everything it transitively needs, each id once. */
    public List<String> resolveWarmOrder(String sourceId) {
        lock.readLock().lock();
        try {
            if (!sources.containsKey(sourceId)) throw new UnknownSourceException(sourceId);
            var order = new ArrayList<String>();
            postOrder(sourceId, new HashSet<>(), order);
            return order;
        } finally {
            lock.readLock().unlock();
        }
    }

    private void postOrder(String id, Set<String> visited, List<String> out) {
        if (!visited.add(id)) return;
        RegisteredSource s = sources.get(id);
        if (s != null) {
            for (String dep : s.source().dependencies()) postOrder(dep, visited, out);
        }
        out.add(id);
    }

    /** DFS with a recursion stack from the candidate over the graph as it would look after registration. */
    private List<String> findCycle(WarmingSource candidate) {
        Map<String, Set<String>> graph = new HashMap<>();
        for (var e : sources.entrySet()) graph.put(e.getKey(), e.getValue().source().dependencies());
        graph.put(candidate.id(), candidate.dependencies());
        return dfs(candidate.id(), graph, new ArrayList<>(), new HashSet<>(), new HashSet<>());
    }

    private static List<String> dfs(String node, Map<String, Set<String>> graph,
                                    List<String> path, Set<String> onPath, Set<String> done) {
        if (onPath.contains(node)) {
            var cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            cycle.add(node);
            return cycle;
        }
        if (done.contains(node)) return null;

        path.add(node);
        onPath.add(node);
        for (String dep : graph.getOrDefault(node, Set.of())) {
            var cycle = dfs(dep, graph, path, onPath, done);
            if (cycle != null) return cycle;
        }
        path.remove(path.size() - 1);
        onPath.remove(node);
        done.add(node);
        return null;
    }

    public RegisteredSource get(String sourceId) {
        return find(sourceId).orElseThrow(() -> new UnknownSourceException(sourceId));
    }

    public Optional<RegisteredSource> find(String sourceId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sources.get(sourceId));
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Snapshot in registration order. */
    public List<RegisteredSource> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(sources.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Ids of sources that list {@code sourceId} as a direct dependency. */
    public Set<String> dependentsOf(String sourceId) {
        lock.readLock().lock();
        try {
            var out = new LinkedHashSet<String>();
            for (RegisteredSource s : sources.values()) {
                if (s.source().dependencies().contains(sourceId)) out.add(s.id());
            }
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    /** @throws SourceInUseException while other sources still depend on it */
    public RegisteredSource remove(String sourceId) {
        lock.writeLock().lock();
        try {
            if (!sources.containsKey(sourceId)) throw new UnknownSourceException(sourceId);
            Set<String> dependents = dependentsOf(sourceId);
            if (!dependents.isEmpty()) throw new SourceInUseException(sourceId, dependents);
            return sources.remove(sourceId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Drops every source; returns the ids removed. */
    public List<String> clear() {
        lock.writeLock().lock();
        try {
            var ids = List.copyOf(sources.keySet());
            sources.clear();
            return ids;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return sources.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Runs {@code body} under the read lock so no register/remove interleaves with it. */
    public <T> T read(Supplier<T> body) {
        lock.readLock().lock();
        try {
            return body.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
