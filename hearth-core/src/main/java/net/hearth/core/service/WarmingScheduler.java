package net.hearth.core.service;

import net.hearth.core.error.ScheduleException;
import net.hearth.core.model.SourceState;
import net.hearth.core.model.SourceStatus;
import net.hearth.core.model.WarmRun;
import net.hearth.core.model.WarmTrigger;
import net.hearth.core.model.WarmingSource;
import net.hearth.core.model.WarmingStrategy;
import net.hearth.core.registry.RegisteredSource;
import net.hearth.core.registry.SourceRegistry;
import net.hearth.core.schedule.JitterApplicator;
import net.hearth.core.schedule.ScheduleCalculator;
import net.hearth.core.spi.CacheWriter;
import net.hearth.core.spi.Clock;
import net.hearth.core.spi.CronCalculator;
import net.hearth.core.spi.WarmingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Decides what is due on every tick and dispatches the warms.
 * <p>
 * {@link #tick()} only plans: it claims due sources, resolves each one's dependency chain into a
 * {@link WarmBatch} and returns. Fetches run on the worker pool; a dependent waits on its dependencies'
 * futures rather than on a worker thread. Runtime state lives in one {@link SourceRuntime} per source id.
 */
public final class WarmingScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WarmingScheduler.class);

    private final SourceRegistry registry;
    private final CronCalculator calculator;
    private final JitterApplicator jitter;
    private final Clock clock;
    private final List<WarmingListener> listeners;
    private final WarmDispatcher dispatcher;
    private final ExecutorService ownedWorkers;
    private final Map<String, SourceRuntime> runtimes = new ConcurrentHashMap<>();
    private final AtomicBoolean enabled;
    private final Object tickerLock = new Object();
    private ScheduledExecutorService ticker;

    private WarmingScheduler(Builder b) {
        this.clock = b.clock;
        this.calculator = b.calculator;
        this.registry = b.registry != null ? b.registry : new SourceRegistry(b.clock, ZoneOffset.UTC, b.calculator);
        this.jitter = b.jitter;
        this.listeners = List.copyOf(b.listeners);
        this.enabled = new AtomicBoolean(b.enabled);
        Executor workers = b.workers;
        if (workers == null) {
            this.ownedWorkers = Executors.newFixedThreadPool(b.workerThreads, namedThreads("hearth-worker"));
            workers = ownedWorkers;
        } else {
            this.ownedWorkers = null;
        }
        this.dispatcher = new WarmDispatcher(workers, Objects.requireNonNull(b.cache, "cacheWriter"), b.clock, b.fetchTimeout);
    }

    public static Builder builder() { return new Builder(); }

    // ---- registration ----

    /** Validates and activates a source. Registration errors propagate and leave nothing behind. */
    public RegisteredSource register(WarmingSource source) {
        RegisteredSource reg = registry.register(source);
        SourceRuntime rt = new SourceRuntime(reg.id(), this::fireStateChanged);
        runtimes.put(reg.id(), rt);

        if (reg.scheduled()) {
            Instant next = naturalNext(reg, clock.now());
            rt.schedule(next);
            log.info("Scheduled warming for source {}: '{}' in {} (min interval {} ms, next {})",
                    reg.id(), reg.cron().source(), reg.zone().name(),
                    ScheduleCalculator.minimumIntervalMs(reg.cron()), next);
            if (next != null) notify(l -> l.onScheduled(reg.id(), next));
        } else {
            if (source.strategy() == WarmingStrategy.EAGER) rt.markEagerPending();
            log.info("Added warming source {} ({}, namespace {})", reg.id(), source.strategy(), source.namespace());
        }
        return reg;
    }

    /** Unregisters a source and cancels its pending retry. An in-flight fetch finishes but its result is dropped. */
    public void remove(String sourceId) {
        registry.remove(sourceId);
        SourceRuntime rt = runtimes.remove(sourceId);
        if (rt != null) rt.markRemoved();
        log.info("Removed warming source {}", sourceId);
    }

    public void clear() {
        List<String> ids = registry.clear();
        for (String id : ids) {
            SourceRuntime rt = runtimes.remove(id);
            if (rt != null) rt.markRemoved();
        }
        log.info("Cleared {} warming sources", ids.size());
    }

    public SourceRegistry registry() { return registry; }

    // ---- ticking ----

    /** One planning pass. Never blocks on a fetch and never throws. */
    public void tick() {
        if (!enabled.get()) return;
        try {
            Instant now = clock.now();
            var batch = newBatch();
            int dispatched = registry.read(() -> plan(now, batch));
            if (dispatched > 0) log.debug("Tick at {} dispatched {} source(s), {} warm(s) in batch", now, dispatched, batch.size());
        } catch (RuntimeException e) {
            log.error("Warming tick failed", e);
        }
    }

    private int plan(Instant now, WarmBatch batch) {
        var due = new ArrayList<RegisteredSource>();
        var triggers = new ArrayList<WarmTrigger>();
        for (RegisteredSource reg : registry.all()) {
            SourceRuntime rt = runtimes.get(reg.id());
            if (rt == null) continue;
            WarmTrigger trigger = rt.claimIfDue(now, reg.scheduled());
            if (trigger != null) {
                due.add(reg);
                triggers.add(trigger);
                batch.claim(reg.id(), trigger);
            }
        }
        for (int i = 0; i < due.size(); i++) {
            RegisteredSource reg = due.get(i);
            WarmTrigger trigger = triggers.get(i);
            // a retry re-runs only the failed source; its dependencies already ran this cycle
            List<RegisteredSource> order = trigger == WarmTrigger.RETRY ? List.of(reg) : chain(reg.id());
            batch.warm(order, trigger);
        }
        return due.size();
    }

    private List<RegisteredSource> chain(String sourceId) {
        var out = new ArrayList<RegisteredSource>();
        for (String id : registry.resolveWarmOrder(sourceId)) out.add(registry.get(id));
        return out;
    }

    /** Starts an internal ticker. Hosts with their own timer call {@link #tick()} instead. */
    public void start(Duration tickInterval) {
        synchronized (tickerLock) {
            if (ticker != null) return;
            ticker = Executors.newSingleThreadScheduledExecutor(namedThreads("hearth-ticker"));
            ticker.scheduleAtFixedRate(this::tick, 0, tickInterval.toMillis(), TimeUnit.MILLISECONDS);
        }
        log.info("Warming scheduler started (tick every {} ms, {} sources)", tickInterval.toMillis(), registry.size());
    }

    public void stop() {
        synchronized (tickerLock) {
            if (ticker == null) return;
            ticker.shutdownNow();
            ticker = null;
        }
        log.info("Warming scheduler stopped");
    }

    @Override
    public void close() {
        stop();
        if (ownedWorkers != null) ownedWorkers.shutdownNow();
    }

    // ---- manual warming ----

    /** Warms a source now, dependencies first. Completes with SKIPPED while the scheduler is disabled. */
    public CompletableFuture<WarmRun> warmNow(String sourceId) {
        RegisteredSource reg = registry.get(sourceId);
        if (!enabled.get()) {
            log.warn("Cache warming is disabled; not warming {}", sourceId);
            return CompletableFuture.completedFuture(
                    WarmRun.skipped(sourceId, reg.source().namespace(), WarmTrigger.MANUAL, clock.now(), "warming disabled"));
        }
        var batch = newBatch();
        return registry.read(() -> batch.warm(chain(sourceId), WarmTrigger.MANUAL));
    }

    /** Warms every registered source once, sharing one batch so common dependencies are fetched once. */
    public CompletableFuture<List<WarmRun>> warmAll() {
        if (!enabled.get()) {
            log.warn("Cache warming is disabled; not warming all sources");
            return CompletableFuture.completedFuture(List.of());
        }
        var batch = newBatch();
        List<CompletableFuture<WarmRun>> futures = registry.read(() -> {
            var fs = new ArrayList<CompletableFuture<WarmRun>>();
            for (RegisteredSource reg : registry.all()) fs.add(batch.warm(chain(reg.id()), WarmTrigger.MANUAL));
            return fs;
        });
        log.info("Warming all cache sources ({})", futures.size());
        return CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    // ---- switch ----

    public void enable() {
        if (enabled.compareAndSet(false, true)) log.info("Cache warming enabled ({} sources)", registry.size());
    }

    public void disable() {
        if (enabled.compareAndSet(true, false)) log.info("Cache warming disabled ({} sources)", registry.size());
    }

    public boolean isEnabled() { return enabled.get(); }

    // ---- status ----

    public Optional<SourceStatus> status(String sourceId) {
        return Optional.ofNullable(runtimes.get(sourceId)).map(SourceRuntime::snapshot);
    }

    public List<SourceStatus> statuses() {
        var out = new ArrayList<SourceStatus>();
        for (RegisteredSource reg : registry.all()) {
            SourceRuntime rt = runtimes.get(reg.id());
            if (rt != null) out.add(rt.snapshot());
        }
        return out;
    }

    // ---- execution ----

    private WarmBatch newBatch() {
        return new WarmBatch(this::warmOne);
    }

    private CompletableFuture<WarmRun> warmOne(RegisteredSource reg, WarmTrigger trigger) {
        WarmingSource source = reg.source();
        SourceRuntime rt = runtimes.get(reg.id());
        SourceRuntime.Claim claim = rt == null ? null : rt.beginWarm(trigger);
        if (claim == null) {
            return CompletableFuture.completedFuture(
                    WarmRun.skipped(reg.id(), source.namespace(), trigger, clock.now(), "source removed"));
        }
        if (!claim.owner()) return claim.future();

        notify(l -> l.onWarmStarted(reg.id(), trigger));
        CompletableFuture<WarmRun> execution;
        try {
            execution = dispatcher.execute(source, trigger, rt::isRemoved);
        } catch (RuntimeException e) {
            // e.g. the worker pool rejected the task
            Instant now = clock.now();
            execution = CompletableFuture.completedFuture(
                    WarmRun.failed(reg.id(), source.namespace(), trigger, now, now, e.toString()));
        }
        execution.whenComplete((run, err) -> {
            WarmRun result = run;
            if (result == null) {
                Instant now = clock.now();
                result = WarmRun.failed(reg.id(), source.namespace(), trigger, now, now, String.valueOf(err));
            }
            try {
                settle(reg, rt, result);
            } catch (RuntimeException e) {
                log.error("Failed to record warm result of source {}", reg.id(), e);
            } finally {
                claim.future().complete(result);
            }
        });
        return claim.future();
    }

    private void settle(RegisteredSource reg, SourceRuntime rt, WarmRun run) {
        Instant now = clock.now();
        SourceRuntime.Settlement s = rt.settle(run, RetryPolicy.of(reg.source().backoff()), now,
                () -> naturalNext(reg, now));
        if (s.discarded()) return;

        notify(l -> l.onWarmCompleted(run));
        if (s.decision() != null) {
            if (!s.decision().isExhausted()) {
                log.info("Retrying warming for source {} in {} ms (attempt {}, {} consecutive failures)",
                        reg.id(), s.decision().delay().toMillis(), s.retryAttempt(), s.consecutiveFailures());
                notify(l -> l.onRetryScheduled(reg.id(), s.retryAttempt(), s.retryAt()));
            } else if (reg.source().backoff() != null) {
                log.warn("Maximum retry count reached for source {} ({} consecutive failures); next run {}",
                        reg.id(), s.consecutiveFailures(), s.nextRunAt());
                notify(l -> l.onRetriesExhausted(reg.id(), s.consecutiveFailures()));
            }
        }
        if (s.ownRun() && s.nextRunAt() != null) {
            log.debug("Next run of source {} at {}", reg.id(), s.nextRunAt());
            notify(l -> l.onScheduled(reg.id(), s.nextRunAt()));
        }
    }

    /** Next cron match after {@code from}, with the delay jittered once. Null for unscheduled sources. */
    private Instant naturalNext(RegisteredSource reg, Instant from) {
        if (!reg.scheduled()) return null;
        try {
            Instant match = calculator.next(reg.cron(), reg.zone(), from);
            long delayMs = jitter.applyJitter(Duration.between(from, match).toMillis(), reg.source().jitter());
            return from.plusMillis(delayMs);
        } catch (ScheduleException e) {
            log.error("Source {} has no further runs and is deactivated", reg.id(), e);
            return null;
        }
    }

    private void fireStateChanged(String sourceId, SourceState from, SourceState to) {
        log.trace("Source {}: {} -> {}", sourceId, from, to);
        notify(l -> l.onStateChanged(sourceId, from, to));
    }

    private void notify(Consumer<WarmingListener> event) {
        for (WarmingListener l : listeners) {
            try {
                event.accept(l);
            } catch (RuntimeException e) {
                log.warn("Warming listener {} failed", l.getClass().getName(), e);
            }
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private Clock clock = Clock.system();
        private CronCalculator calculator = new ScheduleCalculator();
        private SourceRegistry registry;
        private JitterApplicator jitter = new JitterApplicator();
        private CacheWriter cache;
        private final List<WarmingListener> listeners = new ArrayList<>();
        private Executor workers;
        private int workerThreads = 4;
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private boolean enabled = true;

        private Builder() {}

        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder calculator(CronCalculator calculator) { this.calculator = calculator; return this; }
        /** Defaults to a registry sharing this builder's clock and calculator, with UTC as default zone. */
        public Builder registry(SourceRegistry registry) { this.registry = registry; return this; }
        public Builder jitter(JitterApplicator jitter) { this.jitter = jitter; return this; }
        public Builder cacheWriter(CacheWriter cache) { this.cache = cache; return this; }
        public Builder listener(WarmingListener listener) { this.listeners.add(listener); return this; }
        public Builder listeners(List<? extends WarmingListener> listeners) { this.listeners.addAll(listeners); return this; }
        /** Caller-owned executor; when absent a fixed pool of {@link #workerThreads(int)} is created and owned. */
        public Builder workers(Executor workers) { this.workers = workers; return this; }
        public Builder workerThreads(int workerThreads) {
            if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be positive");
            this.workerThreads = workerThreads;
            return this;
        }
        /** Zero or null disables the timeout. */
        public Builder fetchTimeout(Duration fetchTimeout) { this.fetchTimeout = fetchTimeout; return this; }
        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }

        public WarmingScheduler build() { return new WarmingScheduler(this); }
    }
}
