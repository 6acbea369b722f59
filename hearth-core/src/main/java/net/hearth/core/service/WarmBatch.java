package net.hearth.core.service;

import net.hearth.core.model.WarmRun;
import net.hearth.core.model.WarmStatus;
import net.hearth.core.model.WarmTrigger;
import net.hearth.core.registry.RegisteredSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;

/**
 * One trigger batch. Memoizes a warm per source id so a dependency shared by several due sources is fetched once,
 * and chains each source behind the futures of its direct dependencies.
 * Not thread-safe: a batch is built by a single planning thread.
 */
final class WarmBatch {
    private static final Logger log = LoggerFactory.getLogger(WarmBatch.class);

    private final Map<String, CompletableFuture<WarmRun>> memo = new HashMap<>();
    private final Map<String, WarmTrigger> claimed = new HashMap<>();
    private final BiFunction<RegisteredSource, WarmTrigger, CompletableFuture<WarmRun>> runner;

    WarmBatch(BiFunction<RegisteredSource, WarmTrigger, CompletableFuture<WarmRun>> runner) {
        this.runner = runner;
    }

    /** Records that a tick claimed {@code sourceId}; its warm keeps this trigger even when reached as a dependency. */
    void claim(String sourceId, WarmTrigger trigger) {
        claimed.put(sourceId, trigger);
    }

    /**
     * @param order dependency-first chain; the last element is the source that was triggered
     * @return the triggered source's warm
     */
    CompletableFuture<WarmRun> warm(List<RegisteredSource> order, WarmTrigger trigger) {
        RegisteredSource root = order.get(order.size() - 1);
        for (RegisteredSource s : order) {
            if (memo.containsKey(s.id())) continue;

            var deps = new ArrayList<CompletableFuture<WarmRun>>();
            for (String dep : s.source().dependencies()) {
                var f = memo.get(dep);
                if (f != null) deps.add(f);
            }
            WarmTrigger t = s == root ? trigger : claimed.getOrDefault(s.id(), WarmTrigger.DEPENDENCY);
            CompletableFuture<WarmRun> f = CompletableFuture
                    .allOf(deps.toArray(CompletableFuture[]::new))
                    .handle((ignored, err) -> null)
                    .thenCompose(ignored -> {
                        warnOnFailedDependencies(s, deps);
                        return runner.apply(s, t);
                    });
            memo.put(s.id(), f);
        }
        return memo.get(root.id());
    }

    int size() { return memo.size(); }

    private static void warnOnFailedDependencies(RegisteredSource s, List<CompletableFuture<WarmRun>> deps) {
        for (var f : deps) {
            if (f.isCompletedExceptionally()) {
                log.warn("Warming {} although one of its dependencies did not complete", s.id());
                continue;
            }
            WarmRun r = f.join();
            if (r.status() == WarmStatus.FAILED) {
                log.warn("Warming {} although its dependency {} failed", s.id(), r.sourceId());
            }
        }
    }
}
