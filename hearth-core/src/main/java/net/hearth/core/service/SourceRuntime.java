package net.hearth.core.service;

import net.hearth.core.model.SourceState;
import net.hearth.core.model.SourceStatus;
import net.hearth.core.model.WarmRun;
import net.hearth.core.model.WarmStatus;
import net.hearth.core.model.WarmTrigger;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Mutable runtime state of one source. Every mutation happens under this object's monitor,
 * so state changes for a given source are serialized whichever batch or thread drives them.
 */
final class SourceRuntime {

    interface StateObserver {
        void changed(String sourceId, SourceState from, SourceState to);
    }

    /** Future of the warm to wait on; {@code owner} is true when the caller must run it. */
    record Claim(CompletableFuture<WarmRun> future, boolean owner) {}

    /** What {@link #settle} decided, for logging and listeners. */
    record Settlement(boolean discarded, RetryDecision decision, Instant retryAt, Instant nextRunAt,
                      int consecutiveFailures, int retryAttempt, boolean ownRun) {
        static Settlement discardedRun() {
            return new Settlement(true, null, null, null, 0, 0, false);
        }
    }

    private final String sourceId;
    private final StateObserver observer;

    private SourceState state = SourceState.IDLE;
    private Instant nextRunAt;
    private Instant retryAt;
    private Instant lastRunAt;
    private int consecutiveFailures;
    private int retryAttempt;
    private WarmStatus lastStatus;
    private String lastError;
    private boolean eagerPending;
    private boolean removed;
    private WarmTrigger claimed;
    private CompletableFuture<WarmRun> inFlight;

    SourceRuntime(String sourceId, StateObserver observer) {
        this.sourceId = sourceId;
        this.observer = observer;
    }

    /**
     * Marks the source DUE when its natural run, its retry, or its pending eager warm has come.
     * Natural run wins over a retry that is not earlier. In-flight sources are never claimed.
     *
     * @return the trigger of the claimed run, or null when nothing is due
     */
    synchronized WarmTrigger claimIfDue(Instant now, boolean scheduled) {
        if (removed || (state != SourceState.IDLE && state != SourceState.BACKOFF)) return null;

        WarmTrigger trigger = null;
        boolean naturalDue = scheduled && nextRunAt != null && !nextRunAt.isAfter(now);
        boolean retryDue = state == SourceState.BACKOFF && retryAt != null && !retryAt.isAfter(now);
        if (naturalDue && (!retryDue || !nextRunAt.isAfter(retryAt))) {
            trigger = WarmTrigger.SCHEDULE;
        } else if (retryDue) {
            trigger = WarmTrigger.RETRY;
        } else if (eagerPending && state == SourceState.IDLE) {
            trigger = WarmTrigger.EAGER;
        }
        if (trigger == null) return null;

        if (trigger == WarmTrigger.SCHEDULE) {
            retryAt = null;
            retryAttempt = 0;
        }
        eagerPending = false;
        claimed = trigger;
        transition(SourceState.DUE);
        return trigger;
    }

    /** Joins a warm already in flight, or starts one. Returns null once the source is removed. */
    synchronized Claim beginWarm(WarmTrigger trigger) {
        if (removed) return null;
        if (inFlight != null) return new Claim(inFlight, false);

        if (trigger == WarmTrigger.SCHEDULE || trigger == WarmTrigger.MANUAL || trigger == WarmTrigger.EAGER) {
            retryAttempt = 0;
        } else if (trigger == WarmTrigger.DEPENDENCY && retryAt == null) {
            // no retry cycle of its own is pending: a dependency warm opens a fresh one
            retryAttempt = 0;
        }
        inFlight = new CompletableFuture<>();
        transition(SourceState.WARMING);
        return new Claim(inFlight, true);
    }

    /**
     * Records a finished warm. Failures bump the failure count and consult {@code policy}; an own run
     * (one this source was claimed for by a tick) also recomputes the natural next run via {@code naturalNext}.
     * Results arriving after removal are discarded.
     */
    synchronized Settlement settle(WarmRun run, RetryPolicy policy, Instant now, Supplier<Instant> naturalNext) {
        inFlight = null;
        if (removed) return Settlement.discardedRun();

        RetryDecision decision = null;
        lastStatus = run.status();
        if (run.status() != WarmStatus.SKIPPED) {
            lastRunAt = run.finishedAt();
            lastError = run.error();
        }
        if (run.status() == WarmStatus.SUCCEEDED) {
            transition(SourceState.SUCCEEDED);
            consecutiveFailures = 0;
            retryAttempt = 0;
            retryAt = null;
        } else if (run.status() == WarmStatus.FAILED) {
            transition(SourceState.FAILED);
            consecutiveFailures++;
            decision = policy.nextRetry(retryAttempt);
            if (decision.isExhausted()) {
                retryAt = null;
                retryAttempt = 0;
            } else {
                retryAttempt++;
                retryAt = now.plus(decision.delay());
            }
        }

        boolean ownRun = claimed != null;
        if (ownRun) nextRunAt = naturalNext.get();
        claimed = null;
        transition(retryAt != null ? SourceState.BACKOFF : SourceState.IDLE);
        return new Settlement(false, decision, retryAt, nextRunAt, consecutiveFailures, retryAttempt, ownRun);
    }

    synchronized void schedule(Instant next) {
        this.nextRunAt = next;
    }

    synchronized void markEagerPending() {
        this.eagerPending = true;
    }

    /** Cancels any pending retry; an in-flight result will be discarded on arrival. */
    synchronized void markRemoved() {
        removed = true;
        retryAt = null;
        claimed = null;
    }

    synchronized boolean isRemoved() { return removed; }

    synchronized SourceStatus snapshot() {
        return new SourceStatus(sourceId, state, nextRunAt, retryAt, consecutiveFailures, lastStatus, lastRunAt, lastError);
    }

    private void transition(SourceState to) {
        SourceState from = state;
        if (from == to) return;
        state = to;
        observer.changed(sourceId, from, to);
    }
}
