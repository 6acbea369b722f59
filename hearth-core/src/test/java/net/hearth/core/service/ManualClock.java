package net.hearth.core.service;

import net.hearth.core.spi.Clock;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

final class ManualClock implements Clock {
    private final AtomicReference<Instant> now;

    ManualClock(String start) { this.now = new AtomicReference<>(Instant.parse(start)); }

    @Override
    public Instant now() { return now.get(); }

    void set(String instant) { now.set(Instant.parse(instant)); }

    void advance(Duration d) { now.updateAndGet(t -> t.plus(d)); }
}
