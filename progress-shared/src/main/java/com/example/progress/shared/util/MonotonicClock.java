package com.example.progress.shared.util;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Epoch-millisecond source that never goes backwards, even if the wall clock is adjusted.
 * Envelope timestamps are taken from here so that a client can order what it receives.
 */
public class MonotonicClock {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public MonotonicClock(Clock clock) {
        this.clock = clock;
    }

    public static MonotonicClock systemUTC() {
        return new MonotonicClock(Clock.systemUTC());
    }

    public long millis() {
        long now = clock.millis();
        return last.updateAndGet(previous -> Math.max(previous, now));
    }
}
