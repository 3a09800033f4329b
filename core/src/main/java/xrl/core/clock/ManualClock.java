package xrl.core.clock;

import java.time.Duration;

/**
 * Hand-driven clock for deterministic tests.
 * Reads and writes are volatile so background tasks observe advances made by the test thread.
 */
public final class ManualClock implements Clock {
    private volatile long now;

    public ManualClock(long startNanos) {
        this.now = startNanos;
    }

    @Override
    public long nowNanos() {
        return now;
    }

    public synchronized void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now += delta;
    }

    public void advance(Duration delta) {
        advanceNanos(delta.toNanos());
    }

    public synchronized void setNanos(long value) {
        if (value < now) throw new IllegalArgumentException("clock cannot move backwards");
        now = value;
    }
}
