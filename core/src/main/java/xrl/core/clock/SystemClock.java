package xrl.core.clock;

/**
 * Real monotonic clock - uses System.nanoTime().
 * Use this in production and in timing-based tests of the async runtime.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
