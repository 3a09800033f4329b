package xrl.core.throttle;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Ordered timestamps of provider-reported violations, oldest first.
 * Entries older than the retention period are dropped on every append.
 */
public final class ViolationHistory {
    public static final long RETENTION_NANOS = 3_600_000_000_000L;

    private final ArrayDeque<Long> timestamps = new ArrayDeque<>();
    private long total;

    public void record(long nowNanos) {
        timestamps.addLast(nowNanos);
        total++;
        prune(nowNanos);
    }

    /**
     * Number of violations no older than {@code windowNanos}.
     */
    public int countWithin(long nowNanos, long windowNanos) {
        int count = 0;
        Iterator<Long> it = timestamps.descendingIterator();
        while (it.hasNext()) {
            if (nowNanos - it.next() > windowNanos) {
                break;
            }
            count++;
        }
        return count;
    }

    public boolean isEmpty() {
        return timestamps.isEmpty();
    }

    public long latestNanos() {
        if (timestamps.isEmpty()) throw new IllegalStateException("no violations recorded");
        return timestamps.peekLast();
    }

    public int retained() {
        return timestamps.size();
    }

    public long total() {
        return total;
    }

    private void prune(long nowNanos) {
        while (!timestamps.isEmpty() && nowNanos - timestamps.peekFirst() > RETENTION_NANOS) {
            timestamps.removeFirst();
        }
    }
}
