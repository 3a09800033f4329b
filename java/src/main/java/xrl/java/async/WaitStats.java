package xrl.java.async;

/**
 * Request and wait-time counters of one group. Every acquire is counted as a request;
 * every queued caller is recorded exactly once more, when it leaves the queue.
 *
 * <p>Average wait is an exponential moving average: {@code avg = 0.9 * avg + 0.1 * sample}.
 */
public final class WaitStats {

    /**
     * Immutable copy for status reports.
     */
    public record Snapshot(
        long totalRequests,
        long totalWaits,
        long granted,
        long timeouts,
        long cancelled,
        long forced,
        long averageWaitNanos,
        long maxWaitNanos,
        int maxConcurrentWaiters
    ) {
    }

    private static final double DECAY = 0.9;

    private long totalRequests;
    private long totalWaits;
    private long granted;
    private long timeouts;
    private long cancelled;
    private long forced;
    private double averageWaitNanos;
    private long maxWaitNanos;
    private int maxConcurrentWaiters;

    public synchronized void recordRequest() {
        totalRequests++;
    }

    /**
     * @param queueDepth number of queued callers right after one was added
     */
    public synchronized void recordQueued(int queueDepth) {
        maxConcurrentWaiters = Math.max(maxConcurrentWaiters, queueDepth);
    }

    public synchronized void recordGranted(long waitNanos) {
        granted++;
        sample(waitNanos);
    }

    public synchronized void recordTimeout(long waitNanos) {
        timeouts++;
        sample(waitNanos);
    }

    public synchronized void recordCancelled(long waitNanos) {
        cancelled++;
        sample(waitNanos);
    }

    public synchronized void recordForced(long waitNanos) {
        forced++;
        sample(waitNanos);
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(totalRequests, totalWaits, granted, timeouts, cancelled, forced,
            Math.round(averageWaitNanos), maxWaitNanos, maxConcurrentWaiters);
    }

    private void sample(long waitNanos) {
        long wait = Math.max(0L, waitNanos);
        averageWaitNanos = totalWaits == 0 ? wait : DECAY * averageWaitNanos + (1 - DECAY) * wait;
        totalWaits++;
        maxWaitNanos = Math.max(maxWaitNanos, wait);
    }
}
