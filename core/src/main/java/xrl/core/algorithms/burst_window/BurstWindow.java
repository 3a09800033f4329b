package xrl.core.algorithms.burst_window;

import java.util.ArrayDeque;
import java.util.Iterator;

/**
 * Bounded log of completed-call timestamps (newest first) plus a count of
 * reserved calls that have not completed yet.
 *
 * <p>While committed + pending is below capacity a call may bypass steady-rate
 * spacing. Once full, the wait is the shortfall between the observation interval
 * and the time spanned from now back through the recorded calls.
 *
 * <p>Timestamps only enter on {@link #commit}; a reservation that is aborted never
 * occupies a slot.
 *
 * Thread-safety: none. The owning group's lock guards every call.
 */
public final class BurstWindow {
    private final int capacity;
    private final ArrayDeque<Long> timestamps;
    private int pending;

    public BurstWindow(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity <= 0");
        this.capacity = capacity;
        this.timestamps = new ArrayDeque<>(capacity + 1);
    }

    public boolean hasFreeSlot() {
        return timestamps.size() + pending < capacity;
    }

    /**
     * Drops every entry at least {@code intervalNanos} old.
     */
    public void evictExpired(long nowNanos, long intervalNanos) {
        while (!timestamps.isEmpty() && nowNanos - timestamps.peekLast() >= intervalNanos) {
            timestamps.removeLast();
        }
    }

    /**
     * Walks the log from the most recent entry backwards, summing the gap to now
     * and then each gap between neighbours, until the sum covers the interval.
     *
     * @return 0 if a slot is free or the interval is already covered, else the shortfall
     */
    public long waitNanos(long nowNanos, long intervalNanos) {
        if (hasFreeSlot()) {
            return 0L;
        }
        long covered = 0L;
        Iterator<Long> it = timestamps.iterator();
        if (it.hasNext()) {
            long newer = it.next();
            covered = Math.max(0L, nowNanos - newer);
            while (covered < intervalNanos && it.hasNext()) {
                long older = it.next();
                covered += newer - older;
                newer = older;
            }
        }
        return Math.max(0L, intervalNanos - covered);
    }

    public void reserve() {
        pending++;
    }

    /**
     * Turns one pending reservation into a recorded call.
     */
    public void commit(long completedAtNanos, long nowNanos, long intervalNanos) {
        releasePending();
        insertOrdered(completedAtNanos);
        while (timestamps.size() > capacity) {
            timestamps.removeLast();
        }
        evictExpired(nowNanos, intervalNanos);
    }

    public void abort() {
        releasePending();
    }

    public int occupancy() {
        return timestamps.size();
    }

    public int pending() {
        return pending;
    }

    public int capacity() {
        return capacity;
    }

    private void releasePending() {
        if (pending > 0) {
            pending--;
        }
    }

    private void insertOrdered(long ts) {
        if (timestamps.isEmpty() || ts >= timestamps.peekFirst()) {
            timestamps.addFirst(ts);
            return;
        }
        // completions can arrive out of order; keep newest-first
        ArrayDeque<Long> newer = new ArrayDeque<>();
        while (!timestamps.isEmpty() && timestamps.peekFirst() > ts) {
            newer.addLast(timestamps.removeFirst());
        }
        timestamps.addFirst(ts);
        while (!newer.isEmpty()) {
            timestamps.addFirst(newer.removeLast());
        }
    }
}
