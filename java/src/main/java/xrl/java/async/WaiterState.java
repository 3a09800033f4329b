package xrl.java.async;

/**
 * Lifecycle of a queued caller. COMPLETED and CANCELLED are terminal.
 */
public enum WaiterState {
    WAITING,
    READY,
    CANCELLED,
    COMPLETED;

    public boolean terminal() {
        return this == CANCELLED || this == COMPLETED;
    }
}
