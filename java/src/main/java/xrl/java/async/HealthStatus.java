package xrl.java.async;

public enum HealthStatus {
    HEALTHY,
    /** Alive, but at least half of the tolerated consecutive errors reached. */
    DEGRADED,
    /** Terminated itself. */
    FAILED,
    /** Replaced by the supervisor; reassessed on the next check. */
    RESTARTING
}
