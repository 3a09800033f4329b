package xrl.java.async;

/**
 * Health of one group's notifier.
 *
 * @param lastRestartNanos clock reading of the last restart, meaningful only if {@code restartCount > 0}
 */
public record NotifierHealth(
    HealthStatus status,
    int consecutiveErrors,
    long lastRestartNanos,
    int restartCount
) {
    public boolean restarted() {
        return restartCount > 0;
    }
}
