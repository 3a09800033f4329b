package xrl.core.config;

import java.time.Duration;

/**
 * Process-wide runtime policy of the limiter: waiter timeout, background task
 * cadence and the notifier recovery shell's backoff.
 *
 * @param waiterTimeout longest time a caller stays queued before a soft timeout
 * @param notifierTick period of each group's notifier task
 * @param healthCheckInterval period of the health supervisor
 * @param restartCooldown minimum time between two restarts of one group's notifier
 * @param maxConsecutiveErrors notifier failures in a row before it terminates itself
 * @param backoffBase first retry delay of a failing notifier
 * @param backoffMax cap of the notifier retry delay
 * @param backoffJitter upper bound of the random delay added to each retry
 * @param recoveryInterval period of the rate recovery loop
 * @param schedulerThreads size of the shared background scheduler
 */
public record LimiterSettings(
    Duration waiterTimeout,
    Duration notifierTick,
    Duration healthCheckInterval,
    Duration restartCooldown,
    int maxConsecutiveErrors,
    Duration backoffBase,
    Duration backoffMax,
    Duration backoffJitter,
    Duration recoveryInterval,
    int schedulerThreads
) {
    public LimiterSettings {
        requirePositive("waiterTimeout", waiterTimeout);
        requirePositive("notifierTick", notifierTick);
        requirePositive("healthCheckInterval", healthCheckInterval);
        if (restartCooldown == null || restartCooldown.isNegative()) {
            throw new ConfigurationException("restartCooldown must be >= 0, got: " + restartCooldown);
        }
        if (maxConsecutiveErrors < 1) {
            throw new ConfigurationException("maxConsecutiveErrors must be >= 1, got: " + maxConsecutiveErrors);
        }
        requirePositive("backoffBase", backoffBase);
        requirePositive("backoffMax", backoffMax);
        if (backoffJitter == null || backoffJitter.isNegative()) {
            throw new ConfigurationException("backoffJitter must be >= 0, got: " + backoffJitter);
        }
        requirePositive("recoveryInterval", recoveryInterval);
        if (schedulerThreads < 1) {
            throw new ConfigurationException("schedulerThreads must be >= 1, got: " + schedulerThreads);
        }
    }

    public static LimiterSettings defaults() {
        return new LimiterSettings(
            Duration.ofSeconds(30),
            Duration.ofMillis(10),
            Duration.ofSeconds(5),
            Duration.ofSeconds(30),
            10,
            Duration.ofMillis(100),
            Duration.ofSeconds(30),
            Duration.ofMillis(100),
            Duration.ofSeconds(30),
            2
        );
    }

    public LimiterSettings withWaiterTimeout(Duration value) {
        return new LimiterSettings(value, notifierTick, healthCheckInterval, restartCooldown,
            maxConsecutiveErrors, backoffBase, backoffMax, backoffJitter, recoveryInterval, schedulerThreads);
    }

    public LimiterSettings withNotifierTick(Duration value) {
        return new LimiterSettings(waiterTimeout, value, healthCheckInterval, restartCooldown,
            maxConsecutiveErrors, backoffBase, backoffMax, backoffJitter, recoveryInterval, schedulerThreads);
    }

    public LimiterSettings withHealthCheck(Duration interval, Duration cooldown) {
        return new LimiterSettings(waiterTimeout, notifierTick, interval, cooldown,
            maxConsecutiveErrors, backoffBase, backoffMax, backoffJitter, recoveryInterval, schedulerThreads);
    }

    public LimiterSettings withBackoff(int maxErrors, Duration base, Duration max, Duration jitter) {
        return new LimiterSettings(waiterTimeout, notifierTick, healthCheckInterval, restartCooldown,
            maxErrors, base, max, jitter, recoveryInterval, schedulerThreads);
    }

    public LimiterSettings withRecoveryInterval(Duration value) {
        return new LimiterSettings(waiterTimeout, notifierTick, healthCheckInterval, restartCooldown,
            maxConsecutiveErrors, backoffBase, backoffMax, backoffJitter, value, schedulerThreads);
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException(name + " must be > 0, got: " + value);
        }
    }
}
