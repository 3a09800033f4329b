package xrl.core.config;

import java.time.Duration;

/**
 * Immutable limits and throttling policy of one rate-limit group.
 *
 * <p>The primary leg allows {@code baseRps} requests per second with bursts of
 * {@code burstCapacity}. A group with {@code requestsPerMinute > 0} is dual-limited:
 * a secondary leg allows {@code requestsPerMinute} per minute with bursts of
 * {@code rpmBurstCapacity}, and both legs must admit a call.
 *
 * <p>Tuning constants (reduction ratio, recovery step, preventive delays) are policy,
 * kept here rather than in the algorithms.
 *
 * @param baseRps steady requests per second of the primary leg
 * @param burstCapacity primary burst window slots
 * @param observationInterval primary burst window interval; null means {@code burstCapacity / baseRps} seconds
 * @param requestsPerMinute secondary leg rate, 0 for single-limit groups
 * @param rpmBurstCapacity secondary burst window slots
 * @param dynamicAdjustment whether provider violations reduce the rate
 * @param errorThreshold violations within {@code errorWindow} that trigger a reduction
 * @param errorWindow look-back window for the threshold
 * @param reductionRatio multiplier applied to the current ratio on reduction
 * @param minRatio lower bound of the current ratio, strictly positive
 * @param recoveryDelay quiet time after the last reduction before recovery starts
 * @param recoveryStep ratio increment per recovery pass
 * @param preventiveThrottling whether recent violations delay new calls
 * @param preventiveWindow time after a violation during which new calls are delayed
 * @param maxPreventiveDelay upper bound of the preventive delay
 * @param preventiveDelayStep preventive delay contributed by each recent violation
 */
public record GroupConfig(
    double baseRps,
    int burstCapacity,
    Duration observationInterval,
    int requestsPerMinute,
    int rpmBurstCapacity,
    boolean dynamicAdjustment,
    int errorThreshold,
    Duration errorWindow,
    double reductionRatio,
    double minRatio,
    Duration recoveryDelay,
    double recoveryStep,
    boolean preventiveThrottling,
    Duration preventiveWindow,
    Duration maxPreventiveDelay,
    Duration preventiveDelayStep
) {
    public static final int DEFAULT_ERROR_THRESHOLD = 1;
    public static final Duration DEFAULT_ERROR_WINDOW = Duration.ofSeconds(60);
    public static final double DEFAULT_REDUCTION_RATIO = 0.8;
    public static final double DEFAULT_MIN_RATIO = 0.5;
    public static final Duration DEFAULT_RECOVERY_DELAY = Duration.ofMinutes(5);
    public static final double DEFAULT_RECOVERY_STEP = 0.05;
    public static final Duration DEFAULT_PREVENTIVE_WINDOW = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MAX_PREVENTIVE_DELAY = Duration.ofMillis(500);
    public static final Duration DEFAULT_PREVENTIVE_DELAY_STEP = Duration.ofMillis(100);

    public GroupConfig {
        if (!(baseRps > 0) || Double.isInfinite(baseRps)) {
            throw new ConfigurationException("baseRps must be > 0, got: " + baseRps);
        }
        if (burstCapacity < 1) {
            throw new ConfigurationException("burstCapacity must be >= 1, got: " + burstCapacity);
        }
        if (observationInterval == null) {
            observationInterval = Duration.ofNanos(Math.round(burstCapacity * 1_000_000_000d / baseRps));
        }
        requirePositive("observationInterval", observationInterval);
        if (requestsPerMinute < 0) {
            throw new ConfigurationException("requestsPerMinute must be >= 0, got: " + requestsPerMinute);
        }
        if (requestsPerMinute > 0 && rpmBurstCapacity < 1) {
            throw new ConfigurationException("rpmBurstCapacity must be >= 1 for dual-limit groups, got: "
                + rpmBurstCapacity);
        }
        if (errorThreshold < 1) {
            throw new ConfigurationException("errorThreshold must be >= 1, got: " + errorThreshold);
        }
        requirePositive("errorWindow", errorWindow);
        if (!(reductionRatio > 0) || reductionRatio > 1.0) {
            throw new ConfigurationException("reductionRatio must be in (0, 1], got: " + reductionRatio);
        }
        if (!(minRatio > 0) || minRatio > 1.0) {
            throw new ConfigurationException("minRatio must be in (0, 1], got: " + minRatio);
        }
        requireNonNegative("recoveryDelay", recoveryDelay);
        if (!(recoveryStep > 0) || recoveryStep > 1.0) {
            throw new ConfigurationException("recoveryStep must be in (0, 1], got: " + recoveryStep);
        }
        requirePositive("preventiveWindow", preventiveWindow);
        requireNonNegative("maxPreventiveDelay", maxPreventiveDelay);
        requireNonNegative("preventiveDelayStep", preventiveDelayStep);
    }

    /**
     * Single-limit group with the default throttling policy.
     */
    public static GroupConfig singleLimit(double baseRps, int burstCapacity) {
        return builder(baseRps, burstCapacity).build();
    }

    /**
     * Dual-limit group (per second AND per minute) with the default throttling policy.
     */
    public static GroupConfig dualLimit(double baseRps, int burstCapacity, int requestsPerMinute, int rpmBurstCapacity) {
        return builder(baseRps, burstCapacity)
            .requestsPerMinute(requestsPerMinute, rpmBurstCapacity)
            .build();
    }

    public static Builder builder(double baseRps, int burstCapacity) {
        return new Builder(baseRps, burstCapacity);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public boolean dualLimit() {
        return requestsPerMinute > 0;
    }

    /**
     * Secondary window interval: exactly one limiting period of the per-minute leg.
     */
    public Duration secondaryInterval() {
        if (!dualLimit()) {
            throw new IllegalStateException("group is not dual-limited");
        }
        return Duration.ofNanos(Math.round(rpmBurstCapacity * 60_000_000_000d / requestsPerMinute));
    }

    public double secondaryRps() {
        return requestsPerMinute / 60.0;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new ConfigurationException(name + " must be > 0, got: " + value);
        }
    }

    private static void requireNonNegative(String name, Duration value) {
        if (value == null || value.isNegative()) {
            throw new ConfigurationException(name + " must be >= 0, got: " + value);
        }
    }

    public static final class Builder {
        private double baseRps;
        private int burstCapacity;
        private Duration observationInterval;
        private int requestsPerMinute;
        private int rpmBurstCapacity;
        private boolean dynamicAdjustment = true;
        private int errorThreshold = DEFAULT_ERROR_THRESHOLD;
        private Duration errorWindow = DEFAULT_ERROR_WINDOW;
        private double reductionRatio = DEFAULT_REDUCTION_RATIO;
        private double minRatio = DEFAULT_MIN_RATIO;
        private Duration recoveryDelay = DEFAULT_RECOVERY_DELAY;
        private double recoveryStep = DEFAULT_RECOVERY_STEP;
        private boolean preventiveThrottling = true;
        private Duration preventiveWindow = DEFAULT_PREVENTIVE_WINDOW;
        private Duration maxPreventiveDelay = DEFAULT_MAX_PREVENTIVE_DELAY;
        private Duration preventiveDelayStep = DEFAULT_PREVENTIVE_DELAY_STEP;

        private Builder(double baseRps, int burstCapacity) {
            this.baseRps = baseRps;
            this.burstCapacity = burstCapacity;
        }

        private Builder(GroupConfig config) {
            this.baseRps = config.baseRps;
            this.burstCapacity = config.burstCapacity;
            this.observationInterval = config.observationInterval;
            this.requestsPerMinute = config.requestsPerMinute;
            this.rpmBurstCapacity = config.rpmBurstCapacity;
            this.dynamicAdjustment = config.dynamicAdjustment;
            this.errorThreshold = config.errorThreshold;
            this.errorWindow = config.errorWindow;
            this.reductionRatio = config.reductionRatio;
            this.minRatio = config.minRatio;
            this.recoveryDelay = config.recoveryDelay;
            this.recoveryStep = config.recoveryStep;
            this.preventiveThrottling = config.preventiveThrottling;
            this.preventiveWindow = config.preventiveWindow;
            this.maxPreventiveDelay = config.maxPreventiveDelay;
            this.preventiveDelayStep = config.preventiveDelayStep;
        }

        public Builder rate(double baseRps, int burstCapacity) {
            this.baseRps = baseRps;
            this.burstCapacity = burstCapacity;
            this.observationInterval = null;
            return this;
        }

        public Builder observationInterval(Duration observationInterval) {
            this.observationInterval = observationInterval;
            return this;
        }

        public Builder requestsPerMinute(int requestsPerMinute, int rpmBurstCapacity) {
            this.requestsPerMinute = requestsPerMinute;
            this.rpmBurstCapacity = rpmBurstCapacity;
            return this;
        }

        public Builder dynamicAdjustment(boolean enabled) {
            this.dynamicAdjustment = enabled;
            return this;
        }

        public Builder errorThreshold(int errorThreshold, Duration errorWindow) {
            this.errorThreshold = errorThreshold;
            this.errorWindow = errorWindow;
            return this;
        }

        public Builder reduction(double reductionRatio, double minRatio) {
            this.reductionRatio = reductionRatio;
            this.minRatio = minRatio;
            return this;
        }

        public Builder recovery(Duration recoveryDelay, double recoveryStep) {
            this.recoveryDelay = recoveryDelay;
            this.recoveryStep = recoveryStep;
            return this;
        }

        public Builder preventiveThrottling(boolean enabled) {
            this.preventiveThrottling = enabled;
            return this;
        }

        public Builder preventive(Duration window, Duration maxDelay, Duration delayStep) {
            this.preventiveWindow = window;
            this.maxPreventiveDelay = maxDelay;
            this.preventiveDelayStep = delayStep;
            return this;
        }

        public GroupConfig build() {
            return new GroupConfig(
                baseRps,
                burstCapacity,
                observationInterval,
                requestsPerMinute,
                rpmBurstCapacity,
                dynamicAdjustment,
                errorThreshold,
                errorWindow,
                reductionRatio,
                minRatio,
                recoveryDelay,
                recoveryStep,
                preventiveThrottling,
                preventiveWindow,
                maxPreventiveDelay,
                preventiveDelayStep
            );
        }
    }
}
