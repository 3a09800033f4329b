package xrl.core.throttle;

import xrl.core.config.GroupConfig;

/**
 * Rate ratio of one group, driven by provider violations.
 *
 * <p>Reduction is immediate: once the violations inside the error window reach the
 * threshold, the ratio is multiplied by the reduction ratio. Recovery is slow: a
 * periodic pass adds one recovery step after the recovery delay has passed since the
 * last reduction. The ratio always stays within {@code [minRatio, 1.0]}.
 *
 * <p>Preventive delay: for a while after a violation new calls are held back by a
 * delay that decays linearly to zero over the preventive window.
 *
 * Thread-safety: none. The owning group's lock guards every call.
 */
public final class AdaptiveThrottle {
    private final GroupConfig config;
    private final ViolationHistory violations = new ViolationHistory();

    private double currentRatio = 1.0;
    private boolean reduced;
    private long lastReductionNanos;
    private boolean recovered;
    private long lastRecoveryNanos;

    public AdaptiveThrottle(GroupConfig config) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");
        this.config = config;
    }

    /**
     * Records a violation and reduces the ratio if the threshold is reached.
     *
     * @return true if the ratio was reduced by this call
     */
    public boolean recordViolation(long nowNanos) {
        violations.record(nowNanos);
        if (!config.dynamicAdjustment()) {
            return false;
        }
        int recent = violations.countWithin(nowNanos, config.errorWindow().toNanos());
        if (recent < config.errorThreshold()) {
            return false;
        }
        currentRatio = clamp(currentRatio * config.reductionRatio());
        reduced = true;
        lastReductionNanos = nowNanos;
        return true;
    }

    /**
     * One recovery pass.
     *
     * @return true if the ratio was stepped up
     */
    public boolean recover(long nowNanos) {
        if (!config.dynamicAdjustment() || !reduced || currentRatio >= 1.0) {
            return false;
        }
        if (nowNanos - lastReductionNanos < config.recoveryDelay().toNanos()) {
            return false;
        }
        currentRatio = clamp(currentRatio + config.recoveryStep());
        recovered = true;
        lastRecoveryNanos = nowNanos;
        return true;
    }

    /**
     * Extra delay before the next admission attempt:
     * {@code min(maxDelay, recentViolations * step) * (1 - sinceLatest / window)}.
     */
    public long preventiveDelayNanos(long nowNanos) {
        if (!config.preventiveThrottling() || violations.isEmpty()) {
            return 0L;
        }
        long windowNanos = config.preventiveWindow().toNanos();
        int recent = violations.countWithin(nowNanos, windowNanos);
        if (recent == 0) {
            return 0L;
        }
        long sinceLatest = Math.max(0L, nowNanos - violations.latestNanos());
        double decay = Math.max(0.0, 1.0 - (double) sinceLatest / windowNanos);
        long base = Math.min(config.maxPreventiveDelay().toNanos(),
            recent * config.preventiveDelayStep().toNanos());
        return (long) (base * decay);
    }

    public double currentRatio() {
        return currentRatio;
    }

    public long violationCount() {
        return violations.total();
    }

    public int recentViolations(long nowNanos) {
        return violations.countWithin(nowNanos, config.errorWindow().toNanos());
    }

    public boolean reduced() {
        return reduced;
    }

    public long lastReductionNanos() {
        return lastReductionNanos;
    }

    public boolean recovered() {
        return recovered;
    }

    public long lastRecoveryNanos() {
        return lastRecoveryNanos;
    }

    private double clamp(double ratio) {
        return Math.max(config.minRatio(), Math.min(1.0, ratio));
    }
}
