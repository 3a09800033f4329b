package xrl.benchmarks.java;

import org.openjdk.jmh.annotations.*;
import xrl.core.algorithms.hybrid.HybridGcraLimiter;
import xrl.core.clock.SystemClock;
import xrl.core.config.GroupConfig;
import xrl.core.model.AdmissionDecision;
import xrl.core.model.RateLimitGroup;
import xrl.core.throttle.AdaptiveThrottle;

import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the single-threaded admission core (no locking).
 *
 * Measures throughput (ops/sec) across 3 scenarios:
 * - grant: free slot, reserve + commit (hot path)
 * - deny: exhausted window, wait computation only
 * - dualGrant: both legs of a dual-limit group reserve + commit
 *
 * Run:
 *   java -jar benchmarks/target/benchmarks.jar AdmissionCore
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class AdmissionCoreBenchmark {

    private SystemClock clock;
    private HybridGcraLimiter grantLimiter;
    private HybridGcraLimiter denyLimiter;
    private HybridGcraLimiter dualLimiter;

    private static HybridGcraLimiter limiter(GroupConfig config) {
        return new HybridGcraLimiter(RateLimitGroup.PUBLIC_READ, config, new AdaptiveThrottle(config));
    }

    @Setup
    public void setup() {
        clock = SystemClock.instance();

        // Grant scenario: far above the achievable call rate
        grantLimiter = limiter(GroupConfig.singleLimit(100_000_000.0, 1_000));

        // Deny scenario: one slot, held forever
        denyLimiter = limiter(GroupConfig.singleLimit(0.001, 1));
        denyLimiter.tryAdmit(clock.nowNanos());

        dualLimiter = limiter(GroupConfig.dualLimit(100_000_000.0, 1_000, 2_000_000_000, 1_000));
    }

    @Benchmark
    public AdmissionDecision grant() {
        long now = clock.nowNanos();
        AdmissionDecision decision = grantLimiter.tryAdmit(now);
        if (decision.granted()) {
            grantLimiter.commit(decision.reservation(), now);
        }
        return decision;
    }

    @Benchmark
    public AdmissionDecision deny() {
        return denyLimiter.tryAdmit(clock.nowNanos());
    }

    @Benchmark
    public AdmissionDecision dualGrant() {
        long now = clock.nowNanos();
        AdmissionDecision decision = dualLimiter.tryAdmit(now);
        if (decision.granted()) {
            dualLimiter.commit(decision.reservation(), now);
        }
        return decision;
    }
}
