package xrl.benchmarks.java;

import org.openjdk.jmh.annotations.*;
import xrl.core.clock.SystemClock;
import xrl.core.config.GroupConfig;
import xrl.core.model.AdmissionDecision;
import xrl.core.model.RateLimitGroup;
import xrl.java.engine.GroupRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for GroupRegistry (per-group locking).
 *
 * Measures throughput (ops/sec) across 3 scenarios:
 * - singleGroup: every call on one group
 * - multiGroup: calls spread over all groups (low contention)
 * - parallel: 8 threads on one group (high contention)
 *
 * Each op reserves and aborts, so the window never fills.
 *
 * Run:
 *   java -jar benchmarks/target/benchmarks.jar Registry
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class RegistryBenchmark {

    private static final RateLimitGroup[] GROUPS = RateLimitGroup.values();

    private GroupRegistry registry;

    @Setup
    public void setup() {
        Map<RateLimitGroup, GroupConfig> configs = new EnumMap<>(RateLimitGroup.class);
        for (RateLimitGroup group : GROUPS) {
            configs.put(group, GroupConfig.singleLimit(100_000_000.0, 1_000));
        }
        registry = new GroupRegistry(SystemClock.instance(), configs);
    }

    @Benchmark
    public boolean singleGroup() {
        return admitAndAbort(RateLimitGroup.PUBLIC_READ);
    }

    @Benchmark
    public boolean multiGroup() {
        return admitAndAbort(GROUPS[ThreadLocalRandom.current().nextInt(GROUPS.length)]);
    }

    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return admitAndAbort(RateLimitGroup.PUBLIC_READ);
    }

    private boolean admitAndAbort(RateLimitGroup group) {
        AdmissionDecision decision = registry.tryAdmit(group);
        if (decision.granted()) {
            registry.abort(decision.reservation());
            return true;
        }
        return false;
    }
}
