package xrl.java.limiter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.core.clock.Clock;
import xrl.core.clock.SystemClock;
import xrl.core.config.LimiterConfiguration;
import xrl.core.config.LimiterSettings;
import xrl.core.model.RateLimitGroup;
import xrl.java.async.AdmissionQueue;
import xrl.java.async.HealthSupervisor;
import xrl.java.async.NotifierHealth;
import xrl.java.async.RecoveryLoop;
import xrl.java.endpoint.EndpointGroupResolver;
import xrl.java.engine.Admission;
import xrl.java.engine.GroupRegistry;
import xrl.java.engine.GroupSnapshot;
import xrl.java.engine.RateLimitListener;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Client-side admission control for every outbound call to the exchange.
 *
 * <p>One instance per process, shared by all callers:
 * <pre>
 * UnifiedRateLimiter limiter = UnifiedRateLimiter.builder().build();
 * try (Admission admission = limiter.acquire(RateLimitGroup.PRIVATE_ORDER, "/v1/orders").join()) {
 *     if (admission.isGranted()) {
 *         send(order);
 *         admission.commit();
 *     }
 * }
 * </pre>
 *
 * <p>Background work (per-group notifiers, health supervisor, rate recovery, waiter
 * timeouts) runs on a small private scheduler. {@link #start()} is optional: the
 * first {@link #acquire} starts it.
 */
public final class UnifiedRateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnifiedRateLimiter.class);

    private final LimiterConfiguration configuration;
    private final GroupRegistry registry;
    private final AdmissionQueue queue;
    private final HealthSupervisor supervisor;
    private final RecoveryLoop recovery;
    private final ScheduledExecutorService scheduler;
    private final EndpointGroupResolver resolver;

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    private UnifiedRateLimiter(Builder builder) {
        this.configuration = builder.configuration;
        LimiterSettings settings = configuration.settings();
        this.scheduler = Executors.newScheduledThreadPool(settings.schedulerThreads(), schedulerThreads());
        this.registry = new GroupRegistry(builder.clock, configuration.groups(),
            builder.listener, builder.callbackExecutor);
        this.queue = new AdmissionQueue(registry, scheduler, builder.callbackExecutor,
            settings.waiterTimeout().toNanos());
        this.supervisor = new HealthSupervisor(queue, scheduler, settings, builder.clock,
            group -> () -> queue.tick(group));
        this.recovery = new RecoveryLoop(registry, scheduler, settings.recoveryInterval());
        this.resolver = builder.resolver;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Launches notifiers, health supervisor and recovery loop. Idempotent.
     *
     * @throws IllegalStateException if the limiter was closed
     */
    public void start() {
        ensureOpen();
        if (started.compareAndSet(false, true)) {
            supervisor.start();
            recovery.start();
            log.info("limiter.started groups={} waiterTimeoutMs={}",
                configuration.groups().size(), configuration.settings().waiterTimeout().toMillis());
        }
    }

    /**
     * Requests admission for one call in {@code group}.
     *
     * @param endpointTag free-form label of the call, for logs and stats
     * @return future completing with a GRANTED or TIMED_OUT admission; never completes exceptionally
     * @throws IllegalArgumentException if group is null
     * @throws IllegalStateException if the limiter was closed
     */
    public CompletableFuture<Admission> acquire(RateLimitGroup group, String endpointTag) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        start();
        return queue.acquire(group, endpointTag);
    }

    /**
     * Resolves the group of a REST call and requests admission for it.
     *
     * @throws IllegalStateException if no endpoint resolver was configured
     * @throws xrl.core.config.ConfigurationException if the endpoint is not mapped
     */
    public CompletableFuture<Admission> acquire(String path, String method) {
        if (resolver == null) {
            throw new IllegalStateException("no endpoint resolver configured");
        }
        return acquire(resolver.resolve(path, method), path);
    }

    /**
     * Reports a provider 429 for a call in {@code group}.
     *
     * @param retryAfter provider's Retry-After, or null if absent
     */
    public void notify429(RateLimitGroup group, String endpointTag, Duration retryAfter) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        log.warn("provider.429 group={} endpoint={} retryAfterMs={}",
            group.tag(), endpointTag, retryAfter == null ? null : retryAfter.toMillis());
        registry.recordViolation(group, endpointTag, retryAfter);
    }

    public LimiterStatus getStatus() {
        Map<RateLimitGroup, GroupStatus> groups = new EnumMap<>(RateLimitGroup.class);
        for (RateLimitGroup group : RateLimitGroup.values()) {
            GroupSnapshot snapshot = registry.snapshot(group);
            groups.put(group, new GroupStatus(
                group,
                snapshot.baseRps(),
                snapshot.currentRatio(),
                snapshot.tatPrimaryNanos(),
                snapshot.dualLimit() ? OptionalLong.of(snapshot.tatSecondaryNanos()) : OptionalLong.empty(),
                snapshot.burstWindowOccupancy(),
                snapshot.secondaryWindowOccupancy(),
                snapshot.violationCount(),
                queue.depth(group),
                supervisor.health(group),
                queue.waitStats(group)
            ));
        }
        return new LimiterStatus(groups, queue.activeTimeouts(), started.get() && !closed.get());
    }

    public Map<RateLimitGroup, NotifierHealth> health() {
        return supervisor.healthAll();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public LimiterConfiguration configuration() {
        return configuration;
    }

    /**
     * Stops background tasks and completes every still-queued caller with CANCELLED.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        supervisor.stop();
        recovery.stop();
        int cancelled = queue.cancelAll();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("limiter.closed cancelledWaiters={}", cancelled);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("limiter is closed");
        }
    }

    private static ThreadFactory schedulerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "xrl-scheduler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static final class Builder {
        private LimiterConfiguration configuration = LimiterConfiguration.defaults();
        private Clock clock = SystemClock.instance();
        private Executor callbackExecutor = ForkJoinPool.commonPool();
        private EndpointGroupResolver resolver;
        private RateLimitListener listener = RateLimitListener.NO_OP;

        private Builder() {
        }

        public Builder configuration(LimiterConfiguration configuration) {
            if (configuration == null) throw new IllegalArgumentException("configuration cannot be null");
            this.configuration = configuration;
            return this;
        }

        /**
         * Clock instance for time control (injected for testability).
         */
        public Builder clock(Clock clock) {
            if (clock == null) throw new IllegalArgumentException("clock cannot be null");
            this.clock = clock;
            return this;
        }

        /**
         * Executor completing the futures handed to callers and running listener callbacks.
         */
        public Builder callbackExecutor(Executor callbackExecutor) {
            if (callbackExecutor == null) throw new IllegalArgumentException("callbackExecutor cannot be null");
            this.callbackExecutor = callbackExecutor;
            return this;
        }

        public Builder endpointResolver(EndpointGroupResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * Receives 429, rate-reduced and rate-recovered events.
         */
        public Builder listener(RateLimitListener listener) {
            if (listener == null) throw new IllegalArgumentException("listener cannot be null");
            this.listener = listener;
            return this;
        }

        public UnifiedRateLimiter build() {
            return new UnifiedRateLimiter(this);
        }
    }
}
