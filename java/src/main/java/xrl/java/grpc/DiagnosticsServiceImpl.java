package xrl.java.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.core.model.RateLimitGroup;
import xrl.java.async.HealthStatus;
import xrl.java.async.NotifierHealth;
import xrl.java.async.WaitStats;
import xrl.java.limiter.GroupStatus;
import xrl.java.limiter.LimiterStatus;
import xrl.java.limiter.UnifiedRateLimiter;
import xrl.proto.DiagnosticsServiceGrpc;
import xrl.proto.GetStatusRequest;
import xrl.proto.GetStatusResponse;
import xrl.proto.GroupStatusEntry;
import xrl.proto.HealthCheckRequest;
import xrl.proto.HealthCheckResponse;
import xrl.proto.NotifierHealthEntry;
import xrl.proto.WaitStatsEntry;

import java.util.Map;

/**
 * gRPC diagnostics for the limiter embedded in this process.
 *
 * <p>This is a thin, read-only wrapper over {@link UnifiedRateLimiter} with:
 * <ul>
 *   <li>Request validation (fail-fast with INVALID_ARGUMENT)</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 *   <li>Protobuf conversion (LimiterStatus → GetStatusResponse)</li>
 * </ul>
 *
 * <p>Thread-safety: the limiter handles concurrency internally.
 * This service is stateless and can handle concurrent RPCs.
 */
public final class DiagnosticsServiceImpl extends DiagnosticsServiceGrpc.DiagnosticsServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsServiceImpl.class);

    private final UnifiedRateLimiter limiter;

    /**
     * @throws IllegalArgumentException if limiter is null
     */
    public DiagnosticsServiceImpl(UnifiedRateLimiter limiter) {
        if (limiter == null) {
            throw new IllegalArgumentException("limiter cannot be null");
        }
        this.limiter = limiter;
    }

    @Override
    public void getStatus(GetStatusRequest request, StreamObserver<GetStatusResponse> responseObserver) {
        try {
            // protobuf strings are never null, only empty
            RateLimitGroup selected = request.getGroup().isEmpty() ? null : RateLimitGroup.fromTag(request.getGroup());

            LimiterStatus status = limiter.getStatus();
            GetStatusResponse.Builder response = GetStatusResponse.newBuilder()
                .setActiveTimeouts(status.activeTimeouts())
                .setRunning(status.running());
            for (RateLimitGroup group : RateLimitGroup.values()) {
                if (selected == null || selected == group) {
                    response.addGroups(toEntry(status.group(group)));
                }
            }

            responseObserver.onNext(response.build());
            responseObserver.onCompleted();

        } catch (IllegalArgumentException e) {
            responseObserver.onError(
                Status.INVALID_ARGUMENT
                    .withDescription(e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        } catch (Exception e) {
            log.error("diagnostics.status_failed", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        }
    }

    /**
     * SERVING unless the limiter is closed or a notifier has FAILED; degraded or
     * restarting groups are listed but still serve (they fail open).
     */
    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> responseObserver) {
        HealthCheckResponse.Builder response = HealthCheckResponse.newBuilder();
        boolean failed = false;
        for (Map.Entry<RateLimitGroup, NotifierHealth> entry : limiter.health().entrySet()) {
            HealthStatus status = entry.getValue().status();
            if (status != HealthStatus.HEALTHY) {
                response.addUnhealthyGroups(entry.getKey().tag());
            }
            failed |= status == HealthStatus.FAILED;
        }
        response.setStatus(limiter.isClosed() || failed
            ? HealthCheckResponse.Status.NOT_SERVING
            : HealthCheckResponse.Status.SERVING);

        responseObserver.onNext(response.build());
        responseObserver.onCompleted();
    }

    private static GroupStatusEntry toEntry(GroupStatus status) {
        NotifierHealth health = status.notifierHealth();
        WaitStats.Snapshot waits = status.waitStats();
        GroupStatusEntry.Builder entry = GroupStatusEntry.newBuilder()
            .setGroup(status.group().tag())
            .setBaseRps(status.baseRps())
            .setCurrentRatio(status.currentRatio())
            .setTatPrimaryNanos(status.tatPrimaryNanos())
            .setBurstWindowOccupancy(status.burstWindowOccupancy())
            .setSecondaryWindowOccupancy(status.secondaryWindowOccupancy())
            .setViolationCount(status.violationCount())
            .setQueueDepth(status.queueDepth())
            .setNotifierHealth(NotifierHealthEntry.newBuilder()
                .setStatus(health.status().name())
                .setConsecutiveErrors(health.consecutiveErrors())
                .setRestartCount(health.restartCount())
                .setLastRestartNanos(health.lastRestartNanos()))
            .setWaitStats(WaitStatsEntry.newBuilder()
                .setTotalWaits(waits.totalWaits())
                .setGranted(waits.granted())
                .setTimeouts(waits.timeouts())
                .setCancelled(waits.cancelled())
                .setForced(waits.forced())
                .setAverageWaitNanos(waits.averageWaitNanos())
                .setMaxWaitNanos(waits.maxWaitNanos())
                .setTotalRequests(waits.totalRequests())
                .setMaxConcurrentWaiters(waits.maxConcurrentWaiters()));
        status.tatSecondaryNanos().ifPresent(entry::setTatSecondaryNanos);
        return entry.build();
    }
}
