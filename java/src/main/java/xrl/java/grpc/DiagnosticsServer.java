package xrl.java.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xrl.java.limiter.UnifiedRateLimiter;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * gRPC server exposing {@link DiagnosticsServiceImpl} for a limiter owned by the host application.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (0 picks a free one)</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>Does not own the limiter: stopping the server leaves it running</li>
 * </ul>
 *
 * <p>Usage:
 * <pre>
 * UnifiedRateLimiter limiter = UnifiedRateLimiter.builder().build();
 * DiagnosticsServer diagnostics = new DiagnosticsServer(9090, limiter);
 * diagnostics.start();
 * </pre>
 */
public final class DiagnosticsServer {

    private static final Logger log = LoggerFactory.getLogger(DiagnosticsServer.class);

    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;

    /**
     * @throws IllegalArgumentException if port is negative or limiter is null
     */
    public DiagnosticsServer(int port, UnifiedRateLimiter limiter) {
        if (port < 0) {
            throw new IllegalArgumentException("port must be >= 0, got: " + port);
        }
        this.server = ServerBuilder.forPort(port)
            .addService(new DiagnosticsServiceImpl(limiter))
            .build();
    }

    /**
     * Starts the server and registers a JVM shutdown hook that stops it.
     *
     * @throws IOException if server fails to start
     */
    public void start() throws IOException {
        server.start();
        log.info("diagnostics.started port={}", server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                DiagnosticsServer.this.stop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("diagnostics.shutdown_interrupted");
            }
        }));
    }

    /**
     * Stops the server gracefully.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (server.isShutdown()) {
            return;
        }
        server.shutdown().awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        log.info("diagnostics.stopped");
    }

    /**
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return server.getPort();
    }
}
