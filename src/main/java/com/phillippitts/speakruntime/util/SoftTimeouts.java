package com.phillippitts.speakruntime.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Advisory timeouts for long-running hooks and transitions.
 *
 * <p>A watched future that is still running after the timeout is logged as slow. The future is
 * never cancelled or completed by the watch; hooks are trusted to finish eventually.
 */
public final class SoftTimeouts {

    private static final Logger LOG = LogManager.getLogger(SoftTimeouts.class);

    private SoftTimeouts() {
        // Utility class - prevent instantiation
    }

    /**
     * Schedules a WARN log if {@code future} has not completed within {@code timeout}.
     *
     * @param future the operation to watch
     * @param timeout advisory limit, ignored when null, zero or negative
     * @param description operation name used in the log line
     * @return the same future, for chaining
     */
    public static <T> CompletableFuture<T> watch(CompletableFuture<T> future, Duration timeout, String description) {
        if (future == null || future.isDone() || timeout == null || timeout.isZero() || timeout.isNegative()) {
            return future;
        }
        long startNanos = System.nanoTime();
        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            if (!future.isDone()) {
                LOG.warn("{} still running after {} ms (soft timeout {} ms, not cancelled)",
                        description, TimeUtils.elapsedMillis(startNanos), timeout.toMillis());
            }
        });
        return future;
    }
}
