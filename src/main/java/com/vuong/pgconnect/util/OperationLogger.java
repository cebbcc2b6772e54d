package com.vuong.pgconnect.util;

import com.vuong.pgconnect.config.LogLevel;
import com.vuong.pgconnect.exception.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Reports the outcome of repository operations according to the configured {@link LogLevel}.
 * Failures are logged from {@link LogLevel#ERROR}, slow operations from {@link LogLevel#WARN}
 * and every operation at DEBUG from {@link LogLevel#INFO}.
 */
public class OperationLogger {

    static final Duration SLOW_THRESHOLD = Duration.ofMillis(200);

    private static final Logger logger = LoggerFactory.getLogger(OperationLogger.class);

    private final LogLevel level;

    public OperationLogger(LogLevel level) {
        this.level = level != null ? level : LogLevel.SILENT;
    }

    public LogLevel getLevel() {
        return level;
    }

    /**
     * Records a finished operation.
     * @param operation the operation description, e.g. "findWhere Account"
     * @param startNanos {@link System#nanoTime()} taken before the operation
     * @param failure the failure, or null on success
     */
    public void record(String operation, long startNanos, RuntimeException failure) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        if (failure != null) {
            // a miss is an expected outcome of a lookup
            if (level.isEnabled(LogLevel.ERROR) && !(failure instanceof NotFoundException)) {
                logger.error("{} failed after {} ms: {}", operation, elapsed.toMillis(), failure.getMessage());
            }
            return;
        }
        if (elapsed.compareTo(SLOW_THRESHOLD) > 0 && level.isEnabled(LogLevel.WARN)) {
            logger.warn("Slow operation {} took {} ms (threshold {} ms)",
                    operation, elapsed.toMillis(), SLOW_THRESHOLD.toMillis());
        } else if (level.isEnabled(LogLevel.INFO)) {
            logger.debug("{} completed in {} ms", operation, elapsed.toMillis());
        }
    }
}
