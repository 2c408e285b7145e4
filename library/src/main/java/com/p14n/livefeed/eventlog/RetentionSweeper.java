package com.p14n.livefeed.eventlog;

import com.p14n.livefeed.executor.AsyncExecutor;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically removes delivered events older than the retention window.
 */
public class RetentionSweeper implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(RetentionSweeper.class);

    private final EventLog eventLog;
    private final Duration retention;
    private ScheduledFuture<?> schedule;

    public RetentionSweeper(EventLog eventLog, Duration retention) {
        this.eventLog = eventLog;
        this.retention = retention;
    }

    public synchronized void start(AsyncExecutor executor, long intervalMinutes) {
        if (schedule != null) {
            return;
        }
        schedule = executor.scheduleAtFixedRate(this::sweep, intervalMinutes, intervalMinutes, TimeUnit.MINUTES);
    }

    /**
     * Runs one sweep. Failures are logged; the next scheduled run tries again.
     *
     * @return rows deleted, or -1 if the sweep failed
     */
    public int sweep() {
        Instant cutoff = eventLog.clock().instant().minus(retention);
        try {
            int deleted = eventLog.deleteDeliveredBefore(cutoff);
            logger.atInfo()
                    .addArgument(deleted)
                    .addArgument(cutoff)
                    .log("Removed {} delivered events older than {}");
            return deleted;
        } catch (SQLException e) {
            logger.atWarn().setCause(e).log("Retention sweep failed");
            return -1;
        }
    }

    @Override
    public synchronized void close() {
        if (schedule != null) {
            schedule.cancel(false);
            schedule = null;
        }
    }
}
