package com.phillippitts.querybridge.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the job queue.
 *
 * <p>Example application.properties:
 * <pre>
 * queue.concurrency=3
 * queue.await-timeout-ms=35000
 * queue.stall-timeout-ms=60000
 * queue.max-stalled-count=1
 * </pre>
 *
 * @param concurrency number of processor loops pulling jobs
 * @param awaitTimeoutMs default caller wait when none is given
 * @param stallTimeoutMs an ACTIVE job older than this is considered abandoned by its processor
 * @param stallCheckIntervalMs how often the stall sweeper runs
 * @param stallBackoffMs base delay before a stalled job is requeued (doubles per stall)
 * @param maxStalledCount requeues allowed before a stalled job fails
 * @param completedGraceMs retention for completed jobs; failed jobs keep 24x this
 * @param cleanupIntervalMs how often retention cleanup runs
 */
@ConfigurationProperties(prefix = "queue")
@Validated
public record QueueProperties(
        @DefaultValue("3")
        @Positive(message = "Concurrency must be positive")
        @Max(value = 64, message = "Concurrency must be at most 64")
        int concurrency,

        @DefaultValue("35000")
        @Positive(message = "Await timeout must be positive")
        long awaitTimeoutMs,

        @DefaultValue("60000")
        @Positive(message = "Stall timeout must be positive")
        long stallTimeoutMs,

        @DefaultValue("5000")
        @Positive(message = "Stall check interval must be positive")
        long stallCheckIntervalMs,

        @DefaultValue("2000")
        @PositiveOrZero(message = "Stall backoff must not be negative")
        long stallBackoffMs,

        @DefaultValue("1")
        @PositiveOrZero(message = "Max stalled count must not be negative")
        int maxStalledCount,

        @DefaultValue("3600000")
        @Positive(message = "Completed grace must be positive")
        long completedGraceMs,

        @DefaultValue("300000")
        @Positive(message = "Cleanup interval must be positive")
        long cleanupIntervalMs
) {
    /** Failed jobs are retained this many times longer than completed ones. */
    public static final int FAILED_RETENTION_MULTIPLIER = 24;

    public static QueueProperties defaults() {
        return new QueueProperties(3, 35_000, 60_000, 5_000, 2_000, 1, 3_600_000, 300_000);
    }
}
