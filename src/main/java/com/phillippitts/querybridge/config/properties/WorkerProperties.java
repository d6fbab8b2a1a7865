package com.phillippitts.querybridge.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the persistent worker process and its bridge.
 *
 * <p>Example application.properties:
 * <pre>
 * worker.command=python3,-u,worker/orchestrator_wrapper.py,--interactive
 * worker.working-directory=.
 * worker.request-timeout-ms=30000
 * worker.retry.max-attempts=2
 * worker.watchdog.max-restarts-per-window=5
 * </pre>
 */
@ConfigurationProperties(prefix = "worker")
@Validated
public class WorkerProperties {

    /** Executable followed by its arguments. */
    @NotEmpty(message = "Worker command must not be empty")
    private List<String> command = new ArrayList<>(List.of("python3", "-u", "worker/worker.py", "--interactive"));

    /** Working directory for the worker process; blank means the JVM's working directory. */
    private String workingDirectory = "";

    /** Spawn the worker when the application context starts. */
    private boolean autoStart = true;

    @Positive(message = "Request timeout must be positive")
    private long requestTimeoutMs = 30_000;

    @Positive(message = "Startup timeout must be positive")
    private long startupTimeoutMs = 120_000;

    @PositiveOrZero(message = "Restart delay must not be negative")
    private long restartDelayMs = 1_000;

    /** Synthetic known-good query used by health probes. */
    @NotBlank(message = "Health check query must not be blank")
    private String healthCheckQuery = "What are the admission requirements?";

    @Valid
    private Retry retry = new Retry();

    @Valid
    private Watchdog watchdog = new Watchdog();

    public List<String> getCommand() {
        return command;
    }

    public void setCommand(List<String> command) {
        this.command = command;
    }

    public String getWorkingDirectory() {
        return workingDirectory;
    }

    public void setWorkingDirectory(String workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(long requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public long getStartupTimeoutMs() {
        return startupTimeoutMs;
    }

    public void setStartupTimeoutMs(long startupTimeoutMs) {
        this.startupTimeoutMs = startupTimeoutMs;
    }

    public long getRestartDelayMs() {
        return restartDelayMs;
    }

    public void setRestartDelayMs(long restartDelayMs) {
        this.restartDelayMs = restartDelayMs;
    }

    public String getHealthCheckQuery() {
        return healthCheckQuery;
    }

    public void setHealthCheckQuery(String healthCheckQuery) {
        this.healthCheckQuery = healthCheckQuery;
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Watchdog getWatchdog() {
        return watchdog;
    }

    public void setWatchdog(Watchdog watchdog) {
        this.watchdog = watchdog;
    }

    /**
     * Retry policy for execution failures and timeouts.
     */
    public static class Retry {
        /** Total attempts including the first one. */
        @Positive(message = "Max attempts must be positive")
        @Max(value = 10, message = "Max attempts must be at most 10")
        private int maxAttempts = 2;

        @PositiveOrZero(message = "Base backoff must not be negative")
        private long baseBackoffMs = 1_000;

        @PositiveOrZero(message = "Max backoff must not be negative")
        private long maxBackoffMs = 5_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseBackoffMs() {
            return baseBackoffMs;
        }

        public void setBaseBackoffMs(long baseBackoffMs) {
            this.baseBackoffMs = baseBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }
    }

    /**
     * Restart-rate budget. Exceeding it stretches the restart delay to the cooldown.
     */
    public static class Watchdog {
        @Positive(message = "Window minutes must be positive")
        private int windowMinutes = 10;

        @Positive(message = "Max restarts per window must be positive")
        private int maxRestartsPerWindow = 5;

        @Positive(message = "Cooldown seconds must be positive")
        private int cooldownSeconds = 60;

        public int getWindowMinutes() {
            return windowMinutes;
        }

        public void setWindowMinutes(int windowMinutes) {
            this.windowMinutes = windowMinutes;
        }

        public int getMaxRestartsPerWindow() {
            return maxRestartsPerWindow;
        }

        public void setMaxRestartsPerWindow(int maxRestartsPerWindow) {
            this.maxRestartsPerWindow = maxRestartsPerWindow;
        }

        public int getCooldownSeconds() {
            return cooldownSeconds;
        }

        public void setCooldownSeconds(int cooldownSeconds) {
            this.cooldownSeconds = cooldownSeconds;
        }
    }
}
