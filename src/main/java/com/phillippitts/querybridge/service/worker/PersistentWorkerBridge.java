package com.phillippitts.querybridge.service.worker;

import com.phillippitts.querybridge.config.properties.WorkerProperties;
import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.WorkerAnswer;
import com.phillippitts.querybridge.exception.ErrorKind;
import com.phillippitts.querybridge.exception.QueryBridgeException;
import com.phillippitts.querybridge.exception.WorkerCrashedException;
import com.phillippitts.querybridge.exception.WorkerExecutionException;
import com.phillippitts.querybridge.exception.WorkerFailureBuilder;
import com.phillippitts.querybridge.exception.WorkerTimeoutException;
import com.phillippitts.querybridge.service.metrics.PipelineMetrics;
import com.phillippitts.querybridge.service.validation.QueryValidator;
import com.phillippitts.querybridge.util.ProcessTimeouts;
import com.phillippitts.querybridge.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Worker bridge backed by one long-lived worker process.
 *
 * <p><b>Mutual exclusion:</b> callers never touch the process. Each attempt is queued as a
 * {@link WorkerRequest} and a single dispatcher thread drains the queue in FIFO order,
 * writing one request line and reading one response line before taking the next request.
 * Requests arriving before the process is ready simply wait in the queue.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>Execution failure ({@code success:false}): retried with backoff.</li>
 *   <li>Timeout: the process is recycled and the attempt fails; retried with backoff.</li>
 *   <li>Crash (stdout closed, write failure): the in-flight call fails immediately with
 *       {@link WorkerCrashedException}; no retry against the dead process.</li>
 *   <li>Startup: a process that is not ready within {@code worker.startup-timeout-ms} is
 *       recycled and the waiting request fails with {@link WorkerCrashedException}.</li>
 * </ul>
 *
 * <p>Every process exit schedules a replacement after {@code worker.restart-delay-ms}, or
 * after the watchdog cooldown when the restart budget is exhausted.
 *
 * <p><b>Lifecycle:</b> {@link #start()} spawns the process and the dispatcher; it runs at
 * context start when {@code worker.auto-start=true} and lazily on first use otherwise.
 * {@link #close()} is idempotent and fails everything still pending.
 */
@Component
public class PersistentWorkerBridge implements WorkerBridge, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(PersistentWorkerBridge.class);

    static final String REASON_TIMEOUT = "timeout";
    static final String REASON_STARTUP_TIMEOUT = "startup-timeout";
    static final String REASON_WRITE_FAILURE = "write-failure";
    static final String REASON_START_FAILURE = "start-failure";

    private static final String HEALTH_CHECK_CALLER = "health-check";

    private final WorkerProperties props;
    private final ProcessFactory processFactory;
    private final QueryValidator validator;
    private final ApplicationEventPublisher publisher;
    private final PipelineMetrics metrics;
    private final RestartBudget restartBudget;

    private final BlockingQueue<WorkerRequest> pending = new LinkedBlockingQueue<>();

    /** Guards every field below that is not volatile or atomic. */
    private final Object lifecycleLock = new Object();
    private WorkerSession session;
    private CompletableFuture<WorkerSession> readySession = new CompletableFuture<>();
    private boolean started;
    private boolean closed;
    private long generation;
    private Thread dispatcher;
    private ScheduledExecutorService restartScheduler;

    private volatile WorkerState state = WorkerState.STOPPED;

    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong successfulExecutions = new AtomicLong();
    private final AtomicLong failedExecutions = new AtomicLong();
    private final AtomicLong totalElapsedMs = new AtomicLong();
    private final AtomicLong workerInvocations = new AtomicLong();
    private final AtomicLong restarts = new AtomicLong();

    @Autowired
    public PersistentWorkerBridge(WorkerProperties props,
                                  QueryValidator validator,
                                  ApplicationEventPublisher publisher,
                                  PipelineMetrics metrics) {
        this(new DefaultProcessFactory(), props, validator, publisher, metrics, Clock.systemUTC());
    }

    PersistentWorkerBridge(ProcessFactory processFactory,
                           WorkerProperties props,
                           QueryValidator validator,
                           ApplicationEventPublisher publisher,
                           PipelineMetrics metrics,
                           Clock clock) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.props = Objects.requireNonNull(props, "props");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.restartBudget = new RestartBudget(props.getRestartDelayMs(), props.getWatchdog(), clock);
    }

    @PostConstruct
    void autoStart() {
        if (props.isAutoStart()) {
            start();
        } else {
            LOG.info("Worker auto-start disabled; process will start on first query");
        }
    }

    /**
     * Spawns the worker process and the dispatcher thread. Idempotent.
     *
     * @throws WorkerCrashedException if the bridge was already closed
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new WorkerCrashedException("Worker bridge is closed");
            }
            if (started) {
                return;
            }
            started = true;
            restartScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "worker-restart");
                t.setDaemon(true);
                return t;
            });
            dispatcher = new Thread(this::dispatchLoop, "worker-dispatcher");
            dispatcher.setDaemon(true);
            dispatcher.start();
            LOG.info("Starting worker bridge: command={}, requestTimeoutMs={}, maxAttempts={}",
                    props.getCommand().get(0), props.getRequestTimeoutMs(), props.getRetry().getMaxAttempts());
            spawnLocked(false);
        }
    }

    @Override
    public WorkerAnswer query(String text, String callerId, List<ContextTurn> context) {
        return execute(text, callerId, context, null);
    }

    /**
     * Validates, then runs up to {@code worker.retry.max-attempts} attempts.
     *
     * @param budget overall bound for the caller's wait, or null for none; once it runs out
     *               the outstanding request is cancelled and {@link WorkerTimeoutException} is thrown
     */
    private WorkerAnswer execute(String text, String callerId, List<ContextTurn> context, Duration budget) {
        try {
            validator.validate(text, context);
        } catch (QueryBridgeException e) {
            metrics.incrementWorkerFailure("validation");
            throw e;
        }
        String caller = (callerId == null || callerId.isBlank()) ? DEFAULT_CALLER : callerId;
        List<ContextTurn> turns = context == null ? List.of() : List.copyOf(context);
        start();

        int maxAttempts = props.getRetry().getMaxAttempts();
        long startNanos = System.nanoTime();
        long deadlineNanos = budget == null ? 0 : startNanos + budget.toNanos();
        QueryBridgeException lastError = null;
        int attempt = 0;

        while (attempt < maxAttempts) {
            attempt++;
            LOG.info("Executing worker request: attempt={}/{}, queryLength={}, callerId={}, contextTurns={}",
                    attempt, maxAttempts, text.length(), caller, turns.size());
            try {
                WorkerAnswer answer = submitOnce(text, caller, turns, budget, deadlineNanos);
                long elapsed = TimeUtils.elapsedMillis(startNanos);
                recordOutcome(true, elapsed, startNanos, null);
                LOG.info("Worker request succeeded: attempt={}, elapsedMs={}, sources={}",
                        attempt, elapsed, answer.sources().size());
                return answer.withElapsedMs(elapsed);
            } catch (QueryBridgeException e) {
                if (!e.getKind().isRetryable()) {
                    recordOutcome(false, TimeUtils.elapsedMillis(startNanos), startNanos, e.getKind());
                    throw e;
                }
                lastError = e;
                if (attempt < maxAttempts) {
                    long backoff = TimeUtils.exponentialBackoff(attempt,
                            props.getRetry().getBaseBackoffMs(), props.getRetry().getMaxBackoffMs());
                    if (budget != null && deadlineNanos - System.nanoTime() <= TimeUnit.MILLISECONDS.toNanos(backoff)) {
                        break;
                    }
                    LOG.warn("Worker request failed, retrying ({}/{}) in {}ms: {}",
                            attempt, maxAttempts, backoff, e.getMessage());
                    sleepBeforeRetry(backoff);
                }
            }
        }

        long elapsed = TimeUtils.elapsedMillis(startNanos);
        recordOutcome(false, elapsed, startNanos, lastError.getKind());
        LOG.error("Worker request failed after {} attempts: elapsedMs={}, lastError={}",
                attempt, elapsed, lastError.getMessage());
        throw WorkerFailureBuilder.create("Worker failed after " + attempt + " attempts")
                .kind(lastError.getKind())
                .attempts(attempt)
                .durationMs(elapsed)
                .timeoutMs(props.getRequestTimeoutMs())
                .metadata("lastError", lastError.getMessage())
                .cause(lastError)
                .build();
    }

    /**
     * Runs the configured health-check query on the calling thread. A request still queued
     * or in flight when {@code timeout} elapses is cancelled; the process is not recycled.
     */
    @Override
    public boolean healthCheck(Duration timeout) {
        try {
            return execute(props.getHealthCheckQuery(), HEALTH_CHECK_CALLER, List.of(), timeout).success();
        } catch (QueryBridgeException e) {
            LOG.warn("Worker health check failed: kind={}, error={}", e.getKind(), e.getMessage());
            return false;
        }
    }

    @Override
    public WorkerStats stats() {
        long total = totalExecutions.get();
        long successful = successfulExecutions.get();
        long avg = total == 0 ? 0 : totalElapsedMs.get() / total;
        double rate = total == 0 ? 0.0 : (successful * 100.0) / total;
        return new WorkerStats(total, successful, failedExecutions.get(), avg, rate,
                workerInvocations.get(), restarts.get(), restartBudget.restartsInWindow(),
                restartBudget.isCoolingDown(), state, pending.size());
    }

    @Override
    public void resetStats() {
        totalExecutions.set(0);
        successfulExecutions.set(0);
        failedExecutions.set(0);
        totalElapsedMs.set(0);
        workerInvocations.set(0);
        restarts.set(0);
        LOG.info("Worker bridge statistics reset");
    }

    @Override
    public WorkerState state() {
        return state;
    }

    /**
     * Idempotent shutdown: stops the dispatcher, kills the process and fails pending requests.
     */
    @PreDestroy
    @Override
    public void close() {
        WorkerSession current;
        Thread dispatcherThread;
        ScheduledExecutorService scheduler;
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            closed = true;
            state = WorkerState.STOPPED;
            current = session;
            session = null;
            readySession.completeExceptionally(new WorkerCrashedException("Worker bridge is closed"));
            lifecycleLock.notifyAll();
            dispatcherThread = dispatcher;
            scheduler = restartScheduler;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (dispatcherThread != null) {
            dispatcherThread.interrupt();
            try {
                dispatcherThread.join(ProcessTimeouts.DISPATCHER_STOP_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (current != null) {
            current.close();
        }
        List<WorkerRequest> leftovers = new ArrayList<>();
        pending.drainTo(leftovers);
        for (WorkerRequest request : leftovers) {
            request.fail(new WorkerCrashedException("Worker bridge is closed"));
        }
        LOG.info("Worker bridge closed: failedPending={}", leftovers.size());
    }

    private WorkerAnswer submitOnce(String text, String caller, List<ContextTurn> turns,
                                    Duration budget, long deadlineNanos) {
        WorkerRequest request = new WorkerRequest(text, caller, turns);
        synchronized (lifecycleLock) {
            if (closed) {
                throw new WorkerCrashedException("Worker bridge is closed");
            }
            pending.add(request);
        }
        try {
            if (budget == null) {
                return request.result().get();
            }
            return request.result().get(Math.max(0, deadlineNanos - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            request.result().cancel(false);
            throw new WorkerTimeoutException("Worker did not answer within " + budget.toMillis() + "ms",
                    budget.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            request.result().cancel(false);
            throw new QueryBridgeException(ErrorKind.INTERNAL, "Interrupted while waiting for worker", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueryBridgeException qbe) {
                throw qbe;
            }
            throw new QueryBridgeException(ErrorKind.INTERNAL, "Unexpected worker bridge failure", cause);
        }
    }

    private void dispatchLoop() {
        while (true) {
            WorkerRequest request;
            try {
                request = pending.take();
            } catch (InterruptedException e) {
                break;
            }
            if (request.result().isDone()) {
                continue;
            }
            try {
                dispatch(request);
            } catch (InterruptedException e) {
                request.fail(new WorkerCrashedException("Worker bridge is closed"));
                break;
            } catch (QueryBridgeException e) {
                request.fail(e);
            } catch (RuntimeException e) {
                LOG.error("Unexpected dispatcher failure", e);
                request.fail(new QueryBridgeException(ErrorKind.INTERNAL, "Unexpected worker bridge failure", e));
            }
        }
        LOG.debug("Worker dispatcher stopped");
    }

    private void dispatch(WorkerRequest request) throws InterruptedException {
        WorkerSession current = awaitReadySession();
        if (request.result().isDone()) {
            // caller gave up while the process was starting
            return;
        }
        long startNanos = System.nanoTime();
        state = WorkerState.PROCESSING;
        workerInvocations.incrementAndGet();
        try {
            current.send(WorkerProtocol.encodeRequest(request.text(), request.callerId(), request.context()));
        } catch (IOException e) {
            current.recycle(REASON_WRITE_FAILURE);
            request.fail(WorkerFailureBuilder.create("Failed to write request to worker")
                    .kind(ErrorKind.WORKER_CRASHED)
                    .durationMs(TimeUtils.elapsedMillis(startNanos))
                    .metadata("generation", current.generation())
                    .cause(e)
                    .build());
            return;
        }

        long timeoutMs = props.getRequestTimeoutMs();
        WorkerSession.Outcome outcome = current.awaitResponse(timeoutMs);
        long durationMs = TimeUtils.elapsedMillis(startNanos);
        if (outcome == null) {
            LOG.warn("Worker request timed out after {}ms; recycling process", timeoutMs);
            current.recycle(REASON_TIMEOUT);
            request.fail(WorkerFailureBuilder.create("Worker request timeout")
                    .kind(ErrorKind.WORKER_TIMEOUT)
                    .timeoutMs(timeoutMs)
                    .durationMs(durationMs)
                    .metadata("generation", current.generation())
                    .build());
            return;
        }
        if (outcome.endOfStream()) {
            request.fail(WorkerFailureBuilder.create("Worker process crashed")
                    .kind(ErrorKind.WORKER_CRASHED)
                    .exitCode(current.exitCode())
                    .durationMs(durationMs)
                    .metadata("generation", current.generation())
                    .metadata("stderr", current.stderrTail())
                    .build());
            return;
        }

        markReady(current);
        try {
            request.complete(WorkerProtocol.decodeResponse(outcome.response()));
        } catch (WorkerExecutionException e) {
            LOG.warn("Worker reported failure: {}", e.getMessage());
            request.fail(e);
        }
    }

    /**
     * Blocks until a ready process is available, bounded by the startup timeout.
     */
    private WorkerSession awaitReadySession() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(props.getStartupTimeoutMs());
        while (true) {
            CompletableFuture<WorkerSession> target;
            synchronized (lifecycleLock) {
                if (closed) {
                    throw new WorkerCrashedException("Worker bridge is closed");
                }
                target = readySession;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw startupTimeout();
            }
            try {
                WorkerSession ready = target.get(remaining, TimeUnit.NANOSECONDS);
                if (ready.isAlive()) {
                    return ready;
                }
                awaitReplacement(target, deadline);
            } catch (TimeoutException e) {
                throw startupTimeout();
            } catch (ExecutionException e) {
                if (e.getCause() instanceof QueryBridgeException qbe) {
                    throw qbe;
                }
                throw new WorkerCrashedException("Worker failed to start", e.getCause());
            }
        }
    }

    /**
     * Waits until the termination callback swaps out {@code stale}, the bridge closes, or the
     * deadline passes.
     */
    private void awaitReplacement(CompletableFuture<WorkerSession> stale, long deadline) throws InterruptedException {
        synchronized (lifecycleLock) {
            while (!closed && readySession == stale) {
                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) {
                    return;
                }
                lifecycleLock.wait(remainingMs);
            }
        }
    }

    private WorkerCrashedException startupTimeout() {
        long startupTimeoutMs = props.getStartupTimeoutMs();
        LOG.error("Worker not ready within {}ms; recycling process", startupTimeoutMs);
        synchronized (lifecycleLock) {
            if (session != null && !session.ready().isDone()) {
                session.recycle(REASON_STARTUP_TIMEOUT);
            }
        }
        return (WorkerCrashedException) WorkerFailureBuilder.create("Worker did not become ready")
                .kind(ErrorKind.WORKER_CRASHED)
                .durationMs(startupTimeoutMs)
                .metadata("startupTimeoutMs", startupTimeoutMs)
                .build();
    }

    private void spawnLocked(boolean restart) {
        generation++;
        state = WorkerState.STARTING;
        long gen = generation;
        try {
            WorkerSession created = WorkerSession.start(gen, processFactory, props.getCommand(),
                    workingDirectory(), this::onSessionTerminated);
            session = created;
            CompletableFuture<WorkerSession> target = readySession;
            created.ready().thenAccept(ready -> onSessionReady(ready, target, restart));
            LOG.info("Worker process started: generation={}, restart={}", gen, restart);
        } catch (IOException | RuntimeException e) {
            LOG.error("Failed to start worker process: generation={}, error={}", gen, e.toString());
            state = WorkerState.CRASHED;
            publishFailure(REASON_START_FAILURE, "Failed to start worker process", e,
                    Map.of("generation", String.valueOf(gen)));
            scheduleRestartLocked(REASON_START_FAILURE);
        }
    }

    private void onSessionReady(WorkerSession ready, CompletableFuture<WorkerSession> target, boolean restart) {
        synchronized (lifecycleLock) {
            if (closed || session != ready) {
                return;
            }
            state = WorkerState.READY;
            target.complete(ready);
        }
        publisher.publishEvent(new WorkerReadyEvent(Instant.now(), ready.generation(), restart));
    }

    private void onSessionTerminated(WorkerSession dead) {
        String reason = dead.terminationReason();
        synchronized (lifecycleLock) {
            if (closed || session != dead) {
                return;
            }
            session = null;
            state = WorkerState.CRASHED;
            if (readySession.isDone()) {
                readySession = new CompletableFuture<>();
                lifecycleLock.notifyAll();
            }
            Map<String, String> context = new LinkedHashMap<>();
            context.put("generation", String.valueOf(dead.generation()));
            context.put("exitCode", String.valueOf(dead.exitCode()));
            LOG.warn("Worker process terminated: generation={}, reason={}", dead.generation(), reason);
            publishFailure(reason, "Worker process terminated", null, context);
            scheduleRestartLocked(reason);
        }
    }

    private void scheduleRestartLocked(String reason) {
        long delayMs = restartBudget.nextDelayMs();
        LOG.info("Restarting worker in {}ms (reason={})", delayMs, reason);
        restartScheduler.schedule(() -> restart(reason), delayMs, TimeUnit.MILLISECONDS);
    }

    private void restart(String reason) {
        synchronized (lifecycleLock) {
            if (closed) {
                return;
            }
            restarts.incrementAndGet();
            metrics.incrementWorkerRestart(reason);
            spawnLocked(true);
        }
    }

    private void markReady(WorkerSession current) {
        synchronized (lifecycleLock) {
            if (!closed && session == current && current.isAlive()) {
                state = WorkerState.READY;
            }
        }
    }

    private void publishFailure(String reason, String message, Throwable cause, Map<String, String> context) {
        try {
            publisher.publishEvent(new WorkerFailureEvent(Instant.now(), reason, message, cause, context));
        } catch (RuntimeException e) {
            LOG.warn("Failed to publish worker failure event: {}", e.toString());
        }
    }

    private void recordOutcome(boolean success, long elapsedMs, long startNanos, ErrorKind failureKind) {
        totalExecutions.incrementAndGet();
        totalElapsedMs.addAndGet(elapsedMs);
        long nanos = System.nanoTime() - startNanos;
        if (success) {
            successfulExecutions.incrementAndGet();
            metrics.incrementWorkerSuccess();
            metrics.recordWorkerLatency(nanos, "success");
        } else {
            failedExecutions.incrementAndGet();
            metrics.incrementWorkerFailure(failureReason(failureKind));
            metrics.recordWorkerLatency(nanos, "failure");
        }
    }

    private static String failureReason(ErrorKind kind) {
        if (kind == null) {
            return "unknown";
        }
        return switch (kind) {
            case WORKER_TIMEOUT -> "timeout";
            case WORKER_EXECUTION -> "execution";
            case WORKER_CRASHED -> "crashed";
            case VALIDATION -> "validation";
            default -> "internal";
        };
    }

    private void sleepBeforeRetry(long backoffMs) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            Thread.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryBridgeException(ErrorKind.INTERNAL, "Interrupted while waiting to retry worker call", e);
        }
    }

    private Path workingDirectory() {
        String dir = props.getWorkingDirectory();
        return (dir == null || dir.isBlank()) ? null : Path.of(dir);
    }

    /**
     * One attempt waiting for the dispatcher.
     */
    private record WorkerRequest(String text,
                                 String callerId,
                                 List<ContextTurn> context,
                                 CompletableFuture<WorkerAnswer> result) {

        WorkerRequest(String text, String callerId, List<ContextTurn> context) {
            this(text, callerId, context, new CompletableFuture<>());
        }

        void complete(WorkerAnswer answer) {
            result.complete(answer);
        }

        void fail(Throwable error) {
            result.completeExceptionally(error);
        }
    }
}
