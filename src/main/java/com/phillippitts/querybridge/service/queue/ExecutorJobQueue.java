package com.phillippitts.querybridge.service.queue;

import com.phillippitts.querybridge.config.properties.QueueProperties;
import com.phillippitts.querybridge.domain.CachedAnswer;
import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.JobSnapshot;
import com.phillippitts.querybridge.domain.JobStage;
import com.phillippitts.querybridge.domain.JobState;
import com.phillippitts.querybridge.domain.QueryResult;
import com.phillippitts.querybridge.domain.WorkerAnswer;
import com.phillippitts.querybridge.exception.ErrorKind;
import com.phillippitts.querybridge.exception.JobStalledException;
import com.phillippitts.querybridge.exception.QueryBridgeException;
import com.phillippitts.querybridge.exception.QueueTimeoutException;
import com.phillippitts.querybridge.service.cache.ResponseCache;
import com.phillippitts.querybridge.service.metrics.PipelineMetrics;
import com.phillippitts.querybridge.service.validation.QueryValidator;
import com.phillippitts.querybridge.service.worker.WorkerBridge;
import com.phillippitts.querybridge.util.TimeUtils;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process job queue: {@code queue.concurrency} processor loops on the job executor pull
 * jobs from a FIFO and run them through cache lookup, worker call and cache write.
 *
 * <p><b>Processing per job:</b>
 * <pre>
 * STARTED(20) -> [no context: cache lookup, hit -> COMPLETE(100), cached=true]
 *             -> INVOKING_WORKER(40) -> bridge -> STORING(80) -> [no context: cache write]
 *             -> COMPLETE(100)
 * </pre>
 * Jobs with conversation context never read or write the cache: the same text can mean
 * something else in another conversation.
 *
 * <p><b>Stall recovery:</b> while a processor thread is alive it renews the lease of the job
 * it holds every {@code stall-timeout-ms / 2}; a processor that dies revokes it on the way out.
 * Time spent waiting for the worker therefore never counts as a stall. {@link #detectStalled()}
 * runs periodically and treats a job whose lease is revoked or older than
 * {@code queue.stall-timeout-ms} as abandoned: its processor is retired, a replacement is
 * started, and the job is requeued after {@code stall-backoff-ms * 2^(n-1)} until
 * {@code max-stalled-count} is exceeded, then failed with {@link JobStalledException}.
 * Results of the abandoned attempt are discarded.
 *
 * <p><b>Lifecycle:</b> {@link #start()} at context start; {@link #close()} stops processing,
 * fails every non-terminal job and clears the store.
 */
@Component
public class ExecutorJobQueue implements JobQueue, AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ExecutorJobQueue.class);

    private static final String DEFAULT_CALLER = WorkerBridge.DEFAULT_CALLER;
    private static final long POLL_INTERVAL_MS = 200;

    private final QueueProperties props;
    private final WorkerBridge bridge;
    private final ResponseCache cache;
    private final QueryValidator validator;
    private final PipelineMetrics metrics;
    private final Executor executor;
    private final Clock clock;

    private final JobStore store = new InMemoryJobStore();
    private final BlockingDeque<Job> waiting = new LinkedBlockingDeque<>();
    private final ConcurrentMap<String, Processor> owners = new ConcurrentHashMap<>();
    private final AtomicInteger processorSequence = new AtomicInteger();
    private final AtomicInteger liveProcessors = new AtomicInteger();
    private final Object pauseLock = new Object();

    private volatile boolean running;
    private volatile boolean closed;
    private volatile boolean paused;
    private ScheduledExecutorService scheduler;

    @Autowired
    public ExecutorJobQueue(QueueProperties props,
                            WorkerBridge bridge,
                            ResponseCache cache,
                            QueryValidator validator,
                            PipelineMetrics metrics,
                            @Qualifier("jobExecutor") Executor executor) {
        this(props, bridge, cache, validator, metrics, executor, Clock.systemUTC());
    }

    ExecutorJobQueue(QueueProperties props,
                     WorkerBridge bridge,
                     ResponseCache cache,
                     QueryValidator validator,
                     PipelineMetrics metrics,
                     Executor executor,
                     Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Starts the processor loops. Idempotent.
     */
    @PostConstruct
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Job queue is closed");
        }
        if (running) {
            LOG.warn("Queue processor already running");
            return;
        }
        running = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-lease");
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < props.concurrency(); i++) {
            spawnProcessor();
        }
        LOG.info("Queue processor started: concurrency={}", props.concurrency());
    }

    @Override
    public JobHandle submit(String query, String callerId, String sessionId, List<ContextTurn> context) {
        if (closed) {
            throw new QueryBridgeException(ErrorKind.INTERNAL, "Job queue is closed");
        }
        validator.validate(query, context);
        Instant now = clock.instant();
        String caller = (callerId == null || callerId.isBlank()) ? DEFAULT_CALLER : callerId;
        String session = (sessionId == null || sessionId.isBlank()) ? "session-" + now.toEpochMilli() : sessionId;
        Job job = new Job(UUID.randomUUID().toString(), query, caller, session,
                context == null ? List.of() : context, now);
        store.save(job);
        waiting.add(job);
        LOG.info("Job added: jobId={}, callerId={}, queryLength={}, contextTurns={}",
                job.id(), caller, query.length(), job.context().size());
        return new JobHandle(job.id(), job.completion());
    }

    @Override
    public QueryResult await(JobHandle handle, Duration timeout) {
        Objects.requireNonNull(handle, "handle");
        long timeoutMs = timeout == null || timeout.isNegative() || timeout.isZero()
                ? props.awaitTimeoutMs() : timeout.toMillis();
        try {
            return handle.future().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            LOG.warn("Await timed out: jobId={}, timeoutMs={}", handle.id(), timeoutMs);
            throw new QueueTimeoutException(handle.id(), timeoutMs);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof QueryBridgeException qbe) {
                throw qbe;
            }
            throw new QueryBridgeException(ErrorKind.INTERNAL, "Job failed unexpectedly", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new QueryBridgeException(ErrorKind.INTERNAL, "Interrupted while awaiting job " + handle.id(), e);
        }
    }

    @Override
    public Optional<JobSnapshot> status(String jobId) {
        return store.find(jobId).map(Job::snapshot);
    }

    @Override
    public QueueStats stats() {
        long waitingCount = 0;
        long active = 0;
        long completed = 0;
        long failed = 0;
        long delayed = 0;
        for (Job job : store.all()) {
            switch (job.state()) {
                case WAITING -> waitingCount++;
                case ACTIVE, STALLED -> active++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
                case DELAYED -> delayed++;
                default -> {
                    // no other states
                }
            }
        }
        long total = waitingCount + active + completed + failed + delayed;
        return new QueueStats(waitingCount, active, completed, failed, delayed, paused, total,
                QueueHealth.of(waitingCount, active, failed));
    }

    @Override
    public CleanResult clean(Duration grace) {
        Instant now = clock.instant();
        Instant completedCutoff = now.minus(grace);
        Instant failedCutoff = now.minus(grace.multipliedBy(QueueProperties.FAILED_RETENTION_MULTIPLIER));
        int completedRemoved = 0;
        int failedRemoved = 0;
        for (Job job : store.all()) {
            Instant finished = job.finishedAt();
            if (finished == null) {
                continue;
            }
            JobState state = job.state();
            if (state == JobState.COMPLETED && finished.isBefore(completedCutoff) && store.remove(job.id())) {
                completedRemoved++;
            } else if (state == JobState.FAILED && finished.isBefore(failedCutoff) && store.remove(job.id())) {
                failedRemoved++;
            }
        }
        if (completedRemoved > 0 || failedRemoved > 0) {
            LOG.info("Queue cleaned: completedRemoved={}, failedRemoved={}", completedRemoved, failedRemoved);
        }
        return new CleanResult(completedRemoved, failedRemoved);
    }

    @Scheduled(fixedDelayString = "${queue.cleanup-interval-ms:300000}")
    void scheduledClean() {
        clean(Duration.ofMillis(props.completedGraceMs()));
    }

    @Override
    public void pause() {
        paused = true;
        LOG.info("Queue paused");
    }

    @Override
    public void resume() {
        synchronized (pauseLock) {
            paused = false;
            pauseLock.notifyAll();
        }
        LOG.info("Queue resumed");
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    /** Number of processor loops currently alive, replacements included. */
    int liveProcessors() {
        return liveProcessors.get();
    }

    /**
     * Declares ACTIVE jobs whose lease lapsed stalled and requeues or fails them.
     */
    @Scheduled(fixedDelayString = "${queue.stall-check-interval-ms:5000}")
    void detectStalled() {
        if (!running) {
            return;
        }
        long nowNanos = System.nanoTime();
        for (Job job : store.all()) {
            int stalledCount = job.markStalledIfLeaseLost(nowNanos);
            if (stalledCount < 0) {
                continue;
            }
            metrics.incrementJobStalled();
            Processor owner = owners.remove(job.id());
            if (owner != null) {
                owner.retire();
            }
            LOG.warn("Job stalled: jobId={}, stalledCount={}, maxStalledCount={}",
                    job.id(), stalledCount, props.maxStalledCount());
            spawnProcessor();

            if (stalledCount > props.maxStalledCount()) {
                failJob(job, new JobStalledException(job.id(), stalledCount));
                continue;
            }
            job.markDelayed();
            long delayMs = TimeUtils.exponentialBackoff(stalledCount, props.stallBackoffMs(), Long.MAX_VALUE);
            scheduler.schedule(() -> requeue(job), delayMs, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stops processing, fails every unfinished job and clears the store. Idempotent.
     */
    @PreDestroy
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            running = false;
        }
        resume();
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        int failed = 0;
        for (Job job : store.all()) {
            if (job.failTerminal(new QueryBridgeException(ErrorKind.INTERNAL, "Job queue closed"), clock.instant())) {
                failed++;
            }
        }
        waiting.clear();
        owners.clear();
        store.clear();
        LOG.info("Queue closed: unfinishedJobsFailed={}", failed);
    }

    private void requeue(Job job) {
        if (!running) {
            return;
        }
        if (job.markWaiting()) {
            waiting.add(job);
            LOG.info("Stalled job requeued: jobId={}", job.id());
        }
    }

    private void spawnProcessor() {
        Processor processor = new Processor(processorSequence.incrementAndGet());
        try {
            executor.execute(processor);
            liveProcessors.incrementAndGet();
        } catch (RejectedExecutionException e) {
            LOG.error("Job executor rejected processor {}: {}", processor.number, e.toString());
        }
    }

    private ScheduledFuture<?> renewLease(Job job, long token, Thread holder) {
        long leaseNanos = TimeUnit.MILLISECONDS.toNanos(props.stallTimeoutMs());
        long periodMs = Math.max(1, props.stallTimeoutMs() / 2);
        return scheduler.scheduleAtFixedRate(() -> {
            if (holder.isAlive()) {
                job.renewLease(token, System.nanoTime() + leaseNanos);
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void awaitResume() throws InterruptedException {
        synchronized (pauseLock) {
            while (paused && running) {
                pauseLock.wait(POLL_INTERVAL_MS);
            }
        }
    }

    private void process(Job job, long token) {
        ThreadContext.put("jobId", job.id());
        ThreadContext.put("callerId", job.callerId());
        long startNanos = System.nanoTime();
        try {
            LOG.info("Job processing: attempt token={}", token);
            job.advance(token, JobStage.STARTED);

            boolean cacheable = job.context().isEmpty();
            String fingerprint = cacheable ? cache.fingerprint(job.query()) : null;
            if (cacheable) {
                Optional<CachedAnswer> hit = cache.get(fingerprint);
                if (hit.isPresent()) {
                    metrics.incrementCacheHit();
                    LOG.info("Cache hit for job");
                    QueryResult result = new QueryResult(hit.get().answer(), hit.get().sources(), true,
                            TimeUtils.elapsedMillis(startNanos), job.callerId(), job.sessionId(), job.id());
                    finish(job, token, result);
                    return;
                }
                metrics.incrementCacheMiss();
            }

            job.advance(token, JobStage.INVOKING_WORKER);
            WorkerAnswer answer = bridge.query(job.query(), job.callerId(), job.context());

            job.advance(token, JobStage.STORING);
            if (cacheable) {
                cache.set(fingerprint, CachedAnswer.of(answer));
            }
            QueryResult result = new QueryResult(answer.answer(), answer.sources(), false,
                    TimeUtils.elapsedMillis(startNanos), job.callerId(), job.sessionId(), job.id());
            finish(job, token, result);
        } catch (QueryBridgeException e) {
            if (job.fail(token, e, clock.instant())) {
                metrics.incrementJobFailed(e.getKind().name());
                LOG.warn("Job failed: kind={}, error={}", e.getKind(), e.getMessage());
            } else {
                LOG.info("Discarding failure of abandoned attempt: {}", e.getMessage());
            }
        } catch (RuntimeException e) {
            LOG.error("Unexpected error while processing job", e);
            QueryBridgeException wrapped = new QueryBridgeException(ErrorKind.INTERNAL, "Unexpected processing error", e);
            if (job.fail(token, wrapped, clock.instant())) {
                metrics.incrementJobFailed(ErrorKind.INTERNAL.name());
            }
        } finally {
            ThreadContext.remove("jobId");
            ThreadContext.remove("callerId");
        }
    }

    private void finish(Job job, long token, QueryResult result) {
        job.advance(token, JobStage.COMPLETE);
        if (job.complete(token, result, clock.instant())) {
            metrics.incrementJobCompleted(result.cached());
            LOG.info("Job completed: cached={}, elapsedMs={}", result.cached(), result.elapsedMs());
        } else {
            LOG.info("Discarding late result of abandoned attempt");
        }
    }

    private void failJob(Job job, QueryBridgeException error) {
        if (job.failTerminal(error, clock.instant())) {
            metrics.incrementJobFailed(error.getKind().name());
            LOG.error("Job failed: jobId={}, kind={}, error={}", job.id(), error.getKind(), error.getMessage());
        }
    }

    /**
     * One processor loop. Retired loops exit after their current job returns.
     */
    private final class Processor implements Runnable {
        private final int number;
        private volatile boolean retired;

        Processor(int number) {
            this.number = number;
        }

        void retire() {
            retired = true;
        }

        @Override
        public void run() {
            LOG.debug("Job processor {} started", number);
            try {
                while (running && !retired) {
                    awaitResume();
                    Job job = waiting.poll(POLL_INTERVAL_MS, TimeUnit.MILLISECONDS);
                    if (job == null || !running) {
                        continue;
                    }
                    if (paused) {
                        // taken while pausing; keep its place at the head
                        waiting.offerFirst(job);
                        continue;
                    }
                    long token = job.activate(clock.instant(),
                            TimeUnit.MILLISECONDS.toNanos(props.stallTimeoutMs()));
                    if (token < 0) {
                        continue;
                    }
                    ScheduledFuture<?> lease;
                    try {
                        lease = renewLease(job, token, Thread.currentThread());
                    } catch (RejectedExecutionException e) {
                        // scheduler already shut down by close()
                        continue;
                    }
                    owners.put(job.id(), this);
                    boolean returned = false;
                    try {
                        process(job, token);
                        returned = true;
                    } finally {
                        lease.cancel(false);
                        owners.remove(job.id(), this);
                        if (!returned) {
                            // processor is dying; hand the job to the stall sweep
                            job.revokeLease(token);
                            LOG.error("Job processor {} died while holding job {}", number, job.id());
                        }
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                liveProcessors.decrementAndGet();
                LOG.debug("Job processor {} stopped (retired={})", number, retired);
            }
        }
    }
}
