package com.phillippitts.querybridge.service.queue;

import com.phillippitts.querybridge.config.properties.QueryValidationProperties;
import com.phillippitts.querybridge.config.properties.QueueProperties;
import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.JobSnapshot;
import com.phillippitts.querybridge.domain.JobState;
import com.phillippitts.querybridge.domain.QueryResult;
import com.phillippitts.querybridge.exception.ErrorKind;
import com.phillippitts.querybridge.exception.JobStalledException;
import com.phillippitts.querybridge.exception.QueryBridgeException;
import com.phillippitts.querybridge.exception.QueryValidationException;
import com.phillippitts.querybridge.exception.QueueTimeoutException;
import com.phillippitts.querybridge.exception.WorkerTimeoutException;
import com.phillippitts.querybridge.service.cache.InMemoryCacheStore;
import com.phillippitts.querybridge.service.cache.LocalResponseCache;
import com.phillippitts.querybridge.service.metrics.PipelineMetrics;
import com.phillippitts.querybridge.service.validation.QueryValidator;
import com.phillippitts.querybridge.testutil.FakeWorkerBridge;
import com.phillippitts.querybridge.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class ExecutorJobQueueTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private FakeWorkerBridge bridge;
    private LocalResponseCache cache;
    private MutableClock clock;
    private ExecutorService executor;
    private ExecutorJobQueue queue;

    @BeforeEach
    void setUp() {
        bridge = new FakeWorkerBridge();
        clock = new MutableClock();
        cache = new LocalResponseCache(true, Duration.ofHours(1), new InMemoryCacheStore(100));
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        bridge.release();
        if (queue != null) {
            queue.close();
        }
        executor.shutdownNow();
    }

    private ExecutorJobQueue startQueue(QueueProperties props) {
        queue = new ExecutorJobQueue(props, bridge, cache,
                new QueryValidator(QueryValidationProperties.defaults()),
                new PipelineMetrics(new SimpleMeterRegistry()), executor, clock);
        queue.start();
        return queue;
    }

    private static QueueProperties props(long stallTimeoutMs, int maxStalledCount) {
        return new QueueProperties(2, 5_000, stallTimeoutMs, 5_000, 10, maxStalledCount, 3_600_000, 300_000);
    }

    private QueryResult ask(String query) {
        return queue.await(queue.submit(query, "u-1", "s-1", null), WAIT);
    }

    @Test
    void secondIdenticalQueryIsServedFromCache() {
        startQueue(QueueProperties.defaults());

        QueryResult first = ask("What is the deadline?");
        QueryResult second = ask("  what IS the   deadline? ");

        assertThat(first.cached()).isFalse();
        assertThat(first.answer()).isEqualTo("answer:What is the deadline?");
        assertThat(second.cached()).isTrue();
        assertThat(second.answer()).isEqualTo(first.answer());
        assertThat(second.sources()).isEqualTo(first.sources());
        assertThat(bridge.calls()).isEqualTo(1);
    }

    @Test
    void queriesWithContextBypassCache() {
        startQueue(QueueProperties.defaults());
        List<ContextTurn> context = List.of(new ContextTurn("user", "I study physics"));

        QueryResult first = queue.await(queue.submit("What next?", "u-1", "s-1", context), WAIT);
        QueryResult second = queue.await(queue.submit("What next?", "u-1", "s-1", context), WAIT);

        assertThat(first.cached()).isFalse();
        assertThat(second.cached()).isFalse();
        assertThat(bridge.calls()).isEqualTo(2);
        assertThat(cache.size()).isZero();
    }

    @Test
    void resultCarriesIdentifiers() {
        startQueue(QueueProperties.defaults());

        JobHandle handle = queue.submit("hello", "u-9", "s-9", null);
        QueryResult result = queue.await(handle, WAIT);

        assertThat(result.jobId()).isEqualTo(handle.id());
        assertThat(result.callerId()).isEqualTo("u-9");
        assertThat(result.sessionId()).isEqualTo("s-9");
    }

    @Test
    void missingCallerAndSessionGetDefaults() {
        startQueue(QueueProperties.defaults());

        JobHandle handle = queue.submit("hello", null, " ", null);
        queue.await(handle, WAIT);

        JobSnapshot snapshot = queue.status(handle.id()).orElseThrow();
        assertThat(snapshot.callerId()).isEqualTo("anonymous");
        assertThat(snapshot.sessionId()).startsWith("session-");
        assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
        assertThat(snapshot.progress()).isEqualTo(100);
        assertThat(snapshot.attempts()).isEqualTo(1);
    }

    @Test
    void workerFailureFailsJobWithSameKind() {
        bridge.failWith(new WorkerTimeoutException("Worker request timeout", 30_000));
        startQueue(QueueProperties.defaults());

        JobHandle handle = queue.submit("hello", "u-1", "s-1", null);

        assertThatThrownBy(() -> queue.await(handle, WAIT))
                .isInstanceOf(WorkerTimeoutException.class);
        JobSnapshot snapshot = queue.status(handle.id()).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(JobState.FAILED);
        assertThat(snapshot.failureKind()).isEqualTo(ErrorKind.WORKER_TIMEOUT);
        assertThat(cache.size()).isZero();
    }

    @Test
    void invalidQueryIsRejectedAtSubmit() {
        startQueue(QueueProperties.defaults());

        assertThatThrownBy(() -> queue.submit("x".repeat(5000), "u-1", "s-1", null))
                .isInstanceOf(QueryValidationException.class);
        assertThat(queue.stats().total()).isZero();
        assertThat(bridge.calls()).isZero();
    }

    @Test
    void awaitTimeoutLeavesJobRunningAndResultIsCached() {
        bridge.blockWhen(n -> n == 1);
        startQueue(QueueProperties.defaults());

        JobHandle handle = queue.submit("slow question", "u-1", "s-1", null);

        assertThatThrownBy(() -> queue.await(handle, Duration.ofMillis(100)))
                .isInstanceOf(QueueTimeoutException.class)
                .satisfies(e -> assertThat(((QueryBridgeException) e).getKind()).isEqualTo(ErrorKind.QUEUE_TIMEOUT));

        bridge.release();
        await().atMost(WAIT).until(() -> queue.status(handle.id())
                .map(s -> s.state() == JobState.COMPLETED).orElse(false));

        assertThat(ask("slow question").cached()).isTrue();
        assertThat(bridge.calls()).isEqualTo(1);
    }

    @Test
    void slowJobsQueuedBehindTheWorkerAreNotStalled() throws Exception {
        bridge.serialize(300);
        startQueue(new QueueProperties(3, 10_000, 500, 5_000, 10, 1, 3_600_000, 300_000));
        ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor();
        sweeper.scheduleAtFixedRate(queue::detectStalled, 0, 50, TimeUnit.MILLISECONDS);
        try {
            List<JobHandle> handles = List.of(
                    queue.submit("q0", "u-1", "s-1", null),
                    queue.submit("q1", "u-1", "s-1", null),
                    queue.submit("q2", "u-1", "s-1", null));

            for (int i = 0; i < handles.size(); i++) {
                assertThat(queue.await(handles.get(i), WAIT).answer()).isEqualTo("answer:q" + i);
            }

            assertThat(bridge.calls()).isEqualTo(3);
            for (JobHandle handle : handles) {
                JobSnapshot snapshot = queue.status(handle.id()).orElseThrow();
                assertThat(snapshot.stalledCount()).isZero();
                assertThat(snapshot.attempts()).isEqualTo(1);
            }
        } finally {
            sweeper.shutdownNow();
        }
    }

    @Test
    void jobOfDeadProcessorIsRequeued() {
        bridge.killWhen(n -> n == 1);
        startQueue(props(5_000, 1));

        JobHandle handle = queue.submit("hello", "u-1", "s-1", null);
        await().atMost(WAIT).until(() -> bridge.calls() == 1);
        await().atMost(WAIT).until(() -> {
            queue.detectStalled();
            return queue.status(handle.id()).orElseThrow().stalledCount() == 1;
        });

        QueryResult result = queue.await(handle, WAIT);
        assertThat(result.answer()).isEqualTo("answer:hello");
        assertThat(result.sources()).containsExactly("passage-2");

        await().atMost(WAIT).until(() -> queue.liveProcessors() == 2);
        JobSnapshot snapshot = queue.status(handle.id()).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(JobState.COMPLETED);
        assertThat(snapshot.attempts()).isEqualTo(2);
        assertThat(bridge.calls()).isEqualTo(2);
    }

    @Test
    void liveProcessorKeepsLeaseWhileWorkerIsBlocked() throws Exception {
        bridge.blockWhen(n -> n == 1);
        startQueue(props(200, 0));

        JobHandle handle = queue.submit("hello", "u-1", "s-1", null);
        await().atMost(WAIT).until(() -> bridge.calls() == 1);
        for (int i = 0; i < 10; i++) {
            Thread.sleep(50);
            queue.detectStalled();
        }

        assertThat(queue.status(handle.id()).orElseThrow().state()).isEqualTo(JobState.ACTIVE);
        bridge.release();
        assertThat(queue.await(handle, WAIT).answer()).isEqualTo("answer:hello");
    }

    @Test
    void jobFailsOnceStallBudgetIsExhausted() {
        bridge.killWhen(n -> true);
        startQueue(props(5_000, 0));

        JobHandle handle = queue.submit("hello", "u-1", "s-1", null);
        await().atMost(WAIT).until(() -> bridge.calls() == 1);
        await().atMost(WAIT).until(() -> {
            queue.detectStalled();
            return queue.status(handle.id()).orElseThrow().state() == JobState.FAILED;
        });

        assertThatThrownBy(() -> queue.await(handle, WAIT))
                .isInstanceOf(JobStalledException.class)
                .satisfies(e -> assertThat(((QueryBridgeException) e).getKind()).isEqualTo(ErrorKind.JOB_STALLED));
        assertThat(bridge.calls()).isEqualTo(1);
    }

    @Test
    void cleanRemovesOldCompletedAndMuchOlderFailedJobs() {
        startQueue(QueueProperties.defaults());
        JobHandle ok = queue.submit("fine", "u-1", "s-1", null);
        queue.await(ok, WAIT);
        bridge.failWith(new WorkerTimeoutException("Worker request timeout", 30_000));
        JobHandle bad = queue.submit("broken", "u-1", "s-1", null);
        assertThatThrownBy(() -> queue.await(bad, WAIT)).isInstanceOf(WorkerTimeoutException.class);

        Duration grace = Duration.ofHours(1);
        assertThat(queue.clean(grace)).isEqualTo(new CleanResult(0, 0));

        clock.advance(Duration.ofHours(2));
        assertThat(queue.clean(grace)).isEqualTo(new CleanResult(1, 0));
        assertThat(queue.status(ok.id())).isEmpty();
        assertThat(queue.status(bad.id())).isPresent();

        clock.advance(Duration.ofHours(23));
        assertThat(queue.clean(grace)).isEqualTo(new CleanResult(0, 1));
        assertThat(queue.status(bad.id())).isEmpty();
    }

    @Test
    void pausedQueueHoldsJobsUntilResumed() throws Exception {
        startQueue(QueueProperties.defaults());
        queue.pause();

        JobHandle handle = queue.submit("hello", "u-1", "s-1", null);
        Thread.sleep(400);

        assertThat(queue.isPaused()).isTrue();
        assertThat(queue.stats().paused()).isTrue();
        assertThat(queue.status(handle.id()).orElseThrow().state()).isEqualTo(JobState.WAITING);
        assertThat(bridge.calls()).isZero();

        queue.resume();

        assertThat(queue.await(handle, WAIT).answer()).isEqualTo("answer:hello");
    }

    @Test
    void statsCountJobsByState() {
        startQueue(QueueProperties.defaults());
        ask("one");
        ask("two");

        QueueStats stats = queue.stats();

        assertThat(stats.completed()).isEqualTo(2);
        assertThat(stats.waiting()).isZero();
        assertThat(stats.failed()).isZero();
        assertThat(stats.health()).isEqualTo(QueueHealth.HEALTHY);
    }

    @Test
    void rejectedProcessorDoesNotBreakStartup() {
        queue = new ExecutorJobQueue(QueueProperties.defaults(), bridge, cache,
                new QueryValidator(QueryValidationProperties.defaults()),
                new PipelineMetrics(new SimpleMeterRegistry()),
                task -> {
                    throw new TaskRejectedException("job executor saturated");
                }, clock);

        queue.start();

        assertThat(queue.liveProcessors()).isZero();
    }

    @Test
    void closeFailsUnfinishedJobs() {
        bridge.blockWhen(n -> true);
        startQueue(QueueProperties.defaults());
        JobHandle handle = queue.submit("hello", "u-1", "s-1", null);
        await().atMost(WAIT).until(() -> bridge.calls() == 1);

        queue.close();

        assertThatThrownBy(() -> queue.await(handle, WAIT))
                .isInstanceOf(QueryBridgeException.class)
                .hasMessageContaining("closed");
        assertThatThrownBy(() -> queue.submit("again", "u-1", "s-1", null))
                .isInstanceOf(QueryBridgeException.class);
        queue.close();
    }
}
