package com.phillippitts.querybridge.service.worker;

import com.phillippitts.querybridge.config.properties.QueryValidationProperties;
import com.phillippitts.querybridge.config.properties.WorkerProperties;
import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.WorkerAnswer;
import com.phillippitts.querybridge.exception.ErrorKind;
import com.phillippitts.querybridge.exception.QueryBridgeException;
import com.phillippitts.querybridge.exception.QueryValidationException;
import com.phillippitts.querybridge.exception.WorkerCrashedException;
import com.phillippitts.querybridge.exception.WorkerExecutionException;
import com.phillippitts.querybridge.exception.WorkerTimeoutException;
import com.phillippitts.querybridge.service.metrics.PipelineMetrics;
import com.phillippitts.querybridge.service.validation.QueryValidator;
import com.phillippitts.querybridge.service.worker.WorkerTestDoubles.ConcurrencyProbe;
import com.phillippitts.querybridge.service.worker.WorkerTestDoubles.ScriptedProcess;
import com.phillippitts.querybridge.service.worker.WorkerTestDoubles.StubProcessFactory;
import com.phillippitts.querybridge.testutil.EventCapturingPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.phillippitts.querybridge.service.worker.WorkerTestDoubles.answerLine;
import static com.phillippitts.querybridge.service.worker.WorkerTestDoubles.echo;
import static com.phillippitts.querybridge.service.worker.WorkerTestDoubles.errorLine;
import static com.phillippitts.querybridge.service.worker.WorkerTestDoubles.silent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class PersistentWorkerBridgeTest {

    private WorkerProperties props;
    private EventCapturingPublisher publisher;
    private PersistentWorkerBridge bridge;

    @BeforeEach
    void setUp() {
        props = new WorkerProperties();
        props.setAutoStart(false);
        props.setRequestTimeoutMs(300);
        props.setStartupTimeoutMs(2000);
        props.setRestartDelayMs(10);
        props.getRetry().setMaxAttempts(2);
        props.getRetry().setBaseBackoffMs(10);
        props.getRetry().setMaxBackoffMs(20);
        publisher = new EventCapturingPublisher();
    }

    @AfterEach
    void tearDown() {
        if (bridge != null) {
            bridge.close();
        }
    }

    private StubProcessFactory factory(Supplier<ScriptedProcess> supplier) {
        StubProcessFactory factory = new StubProcessFactory(supplier);
        bridge = new PersistentWorkerBridge(factory, props,
                new QueryValidator(QueryValidationProperties.defaults()),
                publisher, new PipelineMetrics(new SimpleMeterRegistry()), Clock.systemUTC());
        return factory;
    }

    @Test
    void returnsAnswerAndSendsCallerAndContext() {
        StubProcessFactory factory = factory(() -> new ScriptedProcess(echo()));

        WorkerAnswer answer = bridge.query("What is the deadline?", "u-1",
                List.of(new ContextTurn("user", "hi"), new ContextTurn("assistant", "hello")));

        assertThat(answer.answer()).isEqualTo("answer:What is the deadline?");
        assertThat(answer.sources()).containsExactly("passage-1");
        assertThat(answer.usage()).containsEntry("contextCount", "1");
        assertThat(answer.success()).isTrue();

        JSONObject sent = factory.latest().requests().get(0);
        assertThat(sent.getString("userId")).isEqualTo("u-1");
        assertThat(sent.getJSONArray("conversationHistory").length()).isEqualTo(2);
        assertThat(bridge.state()).isEqualTo(WorkerState.READY);
    }

    @Test
    void blankCallerDefaultsToAnonymous() {
        StubProcessFactory factory = factory(() -> new ScriptedProcess(echo()));

        bridge.query("hello", "  ", null);

        assertThat(factory.latest().requests().get(0).getString("userId"))
                .isEqualTo(WorkerBridge.DEFAULT_CALLER);
    }

    @Test
    void retriesExecutionFailureThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        factory(() -> new ScriptedProcess((request, process) -> {
            if (calls.incrementAndGet() == 1) {
                process.reply(errorLine("index not loaded"));
            } else {
                process.reply(answerLine("second try"));
            }
        }));

        WorkerAnswer answer = bridge.query("hello", "u-1", null);

        assertThat(answer.answer()).isEqualTo("second try");
        assertThat(bridge.stats().workerInvocations()).isEqualTo(2);
        assertThat(bridge.stats().successfulExecutions()).isEqualTo(1);
    }

    @Test
    void exhaustedExecutionFailuresSurfaceAsExecutionError() {
        factory(() -> new ScriptedProcess((request, process) -> process.reply(errorLine("boom"))));

        assertThatThrownBy(() -> bridge.query("hello", "u-1", null))
                .isInstanceOf(WorkerExecutionException.class)
                .hasMessageContaining("after 2 attempts")
                .satisfies(e -> {
                    QueryBridgeException qbe = (QueryBridgeException) e;
                    assertThat(qbe.getKind()).isEqualTo(ErrorKind.WORKER_EXECUTION);
                    assertThat(qbe.getDetails()).containsEntry("attempts", "2");
                });
        assertThat(bridge.stats().failedExecutions()).isEqualTo(1);
    }

    @Test
    void timeoutRecyclesProcessAndConsumesExactlyMaxAttempts() {
        StubProcessFactory factory = factory(() -> new ScriptedProcess(silent()));

        assertThatThrownBy(() -> bridge.query("slow question", "u-1", null))
                .isInstanceOf(WorkerTimeoutException.class)
                .satisfies(e -> assertThat(((QueryBridgeException) e).getKind()).isEqualTo(ErrorKind.WORKER_TIMEOUT));

        assertThat(bridge.stats().workerInvocations()).isEqualTo(2);
        // the second attempt ran on a fresh process, never behind the stale request
        assertThat(factory.startCount()).isGreaterThanOrEqualTo(2);
        assertThat(factory.started().get(0).requests()).hasSize(1);
        assertThat(factory.started().get(0).isAlive()).isFalse();
        assertThat(publisher.eventsOf(WorkerFailureEvent.class))
                .extracting(WorkerFailureEvent::reason)
                .contains(PersistentWorkerBridge.REASON_TIMEOUT);
    }

    @Test
    void crashFailsInFlightRequestWithoutRetryAndRecovers() {
        AtomicInteger generation = new AtomicInteger();
        StubProcessFactory factory = factory(() -> generation.incrementAndGet() == 1
                ? new ScriptedProcess((request, process) -> {
                    process.writeStderr("Segmentation fault");
                    process.crash(139);
                })
                : new ScriptedProcess(echo()));

        assertThatThrownBy(() -> bridge.query("first", "u-1", null))
                .isInstanceOf(WorkerCrashedException.class);
        assertThat(bridge.stats().workerInvocations()).isEqualTo(1);

        await().atMost(Duration.ofSeconds(5)).until(() -> bridge.state() == WorkerState.READY);
        WorkerAnswer answer = bridge.query("second", "u-1", null);

        assertThat(answer.answer()).isEqualTo("answer:second");
        assertThat(factory.startCount()).isEqualTo(2);
        assertThat(bridge.stats().restarts()).isEqualTo(1);
        assertThat(publisher.eventsOf(WorkerFailureEvent.class))
                .extracting(WorkerFailureEvent::reason)
                .contains(WorkerSession.REASON_CRASH);
        assertThat(publisher.eventsOf(WorkerReadyEvent.class))
                .anyMatch(WorkerReadyEvent::restart);
    }

    @Test
    void oversizedQueryNeverReachesWorker() {
        StubProcessFactory factory = factory(() -> new ScriptedProcess(echo()));

        assertThatThrownBy(() -> bridge.query("x".repeat(5000), "u-1", null))
                .isInstanceOf(QueryValidationException.class);

        assertThat(factory.startCount()).isZero();
        assertThat(bridge.stats().workerInvocations()).isZero();
    }

    @Test
    void concurrentCallersNeverOverlapAtTheWorker() throws Exception {
        props.setRequestTimeoutMs(5000);
        ConcurrencyProbe probe = new ConcurrencyProbe(20);
        factory(() -> new ScriptedProcess(probe));
        bridge.start();

        ExecutorService callers = Executors.newFixedThreadPool(6);
        try {
            List<Future<WorkerAnswer>> futures = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                String query = "question " + i;
                futures.add(callers.submit(() -> bridge.query(query, "u-1", null)));
            }
            for (int i = 0; i < 6; i++) {
                assertThat(futures.get(i).get(10, TimeUnit.SECONDS).answer()).isEqualTo("answer:question " + i);
            }
        } finally {
            callers.shutdownNow();
        }

        assertThat(probe.maxInFlight()).isEqualTo(1);
        assertThat(bridge.stats().workerInvocations()).isEqualTo(6);
    }

    @Test
    void ignoresUnparseableOutputLines() {
        factory(() -> {
            ScriptedProcess process = new ScriptedProcess((request, p) -> {
                p.reply("Loading embeddings...");
                p.reply("{not json");
                p.reply(answerLine("ok"));
            }, false);
            process.reply("Some banner text");
            process.announceReady();
            return process;
        });

        assertThat(bridge.query("hello", "u-1", null).answer()).isEqualTo("ok");
    }

    @Test
    void processThatNeverBecomesReadyFailsRequestAndIsRecycled() {
        props.setStartupTimeoutMs(300);
        StubProcessFactory factory = factory(() -> new ScriptedProcess(echo(), false));

        assertThatThrownBy(() -> bridge.query("hello", "u-1", null))
                .isInstanceOf(WorkerCrashedException.class)
                .hasMessageContaining("did not become ready");

        assertThat(factory.started().get(0).isAlive()).isFalse();
        await().atMost(Duration.ofSeconds(5)).until(() -> factory.startCount() >= 2);
    }

    @Test
    void closeFailsInFlightRequestAndRejectsNewOnes() {
        props.setRequestTimeoutMs(10_000);
        factory(() -> new ScriptedProcess(silent()));

        CompletableFuture<WorkerAnswer> inFlight =
                CompletableFuture.supplyAsync(() -> bridge.query("hello", "u-1", null));
        await().atMost(Duration.ofSeconds(5)).until(() -> bridge.stats().workerInvocations() == 1);

        bridge.close();

        assertThatThrownBy(() -> inFlight.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(WorkerCrashedException.class);
        assertThatThrownBy(() -> bridge.query("again", "u-1", null))
                .isInstanceOf(WorkerCrashedException.class);
        assertThat(bridge.state()).isEqualTo(WorkerState.STOPPED);
        bridge.close();
    }

    @Test
    void healthCheckReflectsWorkerAvailability() {
        factory(() -> new ScriptedProcess(echo()));
        assertThat(bridge.healthCheck(Duration.ofSeconds(5))).isTrue();
    }

    @Test
    void healthCheckFailsWhenWorkerIsSilent() {
        factory(() -> new ScriptedProcess(silent()));
        assertThat(bridge.healthCheck(Duration.ofMillis(100))).isFalse();
    }

    @Test
    void timedOutHealthCheckIsDroppedBeforeReachingWorker() {
        StubProcessFactory factory = factory(() -> new ScriptedProcess(echo(), false));

        long startNanos = System.nanoTime();
        boolean healthy = bridge.healthCheck(Duration.ofMillis(100));
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        assertThat(healthy).isFalse();
        assertThat(elapsedMs).isLessThan(1000);

        factory.latest().announceReady();
        WorkerAnswer answer = bridge.query("real question", "u-1", null);

        assertThat(answer.answer()).isEqualTo("answer:real question");
        assertThat(factory.latest().requests())
                .extracting(r -> r.getString("query"))
                .containsExactly("real question");
        assertThat(factory.startCount()).isEqualTo(1);
    }

    @Test
    void requestAfterReadyProcessDiesWaitsForReplacement() {
        StubProcessFactory factory = factory(() -> new ScriptedProcess(echo()));
        bridge.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> bridge.state() == WorkerState.READY);

        factory.latest().crash(1);
        WorkerAnswer answer = bridge.query("after crash", "u-1", null);

        assertThat(answer.answer()).isEqualTo("answer:after crash");
        assertThat(factory.startCount()).isEqualTo(2);
        assertThat(factory.started().get(0).requests()).isEmpty();
    }

    @Test
    void resetStatsClearsCounters() {
        factory(() -> new ScriptedProcess(echo()));
        bridge.query("hello", "u-1", null);

        WorkerStats before = bridge.stats();
        assertThat(before.totalExecutions()).isEqualTo(1);
        assertThat(before.successRate()).isEqualTo(100.0);

        bridge.resetStats();

        assertThat(bridge.stats().totalExecutions()).isZero();
        assertThat(bridge.stats().workerInvocations()).isZero();
    }
}
