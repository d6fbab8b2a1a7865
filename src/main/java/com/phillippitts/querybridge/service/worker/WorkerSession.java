package com.phillippitts.querybridge.service.worker;

import com.phillippitts.querybridge.exception.WorkerCrashedException;
import com.phillippitts.querybridge.util.LogSanitizer;
import com.phillippitts.querybridge.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * One running instance of the worker process.
 *
 * <p>Responsibilities:
 * - Start the process via {@link ProcessFactory}
 * - Read stdout on a daemon thread: the readiness line completes {@link #ready()},
 *   every other JSON line is queued as a response, anything else is logged and dropped
 * - Drain stderr on a second daemon thread, logging each line at WARN
 * - Signal end-of-stream to a waiting reader and invoke the termination callback exactly once
 * - Graceful then forcible destruction on {@link #recycle(String)} / {@link #close()}
 *
 * <p>A session is never reused after its process dies; the bridge starts a new one.
 */
final class WorkerSession implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(WorkerSession.class);

    static final String REASON_CRASH = "crash";

    private static final int STDERR_TAIL_MAX_CHARS = 2000;
    private static final int LOG_LINE_MAX_CHARS = 500;

    /**
     * What the dispatcher reads back after writing a request.
     *
     * @param response parsed response line, null at end of stream
     * @param endOfStream true once stdout is closed
     */
    record Outcome(JSONObject response, boolean endOfStream) {
        static final Outcome EOF = new Outcome(null, true);

        static Outcome of(JSONObject response) {
            return new Outcome(response, false);
        }
    }

    private final long generation;
    private final Process process;
    private final BufferedWriter stdin;
    private final BlockingQueue<Outcome> responses = new LinkedBlockingQueue<>();
    private final CompletableFuture<WorkerSession> ready = new CompletableFuture<>();
    private final CompletableFuture<String> terminated = new CompletableFuture<>();
    private final StringBuilder stderrTail = new StringBuilder();
    private final Consumer<WorkerSession> onTerminated;

    private volatile String recycleReason;
    private volatile Thread stdoutReader;
    private volatile Thread stderrReader;

    private WorkerSession(long generation, Process process, Consumer<WorkerSession> onTerminated) {
        this.generation = generation;
        this.process = process;
        this.onTerminated = onTerminated;
        this.stdin = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
    }

    /**
     * Starts the process and its reader threads.
     *
     * @param generation monotonically increasing session number, used in thread names and logs
     * @param factory process factory
     * @param command executable and arguments
     * @param workingDir working directory (may be null)
     * @param onTerminated invoked once from the stdout reader when the process output ends
     * @return running session
     * @throws IOException if the process cannot be started
     */
    static WorkerSession start(long generation,
                               ProcessFactory factory,
                               List<String> command,
                               Path workingDir,
                               Consumer<WorkerSession> onTerminated) throws IOException {
        Objects.requireNonNull(factory, "factory");
        Objects.requireNonNull(onTerminated, "onTerminated");
        Process process = factory.start(command, workingDir);
        WorkerSession session = new WorkerSession(generation, process, onTerminated);
        session.stderrReader = session.startReader(process.getErrorStream(), session::drainStderr, "worker-err-");
        session.stdoutReader = session.startReader(process.getInputStream(), session::readStdout, "worker-out-");
        return session;
    }

    long generation() {
        return generation;
    }

    CompletableFuture<WorkerSession> ready() {
        return ready;
    }

    boolean isAlive() {
        return !terminated.isDone() && process.isAlive();
    }

    /**
     * Writes one request line. Must only be called when no other request is outstanding.
     *
     * @throws IOException if stdin is closed or the write fails
     */
    void send(String line) throws IOException {
        synchronized (stdin) {
            stdin.write(line);
            stdin.write('\n');
            stdin.flush();
        }
    }

    /**
     * Waits for the next response line.
     *
     * @param timeoutMs maximum wait
     * @return the outcome, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    Outcome awaitResponse(long timeoutMs) throws InterruptedException {
        return responses.poll(timeoutMs, TimeUnit.MILLISECONDS);
    }

    /** Reason passed to {@link #recycle(String)}, or {@link #REASON_CRASH} when the process died on its own. */
    String terminationReason() {
        String reason = recycleReason;
        return reason == null ? REASON_CRASH : reason;
    }

    /**
     * Exit code if the process has exited (waits briefly), otherwise -1.
     */
    int exitCode() {
        try {
            if (process.waitFor(ProcessTimeouts.READER_CLEANUP_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                return process.exitValue();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return -1;
    }

    String stderrTail() {
        synchronized (stderrTail) {
            return stderrTail.toString();
        }
    }

    /**
     * Kills the process on purpose. The termination callback still fires, reporting {@code reason}.
     */
    void recycle(String reason) {
        this.recycleReason = reason;
        LOG.warn("Recycling worker process: generation={}, reason={}", generation, reason);
        destroyProcess();
    }

    /**
     * Idempotent cleanup of the process and reader threads.
     */
    @Override
    public void close() {
        if (recycleReason == null) {
            recycleReason = "shutdown";
        }
        try {
            stdin.close();
        } catch (IOException e) {
            LOG.debug("Closing worker stdin failed: {}", e.toString());
        }
        destroyProcess();
        joinQuietly(stdoutReader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
        joinQuietly(stderrReader, ProcessTimeouts.READER_CLEANUP_TIMEOUT);
    }

    private Thread startReader(InputStream in, Consumer<BufferedReader> body, String prefix) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                body.accept(reader);
            } catch (IOException e) {
                LOG.debug("Closing worker stream failed: {}", e.toString());
            }
        }, prefix + generation);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private void readStdout(BufferedReader reader) {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                handleStdoutLine(line);
            }
        } catch (IOException e) {
            LOG.debug("Worker stdout reader stopped: generation={}, error={}", generation, e.toString());
        } finally {
            responses.add(Outcome.EOF);
            ready.completeExceptionally(new WorkerCrashedException("Worker process exited before it was ready"));
            if (terminated.complete(terminationReason())) {
                onTerminated.accept(this);
            }
        }
    }

    private void handleStdoutLine(String line) {
        if (line.isBlank()) {
            return;
        }
        JSONObject message = WorkerProtocol.parseLine(line).orElse(null);
        if (message == null) {
            LOG.warn("Ignoring unparseable worker output: {}", LogSanitizer.preview(line, LOG_LINE_MAX_CHARS));
            return;
        }
        if (!ready.isDone()) {
            if (WorkerProtocol.isReady(message)) {
                LOG.info("Worker process ready: generation={}", generation);
                ready.complete(this);
            } else {
                LOG.warn("Ignoring worker output before readiness: {}",
                        LogSanitizer.preview(line, LOG_LINE_MAX_CHARS));
            }
            return;
        }
        responses.add(Outcome.of(message));
    }

    private void drainStderr(BufferedReader reader) {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                LOG.warn("Worker stderr: {}", LogSanitizer.preview(line, LOG_LINE_MAX_CHARS));
                appendStderr(line);
            }
        } catch (IOException e) {
            LOG.debug("Worker stderr reader stopped: generation={}, error={}", generation, e.toString());
        }
    }

    private void appendStderr(String line) {
        synchronized (stderrTail) {
            if (!stderrTail.isEmpty()) {
                stderrTail.append('\n');
            }
            stderrTail.append(line);
            int overflow = stderrTail.length() - STDERR_TAIL_MAX_CHARS;
            if (overflow > 0) {
                stderrTail.delete(0, overflow);
            }
        }
    }

    private void destroyProcess() {
        try {
            if (!process.isAlive()) {
                return;
            }
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Worker process still alive after destroyForcibly: generation={}", generation);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying worker process");
        } catch (RuntimeException e) {
            LOG.warn("Error destroying worker process: {}", e.toString());
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
