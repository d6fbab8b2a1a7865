package com.phillippitts.querybridge.service.orchestration;

import com.phillippitts.querybridge.config.properties.QueueProperties;
import com.phillippitts.querybridge.domain.ContextTurn;
import com.phillippitts.querybridge.domain.QueryResult;
import com.phillippitts.querybridge.service.queue.JobHandle;
import com.phillippitts.querybridge.service.queue.JobQueue;
import com.phillippitts.querybridge.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Inbound entry point: submits a query to the job queue and waits for its result.
 *
 * <p>The caller always gets either a result or a
 * {@link com.phillippitts.querybridge.exception.QueryBridgeException} within the wait bound,
 * however the worker behaves. A {@code QUEUE_TIMEOUT} only ends the wait; the job keeps
 * running and its result still lands in the cache.
 */
@Service
public class QueryOrchestrator {

    private static final Logger LOG = LogManager.getLogger(QueryOrchestrator.class);

    private final JobQueue queue;
    private final QueueProperties props;

    public QueryOrchestrator(JobQueue queue, QueueProperties props) {
        this.queue = Objects.requireNonNull(queue, "queue");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * @param timeoutMs wait bound; {@code <= 0} uses {@code queue.await-timeout-ms}
     */
    public QueryResult submitAndAwait(String query,
                                      String callerId,
                                      String sessionId,
                                      List<ContextTurn> context,
                                      long timeoutMs) {
        long effectiveTimeout = timeoutMs > 0 ? timeoutMs : props.awaitTimeoutMs();
        long startNanos = System.nanoTime();
        JobHandle handle = queue.submit(query, callerId, sessionId, context);
        QueryResult result = queue.await(handle, Duration.ofMillis(effectiveTimeout));
        LOG.info("Query answered: jobId={}, cached={}, totalMs={}",
                handle.id(), result.cached(), TimeUtils.elapsedMillis(startNanos));
        return result;
    }
}
