package com.phillippitts.querybridge.presentation.controller;

import com.phillippitts.querybridge.domain.JobSnapshot;
import com.phillippitts.querybridge.domain.QueryResult;
import com.phillippitts.querybridge.exception.JobNotFoundException;
import com.phillippitts.querybridge.service.cache.ResponseCache;
import com.phillippitts.querybridge.service.orchestration.QueryOrchestrator;
import com.phillippitts.querybridge.service.queue.JobQueue;
import com.phillippitts.querybridge.service.worker.WorkerBridge;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP adapter over the query pipeline. Failures are mapped to status codes by
 * {@link com.phillippitts.querybridge.presentation.exception.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api")
class QueryController {

    private static final Logger LOG = LogManager.getLogger(QueryController.class);

    private final QueryOrchestrator orchestrator;
    private final JobQueue queue;
    private final ResponseCache cache;
    private final WorkerBridge bridge;

    QueryController(QueryOrchestrator orchestrator, JobQueue queue, ResponseCache cache, WorkerBridge bridge) {
        this.orchestrator = orchestrator;
        this.queue = queue;
        this.cache = cache;
        this.bridge = bridge;
    }

    @PostMapping("/query")
    ResponseEntity<QueryResult> query(@Valid @RequestBody QueryRequest request,
                                      @RequestHeader(name = "X-Caller-ID", required = false) String headerCaller) {
        String callerId = request.callerId() != null ? request.callerId() : headerCaller;
        long timeoutMs = request.timeoutMs() == null ? 0 : request.timeoutMs();
        QueryResult result = orchestrator.submitAndAwait(
                request.query(), callerId, request.sessionId(), request.context(), timeoutMs);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/jobs/{id}")
    ResponseEntity<JobSnapshot> job(@PathVariable("id") String id) {
        JobSnapshot snapshot = queue.status(id).orElseThrow(() -> new JobNotFoundException(id));
        return ResponseEntity.ok(snapshot);
    }

    @GetMapping("/stats")
    ResponseEntity<Map<String, Object>> stats() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("queue", queue.stats());
        body.put("cache", cache.stats());
        body.put("worker", bridge.stats());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/cache")
    ResponseEntity<Void> clearCache() {
        cache.clear();
        LOG.info("Response cache cleared");
        return ResponseEntity.noContent().build();
    }
}
