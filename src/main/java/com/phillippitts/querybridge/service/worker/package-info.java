/**
 * Bridge to the long-lived external worker process.
 *
 * <h2>Overview</h2>
 * <p>One worker process is kept warm and fed one request at a time over line-delimited JSON
 * on stdin/stdout. The process signals readiness by printing {@code Ready} on stdout; stderr
 * is logged and otherwise ignored.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.phillippitts.querybridge.service.worker.PersistentWorkerBridge PersistentWorkerBridge} -
 *       retry loop, single dispatcher thread and restart scheduling</li>
 *   <li>{@code WorkerSession} - one process generation: reader threads, response queue,
 *       termination tracking</li>
 *   <li>{@code WorkerProtocol} - request encoding and response decoding</li>
 *   <li>{@code RestartBudget} - sliding-window restart accounting with cooldown</li>
 * </ul>
 *
 * <h2>Failure Handling</h2>
 * <ul>
 *   <li><strong>Execution error</strong> - the worker answered with an error payload; retried</li>
 *   <li><strong>Timeout</strong> - no answer within {@code worker.request-timeout-ms}; the process
 *       is recycled so a late answer cannot be paired with the next request, then retried</li>
 *   <li><strong>Crash</strong> - the process exited; the in-flight request fails immediately and
 *       a restart is scheduled after {@code worker.restart-delay-ms}</li>
 * </ul>
 *
 * <p>Each failure publishes a
 * {@link com.phillippitts.querybridge.service.worker.WorkerFailureEvent WorkerFailureEvent};
 * a completed restart publishes a
 * {@link com.phillippitts.querybridge.service.worker.WorkerReadyEvent WorkerReadyEvent}.</p>
 *
 * <h2>Configuration</h2>
 * <p>Prefix {@code worker}; see
 * {@link com.phillippitts.querybridge.config.properties.WorkerProperties WorkerProperties}.</p>
 */
package com.phillippitts.querybridge.service.worker;
