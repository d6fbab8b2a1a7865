/**
 * Pipeline exception hierarchy.
 *
 * <p>Every failure that can reach a caller extends
 * {@link com.phillippitts.querybridge.exception.QueryBridgeException} and carries an
 * {@link com.phillippitts.querybridge.exception.ErrorKind}:
 * <ul>
 *   <li>{@link com.phillippitts.querybridge.exception.QueryValidationException} - bad input, never retried</li>
 *   <li>{@link com.phillippitts.querybridge.exception.WorkerExecutionException} - worker returned a failure payload</li>
 *   <li>{@link com.phillippitts.querybridge.exception.WorkerTimeoutException} - worker did not answer in time</li>
 *   <li>{@link com.phillippitts.querybridge.exception.WorkerCrashedException} - worker process died mid-request</li>
 *   <li>{@link com.phillippitts.querybridge.exception.QueueTimeoutException} - caller stopped waiting</li>
 *   <li>{@link com.phillippitts.querybridge.exception.JobStalledException} - processor lost too often</li>
 *   <li>{@link com.phillippitts.querybridge.exception.JobNotFoundException} - unknown job id</li>
 * </ul>
 *
 * <p>Cache failures never surface here: the cache downgrades them to misses.
 *
 * @see com.phillippitts.querybridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.querybridge.exception;
