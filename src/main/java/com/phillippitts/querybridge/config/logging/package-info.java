/**
 * Request-scoped logging context.
 *
 * <p>{@link com.phillippitts.querybridge.config.logging.MdcFilter} populates Log4j 2's
 * {@code ThreadContext} with {@code requestId} and {@code callerId}; the job executor's task
 * decorator carries those values onto processor threads, which add {@code jobId}.
 */
package com.phillippitts.querybridge.config.logging;
