/**
 * Advisory response cache.
 *
 * <p>Keys are {@link com.phillippitts.querybridge.service.cache.QueryFingerprint} values; payloads
 * are JSON strings so the same bytes can live in Redis or in process memory. Store failures
 * never reach callers.
 */
package com.phillippitts.querybridge.service.cache;
