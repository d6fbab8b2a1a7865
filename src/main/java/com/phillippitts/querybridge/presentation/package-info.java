/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Presentation depends on service but not vice versa. Controllers are thin adapters over
 * {@link com.phillippitts.querybridge.service.orchestration.QueryOrchestrator}; failures are
 * translated to HTTP statuses in one place.
 *
 * @see com.phillippitts.querybridge.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.querybridge.presentation;
