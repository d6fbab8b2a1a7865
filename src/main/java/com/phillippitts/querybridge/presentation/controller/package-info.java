/**
 * REST API controllers.
 *
 * <ul>
 *   <li>{@code POST /api/query} - submit a query and wait for its answer</li>
 *   <li>{@code GET /api/jobs/{id}} - job status snapshot</li>
 *   <li>{@code GET /api/stats} - queue, cache and worker statistics</li>
 *   <li>{@code DELETE /api/cache} - clear cached answers</li>
 * </ul>
 */
package com.phillippitts.querybridge.presentation.controller;
