/**
 * Actuator health indicators for the worker, the response cache and the job queue.
 */
package com.phillippitts.querybridge.service.health;
