/**
 * Input validation. Rejected input never reaches the queue or the worker.
 */
package com.phillippitts.querybridge.service.validation;
