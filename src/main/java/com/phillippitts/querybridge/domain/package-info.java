/**
 * Immutable value types shared by the worker bridge, the response cache and the job queue.
 */
package com.phillippitts.querybridge.domain;
