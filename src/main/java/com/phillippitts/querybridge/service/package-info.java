/**
 * Service layer: worker bridge, response cache, job queue and the orchestration facade on top.
 */
package com.phillippitts.querybridge.service;
