/**
 * Submit-and-await facade used by the HTTP layer.
 */
package com.phillippitts.querybridge.service.orchestration;
