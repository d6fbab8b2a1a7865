/**
 * Maps {@link com.phillippitts.querybridge.exception.ErrorKind} to HTTP status codes.
 */
package com.phillippitts.querybridge.presentation.exception;
