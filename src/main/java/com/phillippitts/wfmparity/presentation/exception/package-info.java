/**
 * Maps application exceptions to HTTP responses with a uniform error body.
 */
package com.phillippitts.wfmparity.presentation.exception;
