/**
 * REST boundary: controllers, request and response bodies, and the exception-to-HTTP mapping.
 *
 * <p>All JSON field names are snake_case.
 */
package com.phillippitts.wfmparity.presentation;
