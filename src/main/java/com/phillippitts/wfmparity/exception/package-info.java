/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.wfmparity.exception.ParityException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.wfmparity.exception.InvalidJobInputException} - Submission
 *       rejected: required fields missing or of the wrong type (HTTP 400)</li>
 *   <li>{@link com.phillippitts.wfmparity.exception.CalculationException} - An engine could not
 *       produce a result; the job is retried with backoff</li>
 *   <li>{@link com.phillippitts.wfmparity.exception.ComparisonException} - Only one result exists;
 *       the job fails and an operator alert is raised</li>
 *   <li>{@link com.phillippitts.wfmparity.exception.DataQualityException} - Non-fatal; lowers
 *       confidence and is logged as a data-quality issue</li>
 *   <li>{@link com.phillippitts.wfmparity.exception.JobNotFoundException} - Unknown job id (HTTP 404)</li>
 *   <li>{@link com.phillippitts.wfmparity.exception.FailurePatternNotFoundException} - Unknown
 *       failure pattern id (HTTP 404)</li>
 *   <li>{@link com.phillippitts.wfmparity.exception.IllegalJobTransitionException} - Lifecycle
 *       guard tripped</li>
 * </ul>
 *
 * <p>Outliers and performance degradation are not exceptions; they are published as events.
 *
 * @see com.phillippitts.wfmparity.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.wfmparity.exception;
