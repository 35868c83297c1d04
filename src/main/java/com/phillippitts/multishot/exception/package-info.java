/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.multishot.exception.MultiShotException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.multishot.exception.EngineExecutionException} - Thrown by
 *       completion transports; engines turn it into an error response</li>
 *   <li>{@link com.phillippitts.multishot.exception.EngineConfigurationException} - Thrown when
 *       an engine definition is unusable</li>
 *   <li>{@link com.phillippitts.multishot.exception.GateTimeoutException} - Thrown when a
 *       bounded permit wait expires</li>
 *   <li>{@link com.phillippitts.multishot.exception.RunAbortedException} - Thrown when a
 *       fail-fast run stops on the first terminal engine failure</li>
 *   <li>{@link com.phillippitts.multishot.exception.ResultSinkException} - Thrown when run
 *       output cannot be written</li>
 *   <li>{@link com.phillippitts.multishot.exception.InvalidPromptException} - Thrown when a run
 *       request is rejected up front</li>
 * </ul>
 *
 * <p>Per-engine failures never propagate as exceptions out of a dispatch; they are normalized
 * into {@code EngineResponse.error}. Only the run-level exceptions above reach callers, and
 * {@code GlobalExceptionHandler} maps them to HTTP status codes.
 *
 * @see com.phillippitts.multishot.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.multishot.exception;
