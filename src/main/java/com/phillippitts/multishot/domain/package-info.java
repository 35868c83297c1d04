/**
 * Immutable domain model shared by the runner, the engines and the result sinks.
 *
 * <p>All types are Java records. Requests are created by callers, responses by engines (or by
 * the runner for timeouts), and run results by the runner once per run.
 */
package com.phillippitts.multishot.domain;
