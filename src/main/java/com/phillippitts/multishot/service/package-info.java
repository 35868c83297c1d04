/**
 * Service layer: engines, the runner, metrics, output and events.
 *
 * <p>Service Sub-packages:
 * <ul>
 *   <li>{@code service.engine} - Engine contract, variants and factory</li>
 *   <li>{@code service.runner} - Concurrency gate, prompt runner and the Spring-facing service</li>
 *   <li>{@code service.metrics} - Cost/quality derivation, performance tracking, Micrometer meters</li>
 *   <li>{@code service.output} - Result sinks</li>
 *   <li>{@code service.events} - Application event listeners</li>
 *   <li>{@code service.health} - Actuator health indicators</li>
 * </ul>
 *
 * <p>Design Principles:
 * <ul>
 *   <li>Services depend on domain models, not presentation layer</li>
 *   <li>Services throw domain exceptions (not HTTP exceptions)</li>
 *   <li>Services use constructor injection (not field injection)</li>
 * </ul>
 */
package com.phillippitts.multishot.service;
