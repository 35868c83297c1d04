/**
 * Engine abstraction.
 *
 * <p>{@link com.phillippitts.multishot.service.engine.Engine} is the contract the runner
 * dispatches against. {@link com.phillippitts.multishot.service.engine.AbstractEngine} holds the
 * common execution pipeline; the variants in {@code remote}, {@code local} and {@code custom}
 * add readiness checks and limits. Network calls go through a
 * {@link com.phillippitts.multishot.service.engine.CompletionTransport} registered per variant.
 */
package com.phillippitts.multishot.service.engine;
