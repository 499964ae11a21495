/**
 * Circuit breaker seam for outbound telemetry.
 *
 * <p>{@link com.phillippitts.edgekeeper.service.resilience.CircuitBreakerGate} is the only type
 * the telemetry client depends on; the Resilience4j adapter is wired in configuration.
 */
package com.phillippitts.edgekeeper.service.resilience;
