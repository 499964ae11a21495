/**
 * Runtime exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.edgekeeper.exception.EdgeKeeperException} - Base exception
 *       for all runtime errors</li>
 *   <li>{@link com.phillippitts.edgekeeper.exception.DuplicateWorkerException} - Thrown
 *       synchronously by worker registration when the name is taken</li>
 *   <li>{@link com.phillippitts.edgekeeper.exception.IllegalWorkerTransitionException} -
 *       Thrown by the worker state machine for edges it does not have</li>
 *   <li>{@link com.phillippitts.edgekeeper.exception.TelemetryDeliveryException} - Transient
 *       delivery failure, retried with backoff</li>
 *   <li>{@link com.phillippitts.edgekeeper.exception.CircuitOpenException} - Circuit breaker
 *       refused the attempt; the payload is buffered without retry</li>
 *   <li>{@link com.phillippitts.edgekeeper.exception.PayloadCodecException} - A persisted
 *       record could not be decoded</li>
 * </ul>
 *
 * <p>Background loops never let these escape their thread: they are logged and the loop
 * continues. The only caller-visible failures are duplicate registration and the boolean
 * result of a telemetry send.
 *
 * @since 1.0
 */
package com.phillippitts.edgekeeper.exception;
