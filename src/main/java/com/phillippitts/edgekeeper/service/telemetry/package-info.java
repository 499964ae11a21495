/**
 * Store-and-forward telemetry.
 *
 * <p><b>Send path:</b>
 * <pre>
 * send(data) → TelemetryPayload → [circuit gate] → transport (retry, exponential backoff)
 *                                   │ open / exhausted
 *                                   ▼
 *                            TelemetryBuffer (SQLite, FIFO, count-bounded)
 *                                   │ flush loop, oldest first
 *                                   ▼
 *                           [circuit gate] → transport
 * </pre>
 *
 * <p>The transport is pluggable ({@link com.phillippitts.edgekeeper.service.telemetry.TelemetryTransport});
 * the default {@link com.phillippitts.edgekeeper.service.telemetry.LoggingTransport} only logs.
 */
package com.phillippitts.edgekeeper.service.telemetry;
