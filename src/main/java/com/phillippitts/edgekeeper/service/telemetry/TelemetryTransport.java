package com.phillippitts.edgekeeper.service.telemetry;

import com.phillippitts.edgekeeper.domain.TelemetryPayload;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Pluggable delivery mechanism for telemetry payloads.
 *
 * <p>Returning {@code false} means the collector did not accept the payload and is treated
 * like a transient failure. {@link IOException}, {@link TimeoutException},
 * {@link java.io.UncheckedIOException} and
 * {@link com.phillippitts.edgekeeper.exception.TelemetryDeliveryException} are transient and
 * retried; any other exception aborts the send.
 */
@FunctionalInterface
public interface TelemetryTransport {

    boolean send(TelemetryPayload payload) throws IOException, TimeoutException;
}
