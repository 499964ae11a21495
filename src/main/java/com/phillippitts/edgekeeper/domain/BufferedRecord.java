package com.phillippitts.edgekeeper.domain;

import java.time.Instant;

/**
 * A payload persisted in the telemetry buffer.
 *
 * @param id row id inside the buffer (tie-breaker for equal creation times)
 * @param payloadJson serialized payload as stored
 * @param createdAt FIFO ordering key
 */
public record BufferedRecord(long id, String payloadJson, Instant createdAt) {
}
