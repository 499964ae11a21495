package com.phillippitts.edgekeeper.domain;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable unit of telemetry.
 *
 * <p>{@code data} is copied into a canonical JSON-compatible form so a payload read back from
 * the buffer equals the one that was stored:
 * <ul>
 *   <li>integral numbers become {@link Integer} when they fit, otherwise {@link Long}
 *       (or {@link Double} beyond 64 bits)</li>
 *   <li>floating point and decimal numbers become {@link Double}; NaN and infinities become null</li>
 *   <li>maps become unmodifiable maps with string keys, collections and arrays unmodifiable lists</li>
 *   <li>other values become their string form</li>
 * </ul>
 * Null values are kept.
 *
 * @param deviceId identifier of the edge device
 * @param timestamp creation time
 * @param data structured telemetry content (unmodifiable, canonical)
 * @param payloadId unique id used by the collector for de-duplication
 */
public record TelemetryPayload(String deviceId, Instant timestamp, Map<String, Object> data, String payloadId) {

    public TelemetryPayload {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(payloadId, "payloadId");
        data = data == null ? Map.of() : canonicalMap(data);
    }

    /**
     * Creates a payload stamped with the current time and a random id.
     */
    public static TelemetryPayload create(String deviceId, Map<String, Object> data) {
        return new TelemetryPayload(deviceId, Instant.now(), data, UUID.randomUUID().toString());
    }

    private static Map<String, Object> canonicalMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), canonical(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object canonical(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Number number) {
            return canonicalNumber(number);
        }
        if (value instanceof Map<?, ?> map) {
            return canonicalMap(map);
        }
        if (value instanceof Collection<?> items) {
            List<Object> list = new ArrayList<>(items.size());
            items.forEach(item -> list.add(canonical(item)));
            return Collections.unmodifiableList(list);
        }
        if (value instanceof Object[] array) {
            List<Object> list = new ArrayList<>(array.length);
            for (Object item : array) {
                list.add(canonical(item));
            }
            return Collections.unmodifiableList(list);
        }
        if (value instanceof Enum<?> constant) {
            return constant.name();
        }
        return value.toString();
    }

    private static Object canonicalNumber(Number number) {
        if (number instanceof Integer) {
            return number;
        }
        if (number instanceof Long || number instanceof Short || number instanceof Byte
                || number instanceof AtomicInteger || number instanceof AtomicLong) {
            long v = number.longValue();
            return v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE ? (Object) (int) v : (Object) v;
        }
        if (number instanceof BigInteger big) {
            if (big.bitLength() < 32) {
                return big.intValue();
            }
            return big.bitLength() < 64 ? (Object) big.longValue() : finiteOrNull(big.doubleValue());
        }
        if (number instanceof BigDecimal decimal) {
            return finiteOrNull(decimal.doubleValue());
        }
        return finiteOrNull(number.doubleValue());
    }

    private static Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
