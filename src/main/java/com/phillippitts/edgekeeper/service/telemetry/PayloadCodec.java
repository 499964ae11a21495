package com.phillippitts.edgekeeper.service.telemetry;

import com.phillippitts.edgekeeper.domain.TelemetryPayload;
import com.phillippitts.edgekeeper.exception.PayloadCodecException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONString;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON wire/storage format of {@link TelemetryPayload}.
 *
 * <p>Format:
 * <pre>
 * {"device_id": "edge-001", "timestamp": "2024-05-01T10:15:30.123Z",
 *  "data": {...}, "payload_id": "6f1c..."}
 * </pre>
 *
 * <p>Null values are written as JSON {@code null} and doubles always carry a decimal point or
 * exponent. Decoded numbers are normalized to {@link Integer}, {@link Long} or {@link Double};
 * nested objects become {@link Map}s and arrays become {@link List}s. Together with the canonical
 * form of {@link TelemetryPayload#data()}, decoding an encoded payload yields an equal payload.
 */
public final class PayloadCodec {

    static final String DEVICE_ID = "device_id";
    static final String TIMESTAMP = "timestamp";
    static final String DATA = "data";
    static final String PAYLOAD_ID = "payload_id";

    private PayloadCodec() {
    }

    public static String encode(TelemetryPayload payload) {
        JSONObject json = new JSONObject();
        json.put(DEVICE_ID, payload.deviceId());
        json.put(TIMESTAMP, payload.timestamp().toString());
        json.put(DATA, toJson(payload.data()));
        json.put(PAYLOAD_ID, payload.payloadId());
        return json.toString();
    }

    private static JSONObject toJson(Map<?, ?> map) {
        JSONObject json = new JSONObject();
        map.forEach((key, value) -> json.put(String.valueOf(key), toJsonValue(value)));
        return json;
    }

    private static Object toJsonValue(Object value) {
        if (value == null) {
            return JSONObject.NULL;
        }
        if (value instanceof Map<?, ?> map) {
            return toJson(map);
        }
        if (value instanceof List<?> list) {
            JSONArray array = new JSONArray();
            list.forEach(item -> array.put(toJsonValue(item)));
            return array;
        }
        if (value instanceof Double d) {
            return new DecimalLiteral(d);
        }
        return value;
    }

    /**
     * Writes a double with its decimal point ({@code 80.0}, not {@code 80}) so it decodes back
     * to a {@link Double}.
     */
    private record DecimalLiteral(double value) implements JSONString {

        @Override
        public String toJSONString() {
            return Double.isFinite(value) ? Double.toString(value) : "null";
        }
    }

    /**
     * Parses a stored payload.
     *
     * @throws PayloadCodecException if the text is not a JSON object with the payload fields
     */
    public static TelemetryPayload decode(String text) {
        JSONObject json = parseObject(text);
        return fromJson(json);
    }

    /**
     * Parses text that must be a JSON object.
     *
     * @throws PayloadCodecException if the text is not a JSON object
     */
    public static JSONObject parseObject(String text) {
        if (text == null || text.isBlank()) {
            throw new PayloadCodecException("Empty payload");
        }
        try {
            return new JSONObject(text);
        } catch (JSONException e) {
            throw new PayloadCodecException("Malformed payload JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Returns true if the object carries every payload field.
     */
    public static boolean looksLikePayload(JSONObject json) {
        return json.has(DEVICE_ID) && json.has(TIMESTAMP) && json.has(PAYLOAD_ID)
                && json.optJSONObject(DATA) != null;
    }

    static TelemetryPayload fromJson(JSONObject json) {
        try {
            String deviceId = json.getString(DEVICE_ID);
            Instant timestamp = Instant.parse(json.getString(TIMESTAMP));
            String payloadId = json.getString(PAYLOAD_ID);
            Map<String, Object> data = toMap(json.getJSONObject(DATA));
            return new TelemetryPayload(deviceId, timestamp, data, payloadId);
        } catch (JSONException | DateTimeParseException e) {
            throw new PayloadCodecException("Invalid payload: " + e.getMessage(), e);
        }
    }

    /**
     * Converts a JSON object into plain Java collections with normalized numbers.
     */
    public static Map<String, Object> toMap(JSONObject json) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (String key : json.keySet()) {
            out.put(key, normalize(json.opt(key)));
        }
        return out;
    }

    private static Object normalize(Object value) {
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (value instanceof JSONObject obj) {
            return toMap(obj);
        }
        if (value instanceof JSONArray array) {
            List<Object> list = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                list.add(normalize(array.opt(i)));
            }
            return list;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 64 ? (Object) big.longValue() : big.doubleValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }
}
