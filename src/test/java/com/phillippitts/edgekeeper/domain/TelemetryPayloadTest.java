package com.phillippitts.edgekeeper.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryPayloadTest {

    @Test
    void createAssignsUniqueIds() {
        TelemetryPayload a = TelemetryPayload.create("edge-001", Map.of("k", 1));
        TelemetryPayload b = TelemetryPayload.create("edge-001", Map.of("k", 1));

        assertThat(a.payloadId()).isNotEqualTo(b.payloadId());
        assertThat(a.deviceId()).isEqualTo("edge-001");
    }

    @Test
    void dataIsDefensivelyCopied() {
        Map<String, Object> data = new HashMap<>();
        data.put("k", 1);
        TelemetryPayload payload = new TelemetryPayload("d", Instant.EPOCH, data, "p");

        data.put("later", 2);

        assertThat(payload.data()).containsOnlyKeys("k");
        assertThatThrownBy(() -> payload.data().put("x", 3)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nullDataBecomesEmpty() {
        assertThat(new TelemetryPayload("d", Instant.EPOCH, null, "p").data()).isEmpty();
    }

    @Test
    void dataIsStoredInCanonicalJsonForm() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("small", 5L);
        data.put("big", 12345678901L);
        data.put("ratio", 0.5f);
        data.put("state", WorkerState.RUNNING);
        data.put("items", List.of((short) 1, 2.5));
        data.put("missing", null);

        Map<String, Object> canonical = new TelemetryPayload("d", Instant.EPOCH, data, "p").data();

        assertThat(canonical.get("small")).isInstanceOf(Integer.class).isEqualTo(5);
        assertThat(canonical.get("big")).isEqualTo(12345678901L);
        assertThat(canonical.get("ratio")).isEqualTo(0.5);
        assertThat(canonical.get("state")).isEqualTo("RUNNING");
        assertThat(canonical.get("items")).isEqualTo(List.of(1, 2.5));
        assertThat(canonical).containsEntry("missing", null);
    }
}
