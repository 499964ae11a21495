package com.phillippitts.edgekeeper.service.telemetry;

import com.phillippitts.edgekeeper.domain.TelemetryPayload;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Default transport: logs the payload instead of sending it. Always succeeds.
 */
public class LoggingTransport implements TelemetryTransport {

    private static final Logger LOG = LogManager.getLogger(LoggingTransport.class);

    private final String endpoint;

    public LoggingTransport(String endpoint) {
        this.endpoint = endpoint;
    }

    @Override
    public boolean send(TelemetryPayload payload) {
        LOG.info("Sending telemetry to {}: device={} payload_id={}",
                endpoint, payload.deviceId(), payload.payloadId());
        return true;
    }
}
