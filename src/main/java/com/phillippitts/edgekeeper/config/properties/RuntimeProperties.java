package com.phillippitts.edgekeeper.config.properties;

import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Properties for the runtime glue (startup wiring and periodic heartbeat events).
 */
@ConfigurationProperties(prefix = "edge.runtime")
@Validated
public class RuntimeProperties {

    /** When false, engines are created but nothing is started automatically. */
    private boolean enabled = true;

    /** Interval of the heartbeat telemetry event. */
    @NotNull
    private Duration heartbeatInterval = Duration.ofSeconds(60);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    public void setHeartbeatInterval(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }
}
