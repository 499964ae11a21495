package com.phillippitts.edgekeeper.config.properties;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    private static List<String> invalidPaths(Object props) {
        Set<ConstraintViolation<Object>> violations = validator.validate(props);
        return violations.stream().map(v -> v.getPropertyPath().toString()).toList();
    }

    @Test
    void defaultsAreValid() {
        assertThat(invalidPaths(new SupervisorProperties())).isEmpty();
        assertThat(invalidPaths(new HealthProperties())).isEmpty();
        assertThat(invalidPaths(new TelemetryProperties())).isEmpty();
        assertThat(invalidPaths(new RuntimeProperties())).isEmpty();
    }

    @Test
    void healthDefaultsMatchDocumentedValues() {
        HealthProperties props = new HealthProperties();

        assertThat(props.isEnabled()).isTrue();
        assertThat(props.getInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.getTempThreshold()).isEqualTo(75.0);
        assertThat(props.getCpuThreshold()).isEqualTo(95.0);
        assertThat(props.getMemoryThreshold()).isEqualTo(90.0);
        assertThat(props.getDiskPath()).isEqualTo(Path.of("/"));
    }

    @Test
    void rejectsOutOfRangeHealthThresholds() {
        HealthProperties props = new HealthProperties(true, Duration.ofSeconds(1), 0.0, 120.0, 90.0, Path.of("/"));

        assertThat(invalidPaths(props)).containsExactlyInAnyOrder("tempThreshold", "cpuThreshold");
    }

    @Test
    void rejectsNonPositiveTelemetrySizes() {
        TelemetryProperties props = new TelemetryProperties();
        props.setMaxBufferRows(0);
        props.setFlushBatchSize(-1);
        props.getCircuit().setFailureThreshold(0);

        assertThat(invalidPaths(props))
                .containsExactlyInAnyOrder("maxBufferRows", "flushBatchSize", "circuit.failureThreshold");
    }

    @Test
    void rejectsBlankDeviceId() {
        TelemetryProperties props = new TelemetryProperties();
        props.setDeviceId(" ");

        assertThat(invalidPaths(props)).containsExactly("deviceId");
    }

    @Test
    void validatesWorkerDefinitions() {
        SupervisorProperties.WorkerDefinition nameless = new SupervisorProperties.WorkerDefinition();
        nameless.setCommand(List.of("sleep", "1"));
        SupervisorProperties.WorkerDefinition commandless = new SupervisorProperties.WorkerDefinition();
        commandless.setName("empty");
        commandless.setMaxRestarts(-2);
        SupervisorProperties props = new SupervisorProperties();
        props.setWorkers(List.of(nameless, commandless));

        assertThat(invalidPaths(props)).containsExactlyInAnyOrder(
                "workers[0].name", "workers[1].command", "workers[1].maxRestarts");
    }
}
