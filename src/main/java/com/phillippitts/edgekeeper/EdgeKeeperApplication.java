package com.phillippitts.edgekeeper;

import com.phillippitts.edgekeeper.config.properties.HealthProperties;
import com.phillippitts.edgekeeper.config.properties.RuntimeProperties;
import com.phillippitts.edgekeeper.config.properties.SupervisorProperties;
import com.phillippitts.edgekeeper.config.properties.TelemetryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SupervisorProperties.class,
        HealthProperties.class,
        TelemetryProperties.class,
        RuntimeProperties.class
})
@EnableScheduling
public class EdgeKeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(EdgeKeeperApplication.class, args);
    }

}
