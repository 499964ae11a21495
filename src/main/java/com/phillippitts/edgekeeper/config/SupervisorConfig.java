package com.phillippitts.edgekeeper.config;

import com.phillippitts.edgekeeper.config.properties.SupervisorProperties;
import com.phillippitts.edgekeeper.service.metrics.RuntimeMetrics;
import com.phillippitts.edgekeeper.service.supervisor.DefaultProcessFactory;
import com.phillippitts.edgekeeper.service.supervisor.KillCommandSignaller;
import com.phillippitts.edgekeeper.service.supervisor.ProcessFactory;
import com.phillippitts.edgekeeper.service.supervisor.ProcessSignaller;
import com.phillippitts.edgekeeper.service.supervisor.WorkerSupervisor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the worker supervisor and its OS seams.
 */
@Configuration
public class SupervisorConfig {

    @Bean
    public ProcessFactory processFactory() {
        return new DefaultProcessFactory();
    }

    @Bean
    public ProcessSignaller processSignaller() {
        return new KillCommandSignaller();
    }

    /**
     * Workers are stopped by the runtime lifecycle; the destroy method covers contexts where the
     * runtime never started.
     */
    @Bean(destroyMethod = "stopAll")
    public WorkerSupervisor workerSupervisor(SupervisorProperties props,
                                             ProcessFactory processFactory,
                                             ProcessSignaller processSignaller,
                                             RuntimeMetrics metrics,
                                             ApplicationEventPublisher publisher) {
        return new WorkerSupervisor(props, processFactory, processSignaller, metrics, publisher);
    }
}
