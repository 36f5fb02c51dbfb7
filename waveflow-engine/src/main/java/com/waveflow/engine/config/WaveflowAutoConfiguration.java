package com.waveflow.engine.config;

import com.waveflow.core.event.WorkflowEventBus;
import com.waveflow.core.repository.CheckpointRepository;
import com.waveflow.engine.event.InMemoryWorkflowEventBus;
import com.waveflow.engine.executor.WorkflowExecutor;
import com.waveflow.engine.json.WorkflowJson;
import com.waveflow.engine.metrics.ExecutorMetrics;
import com.waveflow.engine.persistence.InMemoryCheckpointRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the workflow executor and its collaborators.
 * Every bean backs off when the application defines its own.
 */
@AutoConfiguration
@EnableConfigurationProperties(ExecutorProperties.class)
public class WaveflowAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(WaveflowAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CheckpointRepository checkpointRepository() {
        return new InMemoryCheckpointRepository();
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowEventBus workflowEventBus() {
        return new InMemoryWorkflowEventBus();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutorMetrics executorMetrics(ObjectProvider<MeterRegistry> meterRegistry) {
        ExecutorMetrics metrics = new ExecutorMetrics();
        MeterRegistry registry = meterRegistry.getIfAvailable(() -> {
            log.debug("No MeterRegistry in context, recording executor metrics in a SimpleMeterRegistry");
            return new SimpleMeterRegistry();
        });
        metrics.bindTo(registry);
        return metrics;
    }

    @Bean
    @ConditionalOnMissingBean
    public WorkflowJson workflowJson() {
        return new WorkflowJson();
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public WorkflowExecutor workflowExecutor(
            ExecutorProperties properties,
            CheckpointRepository checkpointRepository,
            WorkflowEventBus workflowEventBus,
            ExecutorMetrics executorMetrics) {
        log.info("Creating workflow executor: maxWorkers={}, autoCheckpoint={}, stopOnFailure={}, validateGraph={}",
            properties.maxWorkers(), properties.autoCheckpoint(), properties.stopOnFailure(), properties.validateGraph());
        return new WorkflowExecutor(properties, checkpointRepository, workflowEventBus, executorMetrics);
    }
}
