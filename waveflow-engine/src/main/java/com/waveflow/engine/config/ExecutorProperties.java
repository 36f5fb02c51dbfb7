package com.waveflow.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Executor settings, bound from {@code waveflow.executor.*}.
 *
 * @param maxWorkers Size of the worker pool for parallel steps
 * @param autoCheckpoint Take a checkpoint after every wave that was not aborted
 * @param stopOnFailure Skip all remaining work after the first failed step
 * @param validateGraph Reject unknown dependencies and cycles before running
 * @param shutdownTimeout How long shutdown waits for running steps
 */
@ConfigurationProperties(prefix = "waveflow.executor")
public record ExecutorProperties(
    @DefaultValue("4") int maxWorkers,
    @DefaultValue("true") boolean autoCheckpoint,
    @DefaultValue("true") boolean stopOnFailure,
    @DefaultValue("true") boolean validateGraph,
    @DefaultValue("30s") Duration shutdownTimeout
) {
    public ExecutorProperties {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("waveflow.executor.max-workers must be >= 1");
        }
        shutdownTimeout = shutdownTimeout != null ? shutdownTimeout : Duration.ofSeconds(30);
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("waveflow.executor.shutdown-timeout must not be negative");
        }
    }

    public static ExecutorProperties defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int maxWorkers = 4;
        private boolean autoCheckpoint = true;
        private boolean stopOnFailure = true;
        private boolean validateGraph = true;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder autoCheckpoint(boolean autoCheckpoint) {
            this.autoCheckpoint = autoCheckpoint;
            return this;
        }

        public Builder stopOnFailure(boolean stopOnFailure) {
            this.stopOnFailure = stopOnFailure;
            return this;
        }

        public Builder validateGraph(boolean validateGraph) {
            this.validateGraph = validateGraph;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public ExecutorProperties build() {
            return new ExecutorProperties(maxWorkers, autoCheckpoint, stopOnFailure, validateGraph, shutdownTimeout);
        }
    }
}
