package com.waveflow.engine.executor;

import com.waveflow.core.model.StepDefinition;
import com.waveflow.core.model.StepResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Runs a group of steps on a fixed-size worker pool and waits for all of them.
 */
class ParallelStepRunner {

    private static final Logger log = LoggerFactory.getLogger(ParallelStepRunner.class);

    private final ExecutorService pool;
    private final int maxWorkers;

    ParallelStepRunner(int maxWorkers) {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("Max workers must be >= 1");
        }
        this.maxWorkers = maxWorkers;
        this.pool = Executors.newFixedThreadPool(maxWorkers, new WorkerThreadFactory());
    }

    int maxWorkers() {
        return maxWorkers;
    }

    /**
     * Run every step and return the results in the order of {@code steps}.
     *
     * @param task Runs one step; expected to return a result rather than throw
     * @param onError Builds the result for a step whose task threw anyway
     */
    List<StepResult> runAll(
            List<StepDefinition> steps,
            Function<StepDefinition, StepResult> task,
            BiFunction<StepDefinition, Throwable, StepResult> onError) {
        List<CompletableFuture<StepResult>> futures = new ArrayList<>(steps.size());
        for (StepDefinition step : steps) {
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(step), pool));
        }

        List<StepResult> results = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            StepDefinition step = steps.get(i);
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Parallel step error for {}: {}", step.stepId(), cause.getMessage());
                results.add(onError.apply(step, cause));
            }
        }
        return results;
    }

    boolean isShutdown() {
        return pool.isShutdown();
    }

    /**
     * Stop accepting work and wait for running steps, up to the timeout.
     */
    void shutdown(Duration timeout) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Worker pool did not terminate within {} ms, interrupting workers", timeout.toMillis());
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "waveflow-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
