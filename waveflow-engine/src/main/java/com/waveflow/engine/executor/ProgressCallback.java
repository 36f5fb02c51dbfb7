package com.waveflow.engine.executor;

import com.waveflow.core.model.StepResult;

/**
 * Receives each step result once the step reaches COMPLETED, FAILED or SKIPPED.
 * Called synchronously on the thread that produced the result; exceptions are
 * logged and ignored by the executor.
 */
@FunctionalInterface
public interface ProgressCallback {

    void onProgress(String stepId, StepResult result);
}
