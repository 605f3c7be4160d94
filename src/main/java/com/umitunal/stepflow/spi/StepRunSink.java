package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

/**
 * Append-only audit log of step runs.
 */
public interface StepRunSink {

    void create(Job job, StepRun run) throws Exception;
}
