package com.umitunal.stepflow.queue;

import com.umitunal.stepflow.error.JobNotFoundException;
import com.umitunal.stepflow.runner.JobRunner;
import com.umitunal.stepflow.runner.RunJobCommand;

/**
 * Runs queued {@link RunJobCommand}s through a {@link JobRunner}.
 *
 * A job that no longer exists is discarded. Any other failure propagates so
 * the worker rejects the work and the queue retries it.
 */
public class RunJobProcessor implements WorkProcessor<RunJobCommand> {
    private final JobRunner runner;

    public RunJobProcessor(JobRunner runner) {
        this.runner = runner;
    }

    @Override
    public ProcessingResult process(QueuedWork<RunJobCommand> work) throws Exception {
        try {
            runner.execute(work.getPayload());
            return ProcessingResult.success();
        } catch (JobNotFoundException e) {
            return ProcessingResult.discard(e.getMessage());
        }
    }
}
