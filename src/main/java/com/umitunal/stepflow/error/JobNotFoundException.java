package com.umitunal.stepflow.error;

/**
 * The referenced job does not exist. Not retryable.
 */
public class JobNotFoundException extends StepflowException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job with id " + jobId + " not found");
        this.jobId = jobId;
    }

    public String getJobId() { return jobId; }
}
