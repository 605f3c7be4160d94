package com.umitunal.stepflow.model;

/**
 * Overall delivery state of a workflow run, as reported by the next-job enqueuer.
 */
public enum WorkflowRunStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    ERROR
}
