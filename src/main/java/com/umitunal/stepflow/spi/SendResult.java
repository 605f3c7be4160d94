package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

/**
 * Outcome reported by a message sender.
 */
public final class SendResult {

    public enum Status {
        SUCCESS,
        FAILED,
        SKIPPED
    }

    private final Status status;
    private final Job job;
    private final String errorMessage;
    private final String deliveryLifecycleState;

    private SendResult(Status status, Job job, String errorMessage, String deliveryLifecycleState) {
        this.status = status;
        this.job = job;
        this.errorMessage = errorMessage;
        this.deliveryLifecycleState = deliveryLifecycleState;
    }

    public static SendResult success() {
        return new SendResult(Status.SUCCESS, null, null, null);
    }

    /**
     * Success where the sender changed the job, e.g. by merging a digest.
     */
    public static SendResult success(Job updatedJob) {
        return new SendResult(Status.SUCCESS, updatedJob, null, null);
    }

    public static SendResult failure(String errorMessage) {
        return new SendResult(Status.FAILED, null, errorMessage, null);
    }

    public static SendResult skipped(String deliveryLifecycleState) {
        return new SendResult(Status.SKIPPED, null, null, deliveryLifecycleState);
    }

    public Status getStatus() { return status; }

    /**
     * The job as updated during sending, or null if unchanged.
     */
    public Job getJob() { return job; }

    public String getErrorMessage() { return errorMessage; }
    public String getDeliveryLifecycleState() { return deliveryLifecycleState; }
}
