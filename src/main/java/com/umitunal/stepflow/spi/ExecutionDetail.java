package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

/**
 * A business-level note attached to a job's execution history.
 */
public final class ExecutionDetail {

    public enum Detail {
        SKIPPED_STEP_OUTSIDE_OF_THE_SCHEDULE,
        SKIPPED_STEP_BY_CONDITIONS,
        SKIPPED_STEP_MAX_EXTENSIONS_REACHED,
        STEP_EXTENDED_TO_SCHEDULE
    }

    public enum Status {
        SUCCESS,
        PENDING,
        FAILED
    }

    private final String jobId;
    private final String transactionId;
    private final String notificationId;
    private final String environmentId;
    private final String organizationId;
    private final String subscriberId;
    private final Detail detail;
    private final Status status;
    private final String raw;

    public ExecutionDetail(Job job, Detail detail, Status status, String raw) {
        this.jobId = job.getId();
        this.transactionId = job.getTransactionId();
        this.notificationId = job.getNotificationId();
        this.environmentId = job.getEnvironmentId();
        this.organizationId = job.getOrganizationId();
        this.subscriberId = job.getSubscriberId();
        this.detail = detail;
        this.status = status;
        this.raw = raw;
    }

    public String getJobId() { return jobId; }
    public String getTransactionId() { return transactionId; }
    public String getNotificationId() { return notificationId; }
    public String getEnvironmentId() { return environmentId; }
    public String getOrganizationId() { return organizationId; }
    public String getSubscriberId() { return subscriberId; }
    public Detail getDetail() { return detail; }
    public Status getStatus() { return status; }

    /**
     * JSON document with the inputs behind the detail, may be null.
     */
    public String getRaw() { return raw; }

    @Override
    public String toString() {
        return "ExecutionDetail{job='" + jobId + "', detail=" + detail + ", status=" + status + "}";
    }
}
