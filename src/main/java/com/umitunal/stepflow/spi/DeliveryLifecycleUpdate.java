package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

/**
 * Request to recompute the delivery status of a workflow run from its step runs.
 */
public final class DeliveryLifecycleUpdate {
    private final String notificationId;
    private final String environmentId;
    private final String organizationId;
    private final String subscriberId;
    private final Throwable error;

    public DeliveryLifecycleUpdate(String notificationId, String environmentId, String organizationId,
                                   String subscriberId, Throwable error) {
        this.notificationId = notificationId;
        this.environmentId = environmentId;
        this.organizationId = organizationId;
        this.subscriberId = subscriberId;
        this.error = error;
    }

    public static DeliveryLifecycleUpdate forJob(Job job, Throwable error) {
        return new DeliveryLifecycleUpdate(job.getNotificationId(), job.getEnvironmentId(),
                job.getOrganizationId(), job.getSubscriberId(), error);
    }

    public String getNotificationId() { return notificationId; }
    public String getEnvironmentId() { return environmentId; }
    public String getOrganizationId() { return organizationId; }
    public String getSubscriberId() { return subscriberId; }

    /**
     * The error that halted the run, or null.
     */
    public Throwable getError() { return error; }
}
