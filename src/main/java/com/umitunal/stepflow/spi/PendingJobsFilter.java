package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

public final class PendingJobsFilter {
    private final String transactionId;
    private final String environmentId;
    private final String subscriberId;
    private final String templateId;

    public PendingJobsFilter(String transactionId, String environmentId, String subscriberId, String templateId) {
        this.transactionId = transactionId;
        this.environmentId = environmentId;
        this.subscriberId = subscriberId;
        this.templateId = templateId;
    }

    public static PendingJobsFilter siblingsOf(Job job) {
        return new PendingJobsFilter(job.getTransactionId(), job.getEnvironmentId(),
                job.getSubscriberId(), job.getTemplateId());
    }

    public String getTransactionId() { return transactionId; }
    public String getEnvironmentId() { return environmentId; }
    public String getSubscriberId() { return subscriberId; }
    public String getTemplateId() { return templateId; }
}
