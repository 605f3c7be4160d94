package com.umitunal.stepflow.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of a workflow instance, targeted at one subscriber.
 * Jobs of the same trigger share a transaction id and form a chain through
 * their parent ids.
 *
 * Instances are immutable snapshots; stores hand out fresh copies after
 * every write.
 */
public final class Job {
    private final String id;
    private final String environmentId;
    private final String organizationId;
    private final String userId;
    private final String transactionId;
    private final String notificationId;
    private final String templateId;
    private final String parentId;
    private final String identifier;
    private final String subscriberId;
    private final String externalSubscriberId;
    private final StepDefinition step;
    private final JobStatus status;
    private final Map<String, Object> payload;
    private final Map<String, Object> overrides;
    private final DigestMetadata digest;
    private final DelayMetadata delay;
    private final int scheduleExtensionsCount;
    private final List<String> attachments;
    private final String error;

    private Job(Builder builder) {
        this.id = builder.id;
        this.environmentId = builder.environmentId;
        this.organizationId = builder.organizationId;
        this.userId = builder.userId;
        this.transactionId = builder.transactionId;
        this.notificationId = builder.notificationId;
        this.templateId = builder.templateId;
        this.parentId = builder.parentId;
        this.identifier = builder.identifier;
        this.subscriberId = builder.subscriberId;
        this.externalSubscriberId = builder.externalSubscriberId;
        this.step = builder.step;
        this.status = builder.status;
        this.payload = Collections.unmodifiableMap(new LinkedHashMap<>(builder.payload));
        this.overrides = Collections.unmodifiableMap(new LinkedHashMap<>(builder.overrides));
        this.digest = builder.digest;
        this.delay = builder.delay;
        this.scheduleExtensionsCount = builder.scheduleExtensionsCount;
        this.attachments = List.copyOf(builder.attachments);
        this.error = builder.error;
    }

    public String getId() { return id; }
    public String getEnvironmentId() { return environmentId; }
    public String getOrganizationId() { return organizationId; }
    public String getUserId() { return userId; }
    public String getTransactionId() { return transactionId; }
    public String getNotificationId() { return notificationId; }
    public String getTemplateId() { return templateId; }
    public String getParentId() { return parentId; }
    public String getIdentifier() { return identifier; }

    /**
     * Internal subscriber id, used for lookups and bulk cancellation.
     */
    public String getSubscriberId() { return subscriberId; }

    /**
     * Subscriber id as the workflow trigger named it.
     */
    public String getExternalSubscriberId() { return externalSubscriberId; }

    public StepDefinition getStep() { return step; }
    public StepType getType() { return step.getType(); }
    public JobStatus getStatus() { return status; }
    public Map<String, Object> getPayload() { return payload; }
    public Map<String, Object> getOverrides() { return overrides; }
    public DigestMetadata getDigest() { return digest; }
    public DelayMetadata getDelay() { return delay; }
    public int getScheduleExtensionsCount() { return scheduleExtensionsCount; }
    public List<String> getAttachments() { return attachments; }
    public String getError() { return error; }

    public boolean shouldStopOnFail() {
        return step.shouldStopOnFail();
    }

    /**
     * Resolve a dotted path, such as {@code "user.id"}, against the payload.
     *
     * @return the value, or null if any segment is missing
     */
    public Object payloadValue(String path) {
        Object current = payload;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(segment);
        }
        return current;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static Builder newBuilder(String id, String environmentId, StepDefinition step) {
        return new Builder(id, environmentId, step);
    }

    @Override
    public String toString() {
        return String.format("Job{id='%s', type=%s, status=%s, transaction='%s', parent='%s', extensions=%d}",
                id, step.getType(), status, transactionId, parentId, scheduleExtensionsCount);
    }

    public static class Builder {
        private String id;
        private String environmentId;
        private String organizationId;
        private String userId;
        private String transactionId;
        private String notificationId;
        private String templateId;
        private String parentId;
        private String identifier;
        private String subscriberId;
        private String externalSubscriberId;
        private StepDefinition step;
        private JobStatus status = JobStatus.PENDING;
        private Map<String, Object> payload = new LinkedHashMap<>();
        private Map<String, Object> overrides = new LinkedHashMap<>();
        private DigestMetadata digest;
        private DelayMetadata delay;
        private int scheduleExtensionsCount;
        private List<String> attachments = List.of();
        private String error;

        private Builder(String id, String environmentId, StepDefinition step) {
            this.id = id;
            this.environmentId = environmentId;
            this.step = step;
        }

        private Builder(Job job) {
            this.id = job.id;
            this.environmentId = job.environmentId;
            this.organizationId = job.organizationId;
            this.userId = job.userId;
            this.transactionId = job.transactionId;
            this.notificationId = job.notificationId;
            this.templateId = job.templateId;
            this.parentId = job.parentId;
            this.identifier = job.identifier;
            this.subscriberId = job.subscriberId;
            this.externalSubscriberId = job.externalSubscriberId;
            this.step = job.step;
            this.status = job.status;
            this.payload = new LinkedHashMap<>(job.payload);
            this.overrides = new LinkedHashMap<>(job.overrides);
            this.digest = job.digest;
            this.delay = job.delay;
            this.scheduleExtensionsCount = job.scheduleExtensionsCount;
            this.attachments = job.attachments;
            this.error = job.error;
        }

        public Builder withOrganizationId(String organizationId) {
            this.organizationId = organizationId;
            return this;
        }

        public Builder withUserId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder withTransactionId(String transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        public Builder withNotificationId(String notificationId) {
            this.notificationId = notificationId;
            return this;
        }

        public Builder withTemplateId(String templateId) {
            this.templateId = templateId;
            return this;
        }

        public Builder withParentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder withIdentifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder withSubscriberId(String subscriberId) {
            this.subscriberId = subscriberId;
            return this;
        }

        public Builder withExternalSubscriberId(String externalSubscriberId) {
            this.externalSubscriberId = externalSubscriberId;
            return this;
        }

        public Builder withStatus(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder withPayload(Map<String, Object> payload) {
            this.payload = new LinkedHashMap<>(payload);
            return this;
        }

        public Builder withOverrides(Map<String, Object> overrides) {
            this.overrides = new LinkedHashMap<>(overrides);
            return this;
        }

        public Builder withDigest(DigestMetadata digest) {
            this.digest = digest;
            return this;
        }

        public Builder withDelay(DelayMetadata delay) {
            this.delay = delay;
            return this;
        }

        public Builder withScheduleExtensionsCount(int count) {
            this.scheduleExtensionsCount = count;
            return this;
        }

        public Builder withAttachments(List<String> attachments) {
            this.attachments = List.copyOf(attachments);
            return this;
        }

        public Builder withError(String error) {
            this.error = error;
            return this;
        }

        public Job build() {
            if (id == null || environmentId == null || step == null) {
                throw new IllegalStateException("Job requires id, environmentId and step");
            }
            return new Job(this);
        }
    }
}
