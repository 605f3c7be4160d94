package com.umitunal.stepflow.spi;

/**
 * Criteria for a still-active digest job that can take over from a canceled one.
 * The store must only match DIGEST jobs in DELAYED status with no merge target.
 * When {@code digestKey} is set, the payload value at that dotted path must
 * equal {@code digestValue}.
 */
public final class DigestFollowerQuery {
    private final String environmentId;
    private final String organizationId;
    private final String subscriberId;
    private final String templateId;
    private final String digestKey;
    private final Object digestValue;

    public DigestFollowerQuery(String environmentId, String organizationId, String subscriberId,
                               String templateId, String digestKey, Object digestValue) {
        this.environmentId = environmentId;
        this.organizationId = organizationId;
        this.subscriberId = subscriberId;
        this.templateId = templateId;
        this.digestKey = digestKey;
        this.digestValue = digestValue;
    }

    public String getEnvironmentId() { return environmentId; }
    public String getOrganizationId() { return organizationId; }
    public String getSubscriberId() { return subscriberId; }
    public String getTemplateId() { return templateId; }
    public String getDigestKey() { return digestKey; }
    public Object getDigestValue() { return digestValue; }

    public boolean hasDigestKey() {
        return digestKey != null && digestValue != null;
    }
}
