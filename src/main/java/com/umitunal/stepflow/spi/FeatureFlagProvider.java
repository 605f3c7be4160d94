package com.umitunal.stepflow.spi;

public interface FeatureFlagProvider {

    /**
     * Whether subscriber schedules gate step delivery at all.
     */
    boolean isSubscriberScheduleEnabled(String organizationId, String environmentId) throws Exception;
}
