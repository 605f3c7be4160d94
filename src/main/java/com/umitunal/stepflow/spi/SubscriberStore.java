package com.umitunal.stepflow.spi;

public interface SubscriberStore {

    /**
     * @return the subscriber's IANA timezone, or null if unknown
     */
    String findTimezone(String subscriberId, String environmentId, String organizationId) throws Exception;
}
