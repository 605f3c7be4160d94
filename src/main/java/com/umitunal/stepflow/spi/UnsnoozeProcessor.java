package com.umitunal.stepflow.spi;

/**
 * Completes a snoozed in-app message. Owns its own continuation of the chain.
 */
@FunctionalInterface
public interface UnsnoozeProcessor {

    void process(String jobId, String environmentId, String organizationId) throws Exception;
}
