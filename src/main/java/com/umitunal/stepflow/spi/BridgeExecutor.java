package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

@FunctionalInterface
public interface BridgeExecutor {

    /**
     * @return the step outputs, or null if the bridge returned nothing
     */
    BridgeResponse execute(Job job) throws Exception;
}
