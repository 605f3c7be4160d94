package com.umitunal.stepflow.spi;

@FunctionalInterface
public interface WorkflowRunStatusUpdater {

    void updateDeliveryLifecycle(DeliveryLifecycleUpdate update) throws Exception;
}
