package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

/**
 * Re-dispatches a job so that it runs again after a delay.
 */
@FunctionalInterface
public interface DelayedJobQueue {

    void queueJob(Job job, long delayMs) throws Exception;
}
