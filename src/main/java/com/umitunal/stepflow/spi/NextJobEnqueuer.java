package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;

/**
 * Hands the next job of a chain to the queue, after evaluating its step conditions.
 */
@FunctionalInterface
public interface NextJobEnqueuer {

    AddJobResult add(Job job) throws Exception;
}
