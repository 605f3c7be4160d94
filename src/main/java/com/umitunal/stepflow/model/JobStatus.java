package com.umitunal.stepflow.model;

/**
 * Lifecycle states of a workflow step job.
 */
public enum JobStatus {
    PENDING,     // Created, waiting to be queued
    QUEUED,      // Handed to the queue, not yet picked up
    RUNNING,     // Being executed
    DELAYED,     // Waiting for a delay, digest window or subscriber schedule
    COMPLETED,   // Delivered
    FAILED,      // Failed permanently
    CANCELED,    // Canceled or skipped outside the subscriber schedule
    SKIPPED;     // Skipped by step conditions

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELED || this == SKIPPED;
    }
}
