package com.umitunal.stepflow.spi;

/**
 * Delivers a step through its channel. Throwing is reserved for unexpected
 * errors; expected outcomes come back as a {@link SendResult}.
 * Transient errors that should wait for a retry must be raised as a
 * {@link com.umitunal.stepflow.error.StepExecutionException} of kind BACKOFF.
 */
@FunctionalInterface
public interface MessageSender {

    SendResult send(SendMessageCommand command) throws Exception;
}
