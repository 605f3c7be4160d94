package com.umitunal.stepflow.error;

/**
 * Base class for errors raised by the step runner.
 */
public class StepflowException extends RuntimeException {

    public StepflowException(String message) {
        super(message);
    }

    public StepflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
