package com.umitunal.stepflow.serialization;

import com.umitunal.stepflow.error.StepflowException;

/**
 * Raised when a payload cannot be encoded or decoded.
 */
public class CodecException extends StepflowException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
