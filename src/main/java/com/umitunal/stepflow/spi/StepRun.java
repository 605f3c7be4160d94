package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.JobStatus;

/**
 * One audit entry of a step execution attempt.
 */
public final class StepRun {
    public static final String SEND_MESSAGE_FAILED = "send_message_failed";
    public static final String EXECUTION_ERROR = "execution_error";

    private final JobStatus status;
    private final String errorCode;
    private final String errorMessage;

    private StepRun(JobStatus status, String errorCode, String errorMessage) {
        this.status = status;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public static StepRun of(JobStatus status) {
        return new StepRun(status, null, null);
    }

    public static StepRun failed(String errorCode, String errorMessage) {
        return new StepRun(JobStatus.FAILED, errorCode, errorMessage);
    }

    public JobStatus getStatus() { return status; }
    public String getErrorCode() { return errorCode; }
    public String getErrorMessage() { return errorMessage; }

    @Override
    public String toString() {
        return errorCode == null
                ? "StepRun{" + status + "}"
                : "StepRun{" + status + ", " + errorCode + ": " + errorMessage + "}";
    }
}
