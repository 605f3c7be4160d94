package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.JobStatus;
import com.umitunal.stepflow.model.WorkflowRunStatus;

public final class AddJobResult {
    private final JobStatus stepStatus;
    private final WorkflowRunStatus workflowStatus;

    public AddJobResult(JobStatus stepStatus, WorkflowRunStatus workflowStatus) {
        this.stepStatus = stepStatus;
        this.workflowStatus = workflowStatus;
    }

    public static AddJobResult queued() {
        return new AddJobResult(JobStatus.QUEUED, WorkflowRunStatus.PROCESSING);
    }

    public static AddJobResult skipped() {
        return new AddJobResult(JobStatus.SKIPPED, WorkflowRunStatus.PROCESSING);
    }

    public JobStatus getStepStatus() { return stepStatus; }
    public WorkflowRunStatus getWorkflowStatus() { return workflowStatus; }

    public boolean isSkipped() {
        return stepStatus == JobStatus.SKIPPED;
    }
}
