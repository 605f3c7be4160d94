package com.umitunal.stepflow.runner;

import com.umitunal.stepflow.error.FailureKind;
import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.model.JobStatus;
import com.umitunal.stepflow.model.WorkflowRunStatus;
import com.umitunal.stepflow.spi.AddJobResult;
import com.umitunal.stepflow.spi.AttachmentStorage;
import com.umitunal.stepflow.spi.DeliveryLifecycleUpdate;
import com.umitunal.stepflow.spi.ExecutionDetailSink;
import com.umitunal.stepflow.spi.JobFailureRecorder;
import com.umitunal.stepflow.spi.JobStore;
import com.umitunal.stepflow.spi.NextJobEnqueuer;
import com.umitunal.stepflow.spi.PendingJobsFilter;
import com.umitunal.stepflow.spi.StepRun;
import com.umitunal.stepflow.spi.StepRunSink;
import com.umitunal.stepflow.spi.WorkflowRunStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a transaction's chain forward from a finished job and queues the
 * next one. Jobs skipped by their conditions are stepped over, so one call
 * may visit several jobs, but at most one job is ever handed off.
 *
 * Loop invariant: {@code current} is the last job whose outcome is settled;
 * the loop ends as soon as the state is no longer CONTINUE.
 */
class ChainAdvancer {
    private static final Logger log = LoggerFactory.getLogger(ChainAdvancer.class);

    /**
     * How a walk along the chain ended.
     */
    enum Outcome {
        END_OF_CHAIN,     // No job follows, workflow run finalized
        HANDED_OFF,       // Next job queued
        HALTED,           // Queueing failed and the chain stops
        LOOKUP_FAILED     // Next job could not be looked up, workflow run finalized
    }

    private enum State {
        CONTINUE,
        STOP
    }

    private final JobStore jobStore;
    private final NextJobEnqueuer enqueuer;
    private final StepRunSink stepRuns;
    private final ExecutionDetailSink executionDetails;
    private final JobFailureRecorder failureRecorder;
    private final WorkflowRunStatusUpdater workflowRuns;
    private final AttachmentStorage attachments;
    private final ExecutionDetailFactory details;

    ChainAdvancer(JobStore jobStore, NextJobEnqueuer enqueuer, StepRunSink stepRuns,
                  ExecutionDetailSink executionDetails, JobFailureRecorder failureRecorder,
                  WorkflowRunStatusUpdater workflowRuns, AttachmentStorage attachments,
                  ExecutionDetailFactory details) {
        this.jobStore = jobStore;
        this.enqueuer = enqueuer;
        this.stepRuns = stepRuns;
        this.executionDetails = executionDetails;
        this.failureRecorder = failureRecorder;
        this.workflowRuns = workflowRuns;
        this.attachments = attachments;
        this.details = details;
    }

    Outcome advance(Job executed) throws Exception {
        Job current = executed;
        State state = State.CONTINUE;
        Outcome outcome = Outcome.HANDED_OFF;

        while (state == State.CONTINUE) {
            Job next;
            try {
                next = jobStore.findByParent(current.getEnvironmentId(), current.getId());
            } catch (Exception e) {
                log.warn("Looking up the job after {} failed", current.getId(), e);
                finalizeRun(current, null);
                return Outcome.LOOKUP_FAILED;
            }

            if (next == null) {
                finalizeRun(current, null);
                return Outcome.END_OF_CHAIN;
            }

            try {
                state = handOff(next);
                outcome = Outcome.HANDED_OFF;
            } catch (Exception e) {
                state = recoverFromQueueFailure(next, e);
                outcome = state == State.STOP ? Outcome.HALTED : outcome;
            } finally {
                releaseAttachments(next);
            }

            // A failed job without halt or backoff is stepped over like a skipped one
            current = next;
        }

        return outcome;
    }

    private State handOff(Job next) throws Exception {
        AddJobResult result = enqueuer.add(next);
        State state = State.STOP;

        if (result.isSkipped()) {
            jobStore.markSkipped(next.getEnvironmentId(), next.getOrganizationId(), next.getId());
            stepRuns.create(next, StepRun.of(JobStatus.SKIPPED));
            executionDetails.record(details.skippedByConditions(next));
            log.debug("Job {} ({}) skipped by its conditions", next.getId(), next.getType());
            state = State.CONTINUE;
        } else {
            log.debug("Job {} ({}) handed off", next.getId(), next.getType());
        }

        if (result.getWorkflowStatus() == WorkflowRunStatus.COMPLETED) {
            finalizeRun(next, null);
        }
        return state;
    }

    private State recoverFromQueueFailure(Job next, Exception error) throws Exception {
        failureRecorder.markFailed(next, error);

        boolean backoff = FailureKind.of(error) == FailureKind.BACKOFF;
        boolean halt = next.shouldStopOnFail();

        if (halt && !backoff) {
            finalizeRun(next, error);
            jobStore.cancelPendingJobs(PendingJobsFilter.siblingsOf(next));
        }

        if (halt || backoff) {
            log.warn("Queueing job {} ({}) failed, chain stopped: {}", next.getId(), next.getType(), error.getMessage());
            return State.STOP;
        }

        log.warn("Queueing job {} ({}) failed, continuing past it: {}", next.getId(), next.getType(), error.getMessage());
        return State.CONTINUE;
    }

    private void finalizeRun(Job job, Throwable error) throws Exception {
        workflowRuns.updateDeliveryLifecycle(DeliveryLifecycleUpdate.forJob(job, error));
    }

    private void releaseAttachments(Job job) {
        try {
            attachments.deleteAttachments(job.getAttachments());
        } catch (Exception e) {
            log.warn("Failed to release attachments of job {}", job.getId(), e);
        }
    }
}
