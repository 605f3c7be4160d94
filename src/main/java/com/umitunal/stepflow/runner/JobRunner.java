package com.umitunal.stepflow.runner;

import com.umitunal.stepflow.config.EngineConfig;
import com.umitunal.stepflow.error.FailureKind;
import com.umitunal.stepflow.error.JobNotFoundException;
import com.umitunal.stepflow.error.NotificationNotFoundException;
import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.model.JobStatus;
import com.umitunal.stepflow.model.Notification;
import com.umitunal.stepflow.model.StepType;
import com.umitunal.stepflow.spi.AttachmentStorage;
import com.umitunal.stepflow.spi.BridgeExecutor;
import com.umitunal.stepflow.spi.DelayedJobQueue;
import com.umitunal.stepflow.spi.DeliveryLifecycleUpdate;
import com.umitunal.stepflow.spi.ExecutionDetailSink;
import com.umitunal.stepflow.spi.FeatureFlagProvider;
import com.umitunal.stepflow.spi.JobFailureRecorder;
import com.umitunal.stepflow.spi.JobStore;
import com.umitunal.stepflow.spi.MessageSender;
import com.umitunal.stepflow.spi.NextJobEnqueuer;
import com.umitunal.stepflow.spi.NotificationStore;
import com.umitunal.stepflow.spi.PendingJobsFilter;
import com.umitunal.stepflow.spi.SendMessageCommand;
import com.umitunal.stepflow.spi.SendResult;
import com.umitunal.stepflow.spi.StepRun;
import com.umitunal.stepflow.spi.StepRunSink;
import com.umitunal.stepflow.spi.SubscriberScheduleProvider;
import com.umitunal.stepflow.spi.SubscriberStore;
import com.umitunal.stepflow.spi.UnsnoozeProcessor;
import com.umitunal.stepflow.spi.WorkflowRunStatusUpdater;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Objects;

/**
 * Executes one job of a workflow chain and then moves the chain forward.
 *
 * A single call runs the job through cancellation checks, the subscriber
 * schedule and message delivery, records the outcome, and either queues the
 * next job of the chain or, when the chain has to stop, finalizes the
 * workflow run. Calls for different jobs share no mutable state and may run
 * concurrently.
 */
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);

    static final String UNSNOOZE_MARKER = "unsnooze";

    /**
     * What happens to the chain once the job itself is done.
     */
    private enum Completion {
        ADVANCE,   // Queue the next job of the chain
        HALT,      // Finalize the workflow run and release attachments
        PARKED     // Someone else continues the chain later
    }

    private final JobStore jobStore;
    private final NotificationStore notificationStore;
    private final StepRunSink stepRuns;
    private final MessageSender messageSender;
    private final UnsnoozeProcessor unsnoozeProcessor;
    private final WorkflowRunStatusUpdater workflowRuns;
    private final AttachmentStorage attachments;
    private final DigestCancellationResolver cancellationResolver;
    private final ScheduleGate scheduleGate;
    private final ChainAdvancer chainAdvancer;

    private JobRunner(Builder builder) {
        this.jobStore = builder.jobStore;
        this.notificationStore = builder.notificationStore;
        this.stepRuns = builder.stepRuns;
        this.messageSender = builder.messageSender;
        this.unsnoozeProcessor = builder.unsnoozeProcessor;
        this.workflowRuns = builder.workflowRuns;
        this.attachments = builder.attachments;

        ExecutionDetailFactory details = new ExecutionDetailFactory();
        this.cancellationResolver = new DigestCancellationResolver(builder.jobStore);
        this.scheduleGate = new ScheduleGate(builder.jobStore, builder.stepRuns, builder.executionDetails,
                builder.featureFlags, builder.scheduleProvider, builder.subscriberStore,
                builder.bridgeExecutor, builder.delayedQueue, details, builder.config);
        this.chainAdvancer = new ChainAdvancer(builder.jobStore, builder.nextJobEnqueuer, builder.stepRuns,
                builder.executionDetails, builder.failureRecorder, builder.workflowRuns,
                builder.attachments, details);
    }

    /**
     * Execute a job.
     *
     * Business outcomes (skips, extensions, reported delivery failures) are
     * recorded and never thrown. Unexpected errors are recorded and then
     * rethrown so that the caller's retry policy applies.
     *
     * @param command the job to run
     * @return the job that was executed, which is a digest follower when the
     *         requested job was canceled and replaced, or null if the job was
     *         canceled without a replacement
     * @throws JobNotFoundException if the job does not exist
     */
    public Job execute(RunJobCommand command) throws Exception {
        Job job = jobStore.find(command.getJobId(), command.getEnvironmentId());
        if (job == null) {
            throw new JobNotFoundException(command.getJobId());
        }

        stepRuns.create(job, StepRun.of(JobStatus.RUNNING));

        DigestCancellationResolver.Resolution cancellation = cancellationResolver.resolve(job);
        if (cancellation.isCanceled() && !cancellation.hasFollower()) {
            log.info("Job {} ({}) was canceled while delayed", job.getId(), job.getType());
            stepRuns.create(job, StepRun.of(JobStatus.CANCELED));
            return null;
        }

        if (cancellation.hasFollower()) {
            log.info("Job {} was canceled, digest continues as job {}", job.getId(), cancellation.getFollower().getId());
            job = cancellation.getFollower();
        }

        putDiagnosticContext(job);
        try {
            return run(job);
        } finally {
            clearDiagnosticContext();
        }
    }

    private Job run(Job job) throws Exception {
        Execution execution = new Execution(job);
        Exception failure = null;

        try {
            runStep(execution);
        } catch (Exception e) {
            failure = e;
            execution.completion = completionAfterError(execution.job, e);
            try {
                recordExecutionError(execution.job, e);
            } catch (Exception bookkeeping) {
                e.addSuppressed(bookkeeping);
            }
        }

        try {
            complete(execution, failure);
        } catch (Exception e) {
            if (failure == null) {
                throw e;
            }
            failure.addSuppressed(e);
        }

        if (failure != null) {
            throw failure;
        }
        return execution.job;
    }

    private void runStep(Execution execution) throws Exception {
        Job job = execution.job;

        Notification notification = notificationStore.find(job.getNotificationId(), job.getEnvironmentId());
        if (notification == null) {
            throw new NotificationNotFoundException(job.getNotificationId());
        }

        ScheduleGate.Decision decision = scheduleGate.evaluate(job, notification);
        if (decision == ScheduleGate.Decision.EXTENDED) {
            execution.completion = Completion.PARKED;
            return;
        }
        if (decision == ScheduleGate.Decision.SKIPPED) {
            return;
        }

        jobStore.updateStatus(job.getEnvironmentId(), job.getId(), JobStatus.RUNNING, null);
        attachments.getAttachments(job.getAttachments());

        if (isUnsnooze(job)) {
            unsnoozeProcessor.process(job.getId(), job.getEnvironmentId(), job.getOrganizationId());
            execution.completion = Completion.PARKED;
            return;
        }

        SendResult result = messageSender.send(new SendMessageCommand(job, notification));

        // The sender may have changed the job, e.g. merged a digest
        if (result.getJob() != null) {
            execution.job = result.getJob();
            job = execution.job;
        }

        switch (result.getStatus()) {
            case SUCCESS -> {
                jobStore.updateStatus(job.getEnvironmentId(), job.getId(), JobStatus.COMPLETED, null);
                stepRuns.create(job, StepRun.of(JobStatus.COMPLETED));
            }
            case FAILED -> {
                jobStore.markFailed(job.getEnvironmentId(), job.getId(), result.getErrorMessage());
                stepRuns.create(job, StepRun.failed(StepRun.SEND_MESSAGE_FAILED, result.getErrorMessage()));
                log.info("Job {} ({}) failed to send: {}", job.getId(), job.getType(), result.getErrorMessage());

                if (job.shouldStopOnFail()) {
                    execution.completion = Completion.HALT;
                    jobStore.cancelPendingJobs(PendingJobsFilter.siblingsOf(job));
                }
            }
            case SKIPPED -> {
                jobStore.updateStatus(job.getEnvironmentId(), job.getId(), JobStatus.CANCELED,
                        result.getDeliveryLifecycleState());
                stepRuns.create(job, StepRun.of(JobStatus.CANCELED));
            }
        }
    }

    private Completion completionAfterError(Job job, Exception error) {
        boolean backoff = FailureKind.of(error) == FailureKind.BACKOFF;
        return job.shouldStopOnFail() || backoff ? Completion.HALT : Completion.ADVANCE;
    }

    private void recordExecutionError(Job job, Exception error) throws Exception {
        log.warn("Job {} ({}) failed with an execution error: {}", job.getId(), job.getType(), error.getMessage());

        stepRuns.create(job, StepRun.failed(StepRun.EXECUTION_ERROR, error.getMessage()));

        boolean backoff = FailureKind.of(error) == FailureKind.BACKOFF;
        if (job.shouldStopOnFail() && !backoff) {
            jobStore.cancelPendingJobs(PendingJobsFilter.siblingsOf(job));
        }
    }

    private void complete(Execution execution, Exception failure) throws Exception {
        Job job = execution.job;

        switch (execution.completion) {
            case ADVANCE -> chainAdvancer.advance(job);
            case HALT -> {
                workflowRuns.updateDeliveryLifecycle(DeliveryLifecycleUpdate.forJob(job, failure));
                attachments.deleteAttachments(job.getAttachments());
            }
            case PARKED -> log.debug("Job {} parked, chain not advanced", job.getId());
        }
    }

    private static boolean isUnsnooze(Job job) {
        if (job.getType() != StepType.IN_APP || job.getDelay() == null) {
            return false;
        }
        Object marker = job.getPayload().get(UNSNOOZE_MARKER);
        return Boolean.TRUE.equals(marker) || "true".equals(marker);
    }

    private static void putDiagnosticContext(Job job) {
        MDC.put("transactionId", job.getTransactionId());
        MDC.put("jobId", job.getId());
        MDC.put("environmentId", job.getEnvironmentId());
        MDC.put("organizationId", job.getOrganizationId());
    }

    private static void clearDiagnosticContext() {
        MDC.remove("transactionId");
        MDC.remove("jobId");
        MDC.remove("environmentId");
        MDC.remove("organizationId");
    }

    /**
     * Mutable state of one execution.
     */
    private static final class Execution {
        private Job job;
        private Completion completion = Completion.ADVANCE;

        private Execution(Job job) {
            this.job = job;
        }
    }

    public static Builder builder(JobStore jobStore, NotificationStore notificationStore) {
        return new Builder(jobStore, notificationStore);
    }

    public static class Builder {
        private final JobStore jobStore;
        private final NotificationStore notificationStore;
        private StepRunSink stepRuns;
        private ExecutionDetailSink executionDetails;
        private MessageSender messageSender;
        private BridgeExecutor bridgeExecutor;
        private NextJobEnqueuer nextJobEnqueuer;
        private DelayedJobQueue delayedQueue;
        private JobFailureRecorder failureRecorder;
        private WorkflowRunStatusUpdater workflowRuns;
        private AttachmentStorage attachments;
        private UnsnoozeProcessor unsnoozeProcessor;
        private FeatureFlagProvider featureFlags = (organizationId, environmentId) -> false;
        private SubscriberScheduleProvider scheduleProvider = (environmentId, organizationId, subscriberId) -> null;
        private SubscriberStore subscriberStore = (subscriberId, environmentId, organizationId) -> null;
        private EngineConfig config = EngineConfig.defaults();

        private Builder(JobStore jobStore, NotificationStore notificationStore) {
            this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
            this.notificationStore = Objects.requireNonNull(notificationStore, "notificationStore");
        }

        public Builder withStepRuns(StepRunSink stepRuns) {
            this.stepRuns = stepRuns;
            return this;
        }

        public Builder withExecutionDetails(ExecutionDetailSink executionDetails) {
            this.executionDetails = executionDetails;
            return this;
        }

        public Builder withMessageSender(MessageSender messageSender) {
            this.messageSender = messageSender;
            return this;
        }

        public Builder withBridgeExecutor(BridgeExecutor bridgeExecutor) {
            this.bridgeExecutor = bridgeExecutor;
            return this;
        }

        public Builder withNextJobEnqueuer(NextJobEnqueuer nextJobEnqueuer) {
            this.nextJobEnqueuer = nextJobEnqueuer;
            return this;
        }

        public Builder withDelayedQueue(DelayedJobQueue delayedQueue) {
            this.delayedQueue = delayedQueue;
            return this;
        }

        public Builder withFailureRecorder(JobFailureRecorder failureRecorder) {
            this.failureRecorder = failureRecorder;
            return this;
        }

        public Builder withWorkflowRuns(WorkflowRunStatusUpdater workflowRuns) {
            this.workflowRuns = workflowRuns;
            return this;
        }

        public Builder withAttachments(AttachmentStorage attachments) {
            this.attachments = attachments;
            return this;
        }

        public Builder withUnsnoozeProcessor(UnsnoozeProcessor unsnoozeProcessor) {
            this.unsnoozeProcessor = unsnoozeProcessor;
            return this;
        }

        /**
         * Default: subscriber schedules are never enforced
         */
        public Builder withFeatureFlags(FeatureFlagProvider featureFlags) {
            this.featureFlags = featureFlags;
            return this;
        }

        public Builder withScheduleProvider(SubscriberScheduleProvider scheduleProvider) {
            this.scheduleProvider = scheduleProvider;
            return this;
        }

        public Builder withSubscriberStore(SubscriberStore subscriberStore) {
            this.subscriberStore = subscriberStore;
            return this;
        }

        public Builder withConfig(EngineConfig config) {
            this.config = config;
            return this;
        }

        public JobRunner build() {
            Objects.requireNonNull(stepRuns, "stepRuns");
            Objects.requireNonNull(executionDetails, "executionDetails");
            Objects.requireNonNull(messageSender, "messageSender");
            Objects.requireNonNull(bridgeExecutor, "bridgeExecutor");
            Objects.requireNonNull(nextJobEnqueuer, "nextJobEnqueuer");
            Objects.requireNonNull(delayedQueue, "delayedQueue");
            Objects.requireNonNull(failureRecorder, "failureRecorder");
            Objects.requireNonNull(workflowRuns, "workflowRuns");
            Objects.requireNonNull(attachments, "attachments");
            Objects.requireNonNull(unsnoozeProcessor, "unsnoozeProcessor");
            Objects.requireNonNull(featureFlags, "featureFlags");
            Objects.requireNonNull(scheduleProvider, "scheduleProvider");
            Objects.requireNonNull(subscriberStore, "subscriberStore");
            Objects.requireNonNull(config, "config");
            return new JobRunner(this);
        }
    }
}
