package com.umitunal.stepflow.support;

import com.umitunal.stepflow.config.EngineConfig;
import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.model.Notification;
import com.umitunal.stepflow.model.StepDefinition;
import com.umitunal.stepflow.model.StepType;
import com.umitunal.stepflow.runner.JobRunner;
import com.umitunal.stepflow.runner.RunJobCommand;
import com.umitunal.stepflow.schedule.Schedule;
import com.umitunal.stepflow.spi.BridgeExecutor;
import com.umitunal.stepflow.spi.BridgeResponse;
import com.umitunal.stepflow.spi.DelayedJobQueue;
import com.umitunal.stepflow.spi.MessageSender;
import com.umitunal.stepflow.spi.SendMessageCommand;
import com.umitunal.stepflow.spi.SendResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Wires a {@link JobRunner} to in-memory collaborators. Every job made by
 * {@link #job(String, StepType)} belongs to the same transaction, subscriber
 * and notification.
 */
public class RunnerFixture {
    public static final String ENVIRONMENT = "env-1";
    public static final String ORGANIZATION = "org-1";
    public static final String TRANSACTION = "txn-1";
    public static final String NOTIFICATION = "notification-1";
    public static final String SUBSCRIBER = "subscriber-1";
    public static final String TEMPLATE = "template-1";

    /**
     * Monday 2024-06-10, noon UTC.
     */
    public static final Instant NOW = Instant.parse("2024-06-10T12:00:00Z");

    public final InMemoryJobStore jobStore = new InMemoryJobStore();
    public final InMemoryNotificationStore notificationStore = new InMemoryNotificationStore();
    public final RecordingStepRuns stepRuns = new RecordingStepRuns();
    public final RecordingExecutionDetails executionDetails = new RecordingExecutionDetails();
    public final RecordingAttachmentStorage attachments = new RecordingAttachmentStorage();
    public final ScriptedNextJobEnqueuer enqueuer = new ScriptedNextJobEnqueuer();
    public final RecordingDelayedJobQueue delayedQueue = new RecordingDelayedJobQueue();
    public final RecordingWorkflowRuns workflowRuns = new RecordingWorkflowRuns();
    public final RecordingFailureRecorder failureRecorder = new RecordingFailureRecorder();
    public final List<SendMessageCommand> sent = new ArrayList<>();
    public final List<String> unsnoozed = new ArrayList<>();
    public final List<String> bridgeCalls = new ArrayList<>();

    private MessageSender sender = command -> SendResult.success();
    private BridgeExecutor bridge = job -> BridgeResponse.extendingToSchedule(false);
    private boolean scheduleFlag;
    private Schedule schedule;
    private String timezone;
    private int maxScheduleExtensions = EngineConfig.DEFAULT_MAX_SCHEDULE_EXTENSIONS;
    private DelayedJobQueue dispatcher;

    public RunnerFixture() {
        notificationStore.save(new Notification(NOTIFICATION, List.of("billing"), "high", false));
    }

    public static Job.Builder job(String id, StepType type) {
        return jobWithStep(id, StepDefinition.of(type));
    }

    public static Job.Builder jobWithStep(String id, StepDefinition step) {
        return Job.newBuilder(id, ENVIRONMENT, step)
                .withOrganizationId(ORGANIZATION)
                .withUserId("user-1")
                .withTransactionId(TRANSACTION)
                .withNotificationId(NOTIFICATION)
                .withTemplateId(TEMPLATE)
                .withSubscriberId(SUBSCRIBER)
                .withExternalSubscriberId("ext-" + SUBSCRIBER);
    }

    public static RunJobCommand command(String jobId) {
        return new RunJobCommand(jobId, ENVIRONMENT, ORGANIZATION, "user-1");
    }

    public RunnerFixture critical() {
        notificationStore.save(new Notification(NOTIFICATION, List.of("billing"), "high", true));
        return this;
    }

    public RunnerFixture withSender(MessageSender sender) {
        this.sender = sender;
        return this;
    }

    public RunnerFixture withBridgeAskingForExtension(boolean extend) {
        this.bridge = job -> BridgeResponse.extendingToSchedule(extend);
        return this;
    }

    /**
     * Enable schedule enforcement for the subscriber.
     */
    public RunnerFixture withSchedule(Schedule schedule, String timezone) {
        this.scheduleFlag = true;
        this.schedule = schedule;
        this.timezone = timezone;
        return this;
    }

    public RunnerFixture withMaxScheduleExtensions(int max) {
        this.maxScheduleExtensions = max;
        return this;
    }

    /**
     * Re-queue extended jobs here instead of recording them.
     */
    public RunnerFixture withDispatcher(DelayedJobQueue dispatcher) {
        this.dispatcher = dispatcher;
        return this;
    }

    public JobRunner runner() {
        EngineConfig config = EngineConfig.newBuilder()
                .withMaxScheduleExtensions(maxScheduleExtensions)
                .withClock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();

        return JobRunner.builder(jobStore, notificationStore)
                .withStepRuns(stepRuns)
                .withExecutionDetails(executionDetails)
                .withMessageSender(command -> {
                    sent.add(command);
                    return sender.send(command);
                })
                .withBridgeExecutor(job -> {
                    bridgeCalls.add(job.getId());
                    return bridge.execute(job);
                })
                .withNextJobEnqueuer(enqueuer)
                .withDelayedQueue(dispatcher != null ? dispatcher : delayedQueue)
                .withFailureRecorder(failureRecorder)
                .withWorkflowRuns(workflowRuns)
                .withAttachments(attachments)
                .withUnsnoozeProcessor((jobId, environmentId, organizationId) -> unsnoozed.add(jobId))
                .withFeatureFlags((organizationId, environmentId) -> scheduleFlag)
                .withScheduleProvider((environmentId, organizationId, subscriberId) -> schedule)
                .withSubscriberStore((subscriberId, environmentId, organizationId) -> timezone)
                .withConfig(config)
                .build();
    }
}
