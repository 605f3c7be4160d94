package com.umitunal.stepflow.runner;

import com.umitunal.stepflow.config.EngineConfig;
import com.umitunal.stepflow.error.JobNotFoundException;
import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.model.JobStatus;
import com.umitunal.stepflow.model.Notification;
import com.umitunal.stepflow.schedule.Schedule;
import com.umitunal.stepflow.schedule.ScheduleEvaluator;
import com.umitunal.stepflow.spi.BridgeExecutor;
import com.umitunal.stepflow.spi.BridgeResponse;
import com.umitunal.stepflow.spi.DelayedJobQueue;
import com.umitunal.stepflow.spi.ExecutionDetailSink;
import com.umitunal.stepflow.spi.FeatureFlagProvider;
import com.umitunal.stepflow.spi.JobStore;
import com.umitunal.stepflow.spi.StepRun;
import com.umitunal.stepflow.spi.StepRunSink;
import com.umitunal.stepflow.spi.SubscriberScheduleProvider;
import com.umitunal.stepflow.spi.SubscriberStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Holds a job against its subscriber's weekly schedule.
 *
 * Evaluation order for a non-critical job that falls outside the schedule:
 * extend it to the next opening if its step type allows and the bridge asks
 * for it, otherwise let it through if its step type bypasses schedules,
 * otherwise skip it. Critical notifications are never held.
 */
class ScheduleGate {
    private static final Logger log = LoggerFactory.getLogger(ScheduleGate.class);

    enum Decision {
        PROCEED,    // Run the step now
        EXTENDED,   // Parked until the schedule opens, chain must not advance
        SKIPPED     // Canceled outside the schedule, chain advances
    }

    private final JobStore jobStore;
    private final StepRunSink stepRuns;
    private final ExecutionDetailSink executionDetails;
    private final FeatureFlagProvider featureFlags;
    private final SubscriberScheduleProvider scheduleProvider;
    private final SubscriberStore subscriberStore;
    private final BridgeExecutor bridgeExecutor;
    private final DelayedJobQueue delayedQueue;
    private final ExecutionDetailFactory details;
    private final EngineConfig config;

    ScheduleGate(JobStore jobStore, StepRunSink stepRuns, ExecutionDetailSink executionDetails,
                 FeatureFlagProvider featureFlags, SubscriberScheduleProvider scheduleProvider,
                 SubscriberStore subscriberStore, BridgeExecutor bridgeExecutor,
                 DelayedJobQueue delayedQueue, ExecutionDetailFactory details, EngineConfig config) {
        this.jobStore = jobStore;
        this.stepRuns = stepRuns;
        this.executionDetails = executionDetails;
        this.featureFlags = featureFlags;
        this.scheduleProvider = scheduleProvider;
        this.subscriberStore = subscriberStore;
        this.bridgeExecutor = bridgeExecutor;
        this.delayedQueue = delayedQueue;
        this.details = details;
        this.config = config;
    }

    Decision evaluate(Job job, Notification notification) throws Exception {
        if (notification.isCritical()) {
            return Decision.PROCEED;
        }
        if (!featureFlags.isSubscriberScheduleEnabled(job.getOrganizationId(), job.getEnvironmentId())) {
            return Decision.PROCEED;
        }

        Schedule schedule = scheduleProvider.getSchedule(
                job.getEnvironmentId(), job.getOrganizationId(), job.getSubscriberId());
        if (schedule == null || !schedule.isEnabled()) {
            return Decision.PROCEED;
        }

        String timezone = subscriberStore.findTimezone(
                job.getSubscriberId(), job.getEnvironmentId(), job.getOrganizationId());

        if (ScheduleEvaluator.isWithinSchedule(schedule, config.getClock().instant(), timezone)) {
            return Decision.PROCEED;
        }

        if (job.getType().extendsToSchedule() && bridgeRequestsExtension(job)
                && extendToNextAvailableTime(job, schedule, timezone)) {
            return Decision.EXTENDED;
        }

        if (job.getType().bypassesSchedule()) {
            return Decision.PROCEED;
        }

        skip(job, schedule, timezone);
        return Decision.SKIPPED;
    }

    private boolean bridgeRequestsExtension(Job job) throws Exception {
        BridgeResponse response = bridgeExecutor.execute(job);
        return response != null && response.extendToSchedule();
    }

    private boolean extendToNextAvailableTime(Job job, Schedule schedule, String timezone) throws Exception {
        int maxExtensions = config.getMaxScheduleExtensions();
        int extensions = job.getScheduleExtensionsCount();

        if (extensions >= maxExtensions) {
            log.warn("Job {} ({}) reached {} schedule extensions, sending without waiting for subscriber {}",
                    job.getId(), job.getType(), extensions, job.getExternalSubscriberId());
            executionDetails.record(details.maxExtensionsReached(job));
            return false;
        }

        Instant now = config.getClock().instant();
        Instant nextAvailableTime = ScheduleEvaluator.calculateNextAvailableTime(schedule, now, timezone);
        long delayMs = Math.max(0, Duration.between(now, nextAvailableTime).toMillis());

        if (delayMs == 0) {
            return false;
        }

        jobStore.extendToSchedule(job.getEnvironmentId(), job.getId(), extensions + 1);

        Job extended = jobStore.find(job.getId(), job.getEnvironmentId());
        if (extended == null) {
            throw new JobNotFoundException(job.getId());
        }

        stepRuns.create(extended, StepRun.of(JobStatus.DELAYED));
        executionDetails.record(details.extendedToSchedule(
                extended, delayMs, nextAvailableTime, timezone, schedule, maxExtensions));

        delayedQueue.queueJob(extended, delayMs);

        log.info("Job {} ({}) extended to subscriber schedule, next available time {} in {} ms, extension {}/{}",
                extended.getId(), extended.getType(), nextAvailableTime, delayMs,
                extended.getScheduleExtensionsCount(), maxExtensions);
        return true;
    }

    private void skip(Job job, Schedule schedule, String timezone) throws Exception {
        log.info("Job {} ({}) skipped, subscriber {} is outside their schedule",
                job.getId(), job.getType(), job.getExternalSubscriberId());

        jobStore.updateStatus(job.getEnvironmentId(), job.getId(), JobStatus.CANCELED, null);
        stepRuns.create(job, StepRun.of(JobStatus.SKIPPED));
        executionDetails.record(details.outsideSchedule(job, schedule, timezone));
    }
}
