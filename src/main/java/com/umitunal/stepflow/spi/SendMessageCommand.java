package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.model.Notification;

import java.util.List;
import java.util.Map;

/**
 * Everything a message sender needs to deliver one step.
 */
public final class SendMessageCommand {
    private final Job job;
    private final List<String> tags;
    private final String severity;
    private final List<Map<String, Object>> events;

    public SendMessageCommand(Job job, Notification notification) {
        this.job = job;
        this.tags = notification.getTags();
        this.severity = notification.getSeverity();
        this.events = job.getDigest() == null ? List.of() : job.getDigest().getEvents();
    }

    public Job getJob() { return job; }
    public List<String> getTags() { return tags; }
    public String getSeverity() { return severity; }

    /**
     * Events grouped by a digest step, empty for other steps.
     */
    public List<Map<String, Object>> getEvents() { return events; }
}
