package com.umitunal.stepflow.model;

import java.util.List;

/**
 * The workflow trigger that owns a set of jobs. Read-only for the runner.
 */
public final class Notification {
    private final String id;
    private final List<String> tags;
    private final String severity;
    private final boolean critical;

    public Notification(String id, List<String> tags, String severity, boolean critical) {
        this.id = id;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        this.severity = severity;
        this.critical = critical;
    }

    public String getId() { return id; }
    public List<String> getTags() { return tags; }
    public String getSeverity() { return severity; }

    /**
     * Critical notifications ignore subscriber schedules.
     */
    public boolean isCritical() { return critical; }
}
