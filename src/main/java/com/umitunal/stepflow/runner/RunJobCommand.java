package com.umitunal.stepflow.runner;

import java.util.Objects;

/**
 * Request to execute one job. This is the payload carried by the dispatch queue.
 */
public class RunJobCommand {
    private String jobId;
    private String environmentId;
    private String organizationId;
    private String userId;

    // For codecs
    private RunJobCommand() {
    }

    public RunJobCommand(String jobId, String environmentId, String organizationId, String userId) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.environmentId = Objects.requireNonNull(environmentId, "environmentId");
        this.organizationId = organizationId;
        this.userId = userId;
    }

    public String getJobId() { return jobId; }
    public String getEnvironmentId() { return environmentId; }
    public String getOrganizationId() { return organizationId; }
    public String getUserId() { return userId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RunJobCommand)) return false;
        RunJobCommand other = (RunJobCommand) o;
        return Objects.equals(jobId, other.jobId)
                && Objects.equals(environmentId, other.environmentId)
                && Objects.equals(organizationId, other.organizationId)
                && Objects.equals(userId, other.userId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, environmentId, organizationId, userId);
    }

    @Override
    public String toString() {
        return "RunJobCommand{jobId='" + jobId + "', environmentId='" + environmentId + "'}";
    }
}
