package com.umitunal.stepflow.spi;

import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.model.JobStatus;

/**
 * Persistent job records. Status writes are assumed to be atomic per job.
 */
public interface JobStore {

    /**
     * @return the job, or null if it does not exist in the environment
     */
    Job find(String jobId, String environmentId) throws Exception;

    /**
     * Find the job that follows {@code parentId} in its chain.
     *
     * @return the child job, or null at the end of the chain
     */
    Job findByParent(String environmentId, String parentId) throws Exception;

    /**
     * @return a delayed, unmerged digest job matching the query, or null
     */
    Job findActiveDigestFollower(DigestFollowerQuery query) throws Exception;

    /**
     * @param reason optional reason stored with the status, may be null
     */
    void updateStatus(String environmentId, String jobId, JobStatus status, String reason) throws Exception;

    /**
     * Set FAILED together with the error message.
     */
    void markFailed(String environmentId, String jobId, String errorMessage) throws Exception;

    void markSkipped(String environmentId, String organizationId, String jobId) throws Exception;

    /**
     * Set DELAYED and store the new schedule extension count.
     */
    void extendToSchedule(String environmentId, String jobId, int scheduleExtensionsCount) throws Exception;

    /**
     * Cancel every pending job of the transaction for the subscriber and template.
     */
    void cancelPendingJobs(PendingJobsFilter filter) throws Exception;
}
