package com.umitunal.stepflow.runner;

import com.umitunal.stepflow.model.Job;
import com.umitunal.stepflow.model.JobStatus;
import com.umitunal.stepflow.model.StepType;
import com.umitunal.stepflow.spi.DigestFollowerQuery;
import com.umitunal.stepflow.spi.JobStore;

/**
 * Decides whether a parked delay or digest job was canceled while it waited,
 * and whether another digest job should carry on in its place.
 *
 * When events of several triggers were merged into a main digest and that
 * main digest is then canceled, a still-delayed follower takes over
 * the digest from then on.
 */
class DigestCancellationResolver {
    private final JobStore jobStore;

    DigestCancellationResolver(JobStore jobStore) {
        this.jobStore = jobStore;
    }

    Resolution resolve(Job job) throws Exception {
        if (!job.getType().isDeferred() || job.getStatus() != JobStatus.CANCELED) {
            return Resolution.ACTIVE;
        }
        return new Resolution(true, findActiveFollower(job));
    }

    private Job findActiveFollower(Job job) throws Exception {
        if (job.getType() != StepType.DIGEST) {
            return null;
        }
        return jobStore.findActiveDigestFollower(followerQuery(job));
    }

    static DigestFollowerQuery followerQuery(Job job) {
        String digestKey = job.getDigest() == null ? null : job.getDigest().getDigestKey();
        Object digestValue = digestKey == null ? null : job.payloadValue(digestKey);

        return new DigestFollowerQuery(
                job.getEnvironmentId(),
                job.getOrganizationId(),
                job.getSubscriberId(),
                job.getTemplateId(),
                digestValue == null ? null : digestKey,
                digestValue
        );
    }

    static final class Resolution {
        static final Resolution ACTIVE = new Resolution(false, null);

        private final boolean canceled;
        private final Job follower;

        Resolution(boolean canceled, Job follower) {
            this.canceled = canceled;
            this.follower = follower;
        }

        boolean isCanceled() { return canceled; }
        Job getFollower() { return follower; }

        boolean hasFollower() {
            return follower != null;
        }
    }
}
