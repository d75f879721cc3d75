package com.enterprise.sheetconvert.service;

import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Legal job transitions and the record invariants that must hold after each write.
 * The only backwards edge is PROCESSING to QUEUED, the bounded retry. PENDING_UPLOAD
 * may be rewritten in place to take or give back the confirm claim.
 */
public final class JobStateMachine {

    private static final Map<JobStatus, Set<JobStatus>> TRANSITIONS = new EnumMap<>(JobStatus.class);

    static {
        TRANSITIONS.put(JobStatus.PENDING_UPLOAD,
                EnumSet.of(JobStatus.PENDING_UPLOAD, JobStatus.QUEUED, JobStatus.FAILED));
        TRANSITIONS.put(JobStatus.QUEUED, EnumSet.of(JobStatus.PROCESSING));
        TRANSITIONS.put(JobStatus.PROCESSING, EnumSet.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.QUEUED));
        TRANSITIONS.put(JobStatus.COMPLETED, EnumSet.noneOf(JobStatus.class));
        TRANSITIONS.put(JobStatus.FAILED, EnumSet.noneOf(JobStatus.class));
    }

    private JobStateMachine() {
    }

    public static boolean canTransition(JobStatus from, JobStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * @throws IllegalStateException when {@code next} is not a legal successor of {@code current}
     */
    public static void checkTransition(JobRecord current, JobRecord next) {
        if (!canTransition(current.getStatus(), next.getStatus())) {
            throw new IllegalStateException("Illegal transition for job " + current.getJobId() + ": "
                    + current.getStatus() + " -> " + next.getStatus());
        }
        if (!Objects.equals(current.getOwnerId(), next.getOwnerId())
                || !Objects.equals(current.getSourceKey(), next.getSourceKey())) {
            throw new IllegalStateException("Owner and source key of job " + current.getJobId() + " are immutable");
        }
        checkInvariants(next);
    }

    /**
     * Terminal jobs carry exactly one of result key and error detail; other jobs carry neither.
     */
    public static void checkInvariants(JobRecord job) {
        boolean hasResult = job.getResultKey() != null;
        boolean hasError = job.getErrorDetail() != null;
        if (job.getStatus() == JobStatus.COMPLETED && (!hasResult || hasError)) {
            throw new IllegalStateException("Completed job " + job.getJobId() + " must have a result and no error");
        }
        if (job.getStatus() == JobStatus.FAILED && (hasResult || !hasError || job.getErrorKind() == null)) {
            throw new IllegalStateException("Failed job " + job.getJobId() + " must have an error and no result");
        }
        if (!job.getStatus().isTerminal() && (hasResult || hasError)) {
            throw new IllegalStateException("Job " + job.getJobId() + " in " + job.getStatus()
                    + " must have neither result nor error");
        }
    }
}
