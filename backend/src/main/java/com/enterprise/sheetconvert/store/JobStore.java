package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable job records. Every mutation after {@link #create} is a compare-and-set on
 * the record version.
 */
public interface JobStore {

    /**
     * @throws IllegalStateException when a job with the same id already exists
     */
    void create(JobRecord job);

    Optional<JobRecord> find(String jobId);

    /**
     * Replaces the stored record with {@code next} if the stored version still equals
     * {@code expectedVersion}. {@code next} must carry {@code expectedVersion + 1}.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(long expectedVersion, JobRecord next);

    /**
     * Up to {@code limit} jobs of one owner, newest first, starting after {@code after}
     * (null for the first page).
     */
    JobPage findByOwner(String ownerId, int limit, JobCursor after);

    /**
     * Jobs in {@code status} whose last update is older than {@code cutoff}.
     */
    List<JobRecord> findByStatusUpdatedBefore(JobStatus status, Instant cutoff);
}
