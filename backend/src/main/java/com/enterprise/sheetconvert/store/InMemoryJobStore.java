package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Job store for local runs and tests. Records are copied on the way in and out.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "conversion.store", havingValue = "memory")
public class InMemoryJobStore implements JobStore {

    // ties on creation time fall back to the id, as in the DynamoDB index
    private static final Comparator<JobRecord> NEWEST_FIRST =
            Comparator.comparing(JobRecord::getCreatedAt).thenComparing(JobRecord::getJobId).reversed();

    private final ConcurrentMap<String, JobRecord> jobs = new ConcurrentHashMap<>();

    @Override
    public void create(JobRecord job) {
        if (jobs.putIfAbsent(job.getJobId(), copy(job)) != null) {
            throw new IllegalStateException("Job already exists: " + job.getJobId());
        }
    }

    @Override
    public Optional<JobRecord> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(InMemoryJobStore::copy);
    }

    @Override
    public boolean compareAndSet(long expectedVersion, JobRecord next) {
        AtomicBoolean written = new AtomicBoolean();
        jobs.computeIfPresent(next.getJobId(), (id, current) -> {
            if (current.getVersion() != expectedVersion) {
                return current;
            }
            written.set(true);
            return copy(next);
        });
        if (!written.get()) {
            log.debug("Version conflict on jobId={}, expected version {}", next.getJobId(), expectedVersion);
        }
        return written.get();
    }

    @Override
    public JobPage findByOwner(String ownerId, int limit, JobCursor after) {
        List<JobRecord> owned = jobs.values().stream()
                .filter(job -> ownerId.equals(job.getOwnerId()))
                .filter(job -> after == null || comesAfter(job, after))
                .sorted(NEWEST_FIRST)
                .map(InMemoryJobStore::copy)
                .collect(Collectors.toList());
        if (owned.size() <= limit) {
            return new JobPage(owned, null);
        }
        List<JobRecord> page = owned.subList(0, limit);
        JobRecord last = page.get(page.size() - 1);
        return new JobPage(List.copyOf(page), new JobCursor(last.getCreatedAt(), last.getJobId()));
    }

    @Override
    public List<JobRecord> findByStatusUpdatedBefore(JobStatus status, Instant cutoff) {
        return jobs.values().stream()
                .filter(job -> job.getStatus() == status && job.getUpdatedAt().isBefore(cutoff))
                .map(InMemoryJobStore::copy)
                .collect(Collectors.toList());
    }

    private static boolean comesAfter(JobRecord job, JobCursor cursor) {
        int byTime = job.getCreatedAt().compareTo(cursor.getCreatedAt());
        return byTime < 0 || (byTime == 0 && job.getJobId().compareTo(cursor.getJobId()) < 0);
    }

    private static JobRecord copy(JobRecord job) {
        return job.toBuilder().build();
    }
}
