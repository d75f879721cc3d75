package com.enterprise.sheetconvert.service;

import com.enterprise.sheetconvert.config.ConversionSettings;
import com.enterprise.sheetconvert.exception.ConversionException;
import com.enterprise.sheetconvert.extraction.ExtractionEngine;
import com.enterprise.sheetconvert.extraction.ExtractionOutcome;
import com.enterprise.sheetconvert.extraction.ExtractionResult;
import com.enterprise.sheetconvert.extraction.workbook.WorkbookAssembler;
import com.enterprise.sheetconvert.model.ErrorKind;
import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;
import com.enterprise.sheetconvert.model.QuotaDecision;
import com.enterprise.sheetconvert.storage.BlobStore;
import com.enterprise.sheetconvert.storage.PresignedUrl;
import com.enterprise.sheetconvert.store.JobCursor;
import com.enterprise.sheetconvert.store.JobPage;
import com.enterprise.sheetconvert.store.JobStore;
import com.enterprise.sheetconvert.worker.JobDispatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Owns every job transition after the upload handshake.
 *
 * All writes are compare-and-set on the record version. A writer that loses the race
 * drops its change: the winner already moved the job on. This is what keeps a late
 * worker from overwriting a job the stuck-job sweep has re-queued.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversionOrchestrator {

    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 100;

    private final JobStore jobStore;
    private final BlobStore blobStore;
    private final QuotaLedger quotaLedger;
    private final ExtractionEngine extractionEngine;
    private final WorkbookAssembler workbookAssembler;
    private final JobDispatcher dispatcher;
    private final JobNotifier notifier;
    private final ConversionSettings settings;
    private final Clock clock;

    // ─── admission ──────────────────────────────────────────────────────────

    /**
     * Moves a confirmed {@code PENDING_UPLOAD} job to {@code QUEUED} and dispatches it.
     *
     * The confirm first claims the job with a version-checked write, so concurrent
     * confirms of one job never reach the quota ledger more than once. A failure after
     * the claim gives back the reserved slot and the claim before it propagates.
     *
     * @throws ConversionException QUOTA_EXCEEDED when the owner's allotment is used up
     *         (the job is failed), INVALID_STATE when another confirm got there first
     */
    public JobRecord admit(JobRecord job) {
        JobRecord claimed = claimConfirmation(job);
        try {
            return admitClaimed(claimed);
        } catch (ConversionException e) {
            throw e;
        } catch (RuntimeException e) {
            releaseClaim(claimed, e);
            throw e;
        }
    }

    private JobRecord claimConfirmation(JobRecord job) {
        Instant now = clock.instant();
        // a claim older than the processing timeout belongs to a confirm that died
        if (job.getConfirmedAt() != null && job.getConfirmedAt().isAfter(now.minus(settings.getProcessingTimeout()))) {
            throw concurrentConfirm(job);
        }
        JobRecord claimed = advance(job)
                .confirmedAt(now)
                .build();
        if (!write(job, claimed)) {
            throw concurrentConfirm(job);
        }
        return claimed;
    }

    private JobRecord admitClaimed(JobRecord claimed) {
        QuotaDecision decision = quotaLedger.checkAndReserve(claimed.getOwnerId());

        if (!decision.isAllowed()) {
            String detail = "The free allotment of " + settings.getFreeAllotment()
                    + " conversions is used up. Upgrade to convert more documents.";
            JobRecord failed = advance(claimed)
                    .status(JobStatus.FAILED)
                    .errorKind(ErrorKind.QUOTA_EXCEEDED)
                    .errorDetail(detail)
                    .build();
            if (!write(claimed, failed)) {
                throw concurrentConfirm(claimed);
            }
            notifier.jobFailed(failed);
            throw new ConversionException(ErrorKind.QUOTA_EXCEEDED, detail);
        }

        JobRecord queued = advance(claimed)
                .status(JobStatus.QUEUED)
                .quotaCounted(decision.isCounted())
                .build();
        boolean written;
        try {
            written = write(claimed, queued);
        } catch (RuntimeException e) {
            releaseSlot(decision, claimed.getOwnerId(), e);
            throw e;
        }
        if (!written) {
            releaseSlot(decision, claimed.getOwnerId(), null);
            throw concurrentConfirm(claimed);
        }
        dispatch(queued.getJobId(), Duration.ZERO);
        return queued;
    }

    private void releaseSlot(QuotaDecision decision, String ownerId, RuntimeException cause) {
        if (!decision.isCounted()) {
            return;
        }
        try {
            quotaLedger.release(ownerId);
        } catch (RuntimeException e) {
            if (cause == null) {
                throw e;
            }
            cause.addSuppressed(e);
        }
    }

    private void releaseClaim(JobRecord claimed, RuntimeException cause) {
        try {
            if (!write(claimed, advance(claimed).confirmedAt(null).build())) {
                log.info("Confirm claim on jobId={} already superseded", claimed.getJobId());
            }
        } catch (RuntimeException e) {
            log.warn("Could not release confirm claim on jobId={}; it lapses after {}",
                    claimed.getJobId(), settings.getProcessingTimeout());
            cause.addSuppressed(e);
        }
    }

    // ─── worker ─────────────────────────────────────────────────────────────

    /**
     * Claims a {@code QUEUED} job and runs one extraction attempt. Never throws: every
     * outcome ends as a transition or a logged lost race.
     */
    public void process(String jobId) {
        Optional<JobRecord> found = jobStore.find(jobId);
        if (found.isEmpty()) {
            log.warn("Dispatched job not found: jobId={}", jobId);
            return;
        }
        JobRecord job = found.get();
        if (job.getStatus() != JobStatus.QUEUED) {
            log.debug("Skipping jobId={} in status {}", jobId, job.getStatus());
            return;
        }

        Instant now = clock.instant();
        JobRecord claimed = advance(job)
                .status(JobStatus.PROCESSING)
                .attemptCount(job.getAttemptCount() + 1)
                .processingStartedAt(now)
                .build();
        if (!write(job, claimed)) {
            log.info("Another worker claimed jobId={}", jobId);
            return;
        }
        log.info("Processing jobId={}, attempt {}/{}", jobId, claimed.getAttemptCount(), settings.getMaxAttempts());

        try {
            runAttempt(claimed);
        } catch (RuntimeException e) {
            handleUnexpected(claimed, e);
        }
    }

    private void runAttempt(JobRecord job) {
        Optional<Long> size = blobStore.sizeOf(job.getSourceKey());
        if (size.isEmpty()) {
            failBeforeExtraction(job, ErrorKind.SOURCE_MISSING,
                    "The uploaded file was not found. Upload the document again.");
            return;
        }
        if (size.get() > settings.getMaxSourceBytes()) {
            failBeforeExtraction(job, ErrorKind.FILE_TOO_LARGE, String.format(
                    "The document is %d bytes; the limit is %d bytes.", size.get(), settings.getMaxSourceBytes()));
            return;
        }

        byte[] source = blobStore.get(job.getSourceKey());

        // from here on the slot stays consumed, whatever the outcome
        JobRecord extracting = job.toBuilder().extractionAttempted(true).build();
        try {
            extractAndStore(extracting, source);
        } catch (RuntimeException e) {
            handleUnexpected(extracting, e);
        }
    }

    private void extractAndStore(JobRecord job, byte[] source) {
        ExtractionOutcome outcome = extractionEngine.extract(source);
        if (!outcome.isSuccess()) {
            switch (outcome.failureKind()) {
                case TRANSIENT -> retryOrFail(job, outcome.detail());
                case NO_TABLES_FOUND -> fail(job, ErrorKind.NO_TABLES_FOUND, outcome.detail());
                case UNPARSABLE_DOCUMENT -> fail(job, ErrorKind.UNPARSABLE_DOCUMENT, outcome.detail());
            }
            return;
        }

        ExtractionResult result = outcome.result();
        byte[] workbook;
        try {
            workbook = workbookAssembler.assemble(result, job.getFileName());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write workbook for job " + job.getJobId(), e);
        }
        String resultKey = BlobKeys.resultKey(settings.getResultPrefix(), job.getOwnerId(), job.getJobId(),
                job.getFileName());
        blobStore.put(resultKey, workbook, WorkbookAssembler.CONTENT_TYPE);

        JobRecord completed = advance(job)
                .status(JobStatus.COMPLETED)
                .resultKey(resultKey)
                .tableCount(result.tables().size())
                .strategy(result.strategy().name())
                .warnings(List.copyOf(result.warnings()))
                .build();
        if (write(job, completed)) {
            log.info("Job completed: jobId={}, tables={}, strategy={}",
                    job.getJobId(), completed.getTableCount(), completed.getStrategy());
            notifier.jobCompleted(completed);
        } else {
            log.info("Discarding result of jobId={}: job changed while processing", job.getJobId());
        }
    }

    // the slot goes back unless some attempt got as far as extraction
    private void failBeforeExtraction(JobRecord job, ErrorKind kind, String detail) {
        if (fail(job, kind, detail) && job.isQuotaCounted() && !job.isExtractionAttempted()) {
            quotaLedger.release(job.getOwnerId());
        }
    }

    private void handleUnexpected(JobRecord job, RuntimeException e) {
        log.error("Unexpected failure processing jobId={}", job.getJobId(), e);
        try {
            retryOrFail(job, "Unexpected error: " + e.getMessage());
        } catch (RuntimeException nested) {
            // the sweep retries the job once it times out
            log.error("Could not record failure for jobId={}", job.getJobId(), nested);
        }
    }

    private void retryOrFail(JobRecord job, String detail) {
        if (job.getAttemptCount() >= settings.getMaxAttempts()) {
            fail(job, ErrorKind.RETRIES_EXHAUSTED, "Conversion failed after " + job.getAttemptCount()
                    + " attempts. Try again later. Last error: " + detail);
            return;
        }
        JobRecord requeued = advance(job)
                .status(JobStatus.QUEUED)
                .processingStartedAt(null)
                .build();
        if (!write(job, requeued)) {
            log.info("Retry of jobId={} superseded by a concurrent update", job.getJobId());
            return;
        }
        Duration backoff = settings.getRetryBackoff().multipliedBy(job.getAttemptCount());
        log.warn("Transient failure on jobId={} (attempt {}): {}. Retrying in {}",
                job.getJobId(), job.getAttemptCount(), detail, backoff);
        dispatch(job.getJobId(), backoff);
    }

    private boolean fail(JobRecord job, ErrorKind kind, String detail) {
        JobRecord failed = advance(job)
                .status(JobStatus.FAILED)
                .errorKind(kind)
                .errorDetail(detail)
                .build();
        if (!write(job, failed)) {
            log.info("Failure of jobId={} superseded by a concurrent update", job.getJobId());
            return false;
        }
        log.info("Job failed: jobId={}, kind={}, detail={}", job.getJobId(), kind.code(), detail);
        notifier.jobFailed(failed);
        return true;
    }

    // ─── stuck-job sweep ────────────────────────────────────────────────────

    /**
     * Treats jobs stuck in {@code PROCESSING} past the timeout as transient failures and
     * re-dispatches {@code QUEUED} jobs nobody picked up.
     *
     * @return number of jobs acted on
     */
    public int sweepStuckJobs() {
        Instant cutoff = clock.instant().minus(settings.getProcessingTimeout());
        int handled = 0;

        for (JobRecord job : jobStore.findByStatusUpdatedBefore(JobStatus.PROCESSING, cutoff)) {
            log.warn("jobId={} has been processing since {}, treating as timed out",
                    job.getJobId(), job.getProcessingStartedAt());
            try {
                // the stalled worker may already have extracted
                retryOrFail(job.toBuilder().extractionAttempted(true).build(),
                        "Processing timed out after " + settings.getProcessingTimeout());
                handled++;
            } catch (RuntimeException e) {
                log.error("Failed to recover stuck jobId={}", job.getJobId(), e);
            }
        }
        for (JobRecord job : jobStore.findByStatusUpdatedBefore(JobStatus.QUEUED, cutoff)) {
            log.warn("jobId={} queued since {}, dispatching again", job.getJobId(), job.getUpdatedAt());
            dispatch(job.getJobId(), Duration.ZERO);
            handled++;
        }
        if (handled > 0) {
            log.info("Stuck-job sweep handled {} job(s)", handled);
        }
        return handled;
    }

    // ─── queries ────────────────────────────────────────────────────────────

    public JobRecord getStatus(String jobId, String ownerId) {
        return ownedJob(jobId, ownerId);
    }

    /**
     * One page of the owner's jobs, newest first. {@code limit} is clamped to
     * 1..{@value #MAX_PAGE_SIZE}.
     *
     * @param pageToken token from the previous page, or null for the first
     * @throws ConversionException INVALID_REQUEST for a token this service did not issue
     */
    public JobPage listJobs(String ownerId, int limit, String pageToken) {
        JobCursor after = null;
        if (pageToken != null && !pageToken.isBlank()) {
            try {
                after = JobCursor.decode(pageToken);
            } catch (IllegalArgumentException e) {
                throw new ConversionException(ErrorKind.INVALID_REQUEST, "Invalid page token: " + pageToken);
            }
        }
        return jobStore.findByOwner(ownerId, Math.max(1, Math.min(limit, MAX_PAGE_SIZE)), after);
    }

    /**
     * @throws ConversionException NOT_READY unless the job is {@code COMPLETED}
     */
    public PresignedUrl getDownloadUrl(String jobId, String ownerId) {
        JobRecord job = ownedJob(jobId, ownerId);
        if (job.getStatus() != JobStatus.COMPLETED) {
            throw new ConversionException(ErrorKind.NOT_READY,
                    "Job " + jobId + " is " + job.getStatus() + "; the workbook is not available.");
        }
        return blobStore.issueDownloadUrl(job.getResultKey(), settings.getDownloadUrlTtl());
    }

    JobRecord ownedJob(String jobId, String ownerId) {
        JobRecord job = jobStore.find(jobId)
                .orElseThrow(() -> new ConversionException(ErrorKind.NOT_FOUND, "Job not found: " + jobId));
        if (!job.getOwnerId().equals(ownerId)) {
            throw new ConversionException(ErrorKind.FORBIDDEN, "Job " + jobId + " belongs to another user");
        }
        return job;
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    private JobRecord.JobRecordBuilder advance(JobRecord current) {
        return current.toBuilder()
                .version(current.getVersion() + 1)
                .updatedAt(clock.instant());
    }

    private boolean write(JobRecord current, JobRecord next) {
        JobStateMachine.checkTransition(current, next);
        return jobStore.compareAndSet(current.getVersion(), next);
    }

    private void dispatch(String jobId, Duration delay) {
        dispatcher.dispatch(jobId, delay, () -> process(jobId));
    }

    private static ConversionException concurrentConfirm(JobRecord job) {
        return new ConversionException(ErrorKind.INVALID_STATE, "Job " + job.getJobId() + " was already confirmed");
    }
}
