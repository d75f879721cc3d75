package com.enterprise.sheetconvert.service;

import com.enterprise.sheetconvert.config.ConversionSettings;
import com.enterprise.sheetconvert.exception.ConversionException;
import com.enterprise.sheetconvert.exception.StoreException;
import com.enterprise.sheetconvert.extraction.ExtractedTable;
import com.enterprise.sheetconvert.extraction.ExtractionEngine;
import com.enterprise.sheetconvert.extraction.ExtractionOutcome;
import com.enterprise.sheetconvert.extraction.ExtractionResult;
import com.enterprise.sheetconvert.extraction.ExtractionStrategy;
import com.enterprise.sheetconvert.extraction.FailureKind;
import com.enterprise.sheetconvert.extraction.workbook.WorkbookAssembler;
import com.enterprise.sheetconvert.model.ConfirmResponse;
import com.enterprise.sheetconvert.model.ErrorKind;
import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;
import com.enterprise.sheetconvert.model.QuotaDecision;
import com.enterprise.sheetconvert.model.QuotaRecord;
import com.enterprise.sheetconvert.model.Tier;
import com.enterprise.sheetconvert.model.UploadRequest;
import com.enterprise.sheetconvert.model.UploadResponse;
import com.enterprise.sheetconvert.storage.PresignedUrl;
import com.enterprise.sheetconvert.store.InMemoryJobStore;
import com.enterprise.sheetconvert.store.InMemoryQuotaStore;
import com.enterprise.sheetconvert.store.JobPage;
import com.enterprise.sheetconvert.store.QuotaStore;
import com.enterprise.sheetconvert.support.InMemoryBlobStore;
import com.enterprise.sheetconvert.support.MutableClock;
import com.enterprise.sheetconvert.support.RecordingJobDispatcher;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConversionOrchestratorTest {

    private static final String OWNER = "user-1";
    private static final byte[] PDF = "%PDF-1.7 test document".getBytes(StandardCharsets.US_ASCII);

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private final FlakyJobStore jobStore = new FlakyJobStore();
    private final InMemoryQuotaStore quotaStore = new InMemoryQuotaStore();
    private final InMemoryBlobStore blobStore = new InMemoryBlobStore(clock);
    private final RecordingJobDispatcher dispatcher = new RecordingJobDispatcher();
    private final ExtractionEngine engine = mock(ExtractionEngine.class);
    private final JobNotifier notifier = mock(JobNotifier.class);

    private QuotaLedger quotaLedger;
    private ConversionOrchestrator orchestrator;
    private UploadHandshakeService handshake;

    @BeforeEach
    void setUp() {
        wire(settings(20L * 1024 * 1024));
    }

    private void wire(ConversionSettings settings) {
        wire(settings, quotaStore);
    }

    private void wire(ConversionSettings settings, QuotaStore ledgerStore) {
        quotaLedger = new QuotaLedger(ledgerStore, settings, clock);
        orchestrator = new ConversionOrchestrator(jobStore, blobStore, quotaLedger, engine,
                new WorkbookAssembler(), dispatcher, notifier, settings, clock);
        handshake = new UploadHandshakeService(jobStore, blobStore, orchestrator, settings, clock);
    }

    private static ConversionSettings settings(long maxSourceBytes) {
        return ConversionSettings.builder()
                .uploadPrefix("uploads")
                .resultPrefix("results")
                .uploadUrlTtl(Duration.ofMinutes(15))
                .downloadUrlTtl(Duration.ofHours(1))
                .maxAttempts(3)
                .retryBackoff(Duration.ofSeconds(10))
                .processingTimeout(Duration.ofMinutes(5))
                .maxSourceBytes(maxSourceBytes)
                .freeAllotment(5)
                .quotaResetPolicy(QuotaResetPolicy.NEVER)
                .build();
    }

    // ─── happy path ─────────────────────────────────────────────────────────

    @Test
    void completedJobHasOneWorksheetPerReportedTable() throws Exception {
        when(engine.extract(any())).thenReturn(success(table(1, "Region", "Total"), table(2, "Item", "Qty")));
        String jobId = uploadedJob("Quarterly Report.pdf");

        handshake.confirmUpload(jobId, OWNER);
        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getResultKey()).isEqualTo("results/user-1/" + jobId + "/Quarterly_Report.xlsx");
        assertThat(job.getErrorDetail()).isNull();
        assertThat(job.getAttemptCount()).isEqualTo(1);
        assertThat(job.getTableCount()).isEqualTo(2);
        assertThat(job.getStrategy()).isEqualTo("STRUCTURED");
        assertThat(blobStore.contentType(job.getResultKey())).isEqualTo(WorkbookAssembler.CONTENT_TYPE);
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(blobStore.get(job.getResultKey())))) {
            assertThat(workbook.getNumberOfSheets()).isEqualTo(job.getTableCount());
        }
        JobStateMachine.checkInvariants(job);
        verify(notifier).jobCompleted(any());
    }

    @Test
    void downloadUrlIsIssuedOnlyForCompletedJobs() {
        when(engine.extract(any())).thenReturn(success(table(1, "a", "b")));
        String jobId = uploadedJob("report.pdf");
        handshake.confirmUpload(jobId, OWNER);

        assertThat(kindOf(() -> orchestrator.getDownloadUrl(jobId, OWNER))).isEqualTo(ErrorKind.NOT_READY);

        dispatcher.runAll();
        PresignedUrl url = orchestrator.getDownloadUrl(jobId, OWNER);
        assertThat(url.getUrl()).contains(job(jobId).getResultKey());
        assertThat(url.getExpiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));
    }

    // ─── quota ──────────────────────────────────────────────────────────────

    @Test
    void freeOwnerWithOneSlotLeftIsAdmittedAndTheNextJobIsRejected() {
        for (int i = 0; i < 4; i++) {
            quotaLedger.checkAndReserve(OWNER);
        }
        String admitted = uploadedJob("first.pdf");
        String rejected = uploadedJob("second.pdf");

        assertThat(handshake.confirmUpload(admitted, OWNER).getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(5);

        assertThat(kindOf(() -> handshake.confirmUpload(rejected, OWNER))).isEqualTo(ErrorKind.QUOTA_EXCEEDED);
        JobRecord failed = job(rejected);
        assertThat(failed.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(failed.getErrorKind()).isEqualTo(ErrorKind.QUOTA_EXCEEDED);
        assertThat(failed.getErrorDetail()).isNotBlank();
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(5);
        assertThat(dispatcher.dispatchedJobs()).containsExactly(admitted);
        verify(notifier).jobFailed(any());
    }

    @Test
    void paidOwnersAreNeverCounted() {
        quotaLedger.applyTierChange(OWNER, Tier.PAID);

        for (int i = 0; i < 7; i++) {
            String jobId = uploadedJob("doc-" + i + ".pdf");
            assertThat(handshake.confirmUpload(jobId, OWNER).getStatus()).isEqualTo(JobStatus.QUEUED);
            assertThat(job(jobId).isQuotaCounted()).isFalse();
        }
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isZero();
    }

    @Test
    void concurrentConfirmsAtTheBoundaryAdmitExactlyOne() throws Exception {
        for (int i = 0; i < 4; i++) {
            quotaLedger.checkAndReserve(OWNER);
        }
        List<String> jobIds = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            jobIds.add(uploadedJob("race-" + i + ".pdf"));
        }

        ExecutorService pool = Executors.newFixedThreadPool(jobIds.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (String jobId : jobIds) {
                Callable<Boolean> confirm = () -> {
                    start.await();
                    try {
                        handshake.confirmUpload(jobId, OWNER);
                        return true;
                    } catch (ConversionException e) {
                        return false;
                    }
                };
                results.add(pool.submit(confirm));
            }
            start.countDown();
            int admitted = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(5);
        assertThat(jobStore.findByOwner(OWNER, 100, null).getJobs())
                .filteredOn(job -> job.getStatus() == JobStatus.QUEUED)
                .hasSize(1);
    }

    // ─── confirmation ───────────────────────────────────────────────────────

    @Test
    void confirmingTwiceIsRejectedAndQueuesOnce() {
        String jobId = uploadedJob("report.pdf");

        handshake.confirmUpload(jobId, OWNER);

        assertThat(kindOf(() -> handshake.confirmUpload(jobId, OWNER))).isEqualTo(ErrorKind.INVALID_STATE);
        assertThat(dispatcher.dispatchedJobs()).containsExactly(jobId);
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(1);
        // claim, then queue
        assertThat(job(jobId).getVersion()).isEqualTo(2);
    }

    @Test
    void concurrentConfirmsOfOneJobReserveQuotaOnce() throws Exception {
        for (int i = 0; i < 4; i++) {
            quotaLedger.checkAndReserve(OWNER);
        }
        CountDownLatch reserved = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        HookedQuotaStore hooked = new HookedQuotaStore(() -> { }, () -> {
            reserved.countDown();
            awaitQuietly(proceed);
        });
        wire(settings(20L * 1024 * 1024), hooked);
        String jobId = uploadedJob("report.pdf");

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ConfirmResponse> first = pool.submit(() -> handshake.confirmUpload(jobId, OWNER));
            assertThat(reserved.await(10, TimeUnit.SECONDS)).isTrue();

            // the first confirm holds the last slot and has not queued the job yet
            assertThat(kindOf(() -> handshake.confirmUpload(jobId, OWNER))).isEqualTo(ErrorKind.INVALID_STATE);

            proceed.countDown();
            assertThat(first.get(10, TimeUnit.SECONDS).getStatus()).isEqualTo(JobStatus.QUEUED);
        } finally {
            proceed.countDown();
            pool.shutdownNow();
        }

        assertThat(hooked.reservations()).isEqualTo(1);
        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job(jobId).getErrorKind()).isNull();
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(5);
    }

    @Test
    void storeFailureWhileQueueingGivesTheSlotBack() {
        String jobId = uploadedJob("report.pdf");
        jobStore.failWritesTo(JobStatus.QUEUED);

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> handshake.confirmUpload(jobId, OWNER)).isInstanceOf(StoreException.class);
        }

        JobRecord pending = job(jobId);
        assertThat(pending.getStatus()).isEqualTo(JobStatus.PENDING_UPLOAD);
        assertThat(pending.getConfirmedAt()).isNull();
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isZero();
        assertThat(dispatcher.dispatchedJobs()).isEmpty();

        jobStore.failWritesTo(null);
        assertThat(handshake.confirmUpload(jobId, OWNER).getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(1);
    }

    @Test
    void quotaStoreOutageLeavesTheJobConfirmable() {
        HookedQuotaStore unavailable = new HookedQuotaStore(() -> {
            throw new StoreException("DynamoDB unavailable", null);
        }, () -> { });
        wire(settings(20L * 1024 * 1024), unavailable);
        String jobId = uploadedJob("report.pdf");

        assertThatThrownBy(() -> handshake.confirmUpload(jobId, OWNER)).isInstanceOf(StoreException.class);
        assertThat(job(jobId).getConfirmedAt()).isNull();

        wire(settings(20L * 1024 * 1024));
        assertThat(handshake.confirmUpload(jobId, OWNER).getStatus()).isEqualTo(JobStatus.QUEUED);
    }

    @Test
    void abandonedConfirmClaimLapsesAfterTheProcessingTimeout() {
        String jobId = uploadedJob("report.pdf");
        JobRecord pending = job(jobId);
        // a confirm that claimed the job and then died
        assertThat(jobStore.compareAndSet(pending.getVersion(), pending.toBuilder()
                .confirmedAt(clock.instant())
                .version(pending.getVersion() + 1)
                .build())).isTrue();

        assertThat(kindOf(() -> handshake.confirmUpload(jobId, OWNER))).isEqualTo(ErrorKind.INVALID_STATE);
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isZero();

        clock.advance(Duration.ofMinutes(6));
        assertThat(handshake.confirmUpload(jobId, OWNER).getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(1);
    }

    @Test
    void jobsAreVisibleOnlyToTheirOwner() {
        String jobId = uploadedJob("report.pdf");

        assertThat(kindOf(() -> orchestrator.getStatus(jobId, "intruder"))).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(kindOf(() -> handshake.confirmUpload(jobId, "intruder"))).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(kindOf(() -> orchestrator.getStatus("no-such-job", OWNER))).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(orchestrator.getStatus(jobId, OWNER).getStatus()).isEqualTo(JobStatus.PENDING_UPLOAD);
    }

    @Test
    void listJobsPagesNewestFirst() {
        String older = uploadedJob("older.pdf");
        clock.advance(Duration.ofMinutes(1));
        String middle = uploadedJob("middle.pdf");
        clock.advance(Duration.ofMinutes(1));
        String newer = uploadedJob("newer.pdf");

        JobPage first = orchestrator.listJobs(OWNER, 2, null);
        assertThat(first.getJobs()).extracting(JobRecord::getJobId).containsExactly(newer, middle);

        JobPage second = orchestrator.listJobs(OWNER, 2, first.getNext().encode());
        assertThat(second.getJobs()).extracting(JobRecord::getJobId).containsExactly(older);
        assertThat(second.getNext()).isNull();

        assertThat(orchestrator.listJobs(OWNER, 0, null).getJobs()).hasSize(1);
        assertThat(orchestrator.listJobs("someone-else", 2, null).getJobs()).isEmpty();
    }

    @Test
    void unreadablePageTokenIsAnInvalidRequest() {
        assertThat(kindOf(() -> orchestrator.listJobs(OWNER, 10, "not a token!"))).isEqualTo(ErrorKind.INVALID_REQUEST);
        assertThat(kindOf(() -> orchestrator.listJobs(OWNER, 10, "bm8tc2VwYXJhdG9y"))).isEqualTo(ErrorKind.INVALID_REQUEST);
    }

    // ─── failures and retries ───────────────────────────────────────────────

    @Test
    void documentWithoutTablesFailsAndKeepsTheSlot() {
        when(engine.extract(any())).thenReturn(ExtractionOutcome.failure(FailureKind.NO_TABLES_FOUND,
                "No tables were found in the document."));
        String jobId = uploadedJob("letter.pdf");

        handshake.confirmUpload(jobId, OWNER);
        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.NO_TABLES_FOUND);
        assertThat(job.getErrorDetail()).isEqualTo("No tables were found in the document.");
        assertThat(job.getResultKey()).isNull();
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(1);
    }

    @Test
    void passwordProtectedDocumentFailsAfterOneAttempt() {
        when(engine.extract(any())).thenReturn(ExtractionOutcome.failure(FailureKind.UNPARSABLE_DOCUMENT,
                "The document is password protected."));
        String jobId = uploadedJob("locked.pdf");

        handshake.confirmUpload(jobId, OWNER);
        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.UNPARSABLE_DOCUMENT);
        assertThat(job.getAttemptCount()).isEqualTo(1);
        verify(engine, times(1)).extract(any());
    }

    @Test
    void repeatedTransientFailuresExhaustTheRetries() {
        when(engine.extract(any())).thenReturn(ExtractionOutcome.failure(FailureKind.TRANSIENT, "Throttled"));
        String jobId = uploadedJob("scan.pdf");

        handshake.confirmUpload(jobId, OWNER);
        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.RETRIES_EXHAUSTED);
        assertThat(job.getAttemptCount()).isEqualTo(3);
        assertThat(job.getErrorDetail()).contains("Throttled");
        assertThat(dispatcher.delays()).containsExactly(Duration.ZERO, Duration.ofSeconds(10), Duration.ofSeconds(20));
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(1);
        JobStateMachine.checkInvariants(job);
    }

    @Test
    void transientFailureIsRetriedUntilItSucceeds() {
        when(engine.extract(any()))
                .thenReturn(ExtractionOutcome.failure(FailureKind.TRANSIENT, "Timed out"))
                .thenReturn(success(table(1, "a", "b")));
        String jobId = uploadedJob("scan.pdf");

        handshake.confirmUpload(jobId, OWNER);
        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getAttemptCount()).isEqualTo(2);
        assertThat(job.getProcessingStartedAt()).isNotNull();
    }

    @Test
    void storageWriteFailuresAreTreatedAsTransient() {
        when(engine.extract(any())).thenReturn(success(table(1, "a", "b")));
        String jobId = uploadedJob("report.pdf");
        handshake.confirmUpload(jobId, OWNER);

        blobStore.failWrites(true);
        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.RETRIES_EXHAUSTED);
        assertThat(job.getErrorDetail()).contains("Simulated write failure");
    }

    @Test
    void missingSourceFailsAndGivesTheSlotBack() {
        UploadResponse upload = handshake.requestUpload(OWNER, pdfRequest("never-uploaded.pdf"));

        handshake.confirmUpload(upload.getJobId(), OWNER);
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(1);
        dispatcher.runAll();

        JobRecord job = job(upload.getJobId());
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.SOURCE_MISSING);
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isZero();
        verify(engine, never()).extract(any());
    }

    @Test
    void oversizedSourceFailsAndGivesTheSlotBack() {
        wire(settings(16));
        String jobId = uploadedJob("huge.pdf");

        handshake.confirmUpload(jobId, OWNER);
        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.FILE_TOO_LARGE);
        assertThat(job.getErrorDetail()).contains("limit is 16 bytes");
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isZero();
        verify(engine, never()).extract(any());
    }

    @Test
    void sourceMissingAfterAFailedSizeCheckStillGivesTheSlotBack() {
        UploadResponse upload = handshake.requestUpload(OWNER, pdfRequest("never-uploaded.pdf"));
        handshake.confirmUpload(upload.getJobId(), OWNER);

        blobStore.failNextSizeChecks(1);
        dispatcher.runAll();

        JobRecord job = job(upload.getJobId());
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.SOURCE_MISSING);
        assertThat(job.getAttemptCount()).isEqualTo(2);
        assertThat(job.isExtractionAttempted()).isFalse();
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isZero();
    }

    @Test
    void sourceVanishingAfterAnExtractionKeepsTheSlot() {
        String jobId = uploadedJob("report.pdf");
        when(engine.extract(any())).thenAnswer(invocation -> {
            blobStore.delete(job(jobId).getSourceKey());
            return ExtractionOutcome.failure(FailureKind.TRANSIENT, "Throttled");
        });
        handshake.confirmUpload(jobId, OWNER);

        dispatcher.runAll();

        JobRecord job = job(jobId);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.SOURCE_MISSING);
        assertThat(job.isExtractionAttempted()).isTrue();
        assertThat(quotaLedger.usage(OWNER).getUsedCount()).isEqualTo(1);
    }

    // ─── stuck-job sweep ────────────────────────────────────────────────────

    @Test
    void lateResultOfATimedOutWorkerIsDiscarded() {
        String jobId = uploadedJob("slow.pdf");
        when(engine.extract(any()))
                .thenAnswer(invocation -> {
                    // the worker stalls past the timeout and the sweep takes the job back
                    clock.advance(Duration.ofMinutes(6));
                    assertThat(orchestrator.sweepStuckJobs()).isEqualTo(1);
                    return success(table(1, "late", "result"));
                })
                .thenReturn(success(table(1, "fresh", "result")));

        handshake.confirmUpload(jobId, OWNER);
        dispatcher.runNext();

        JobRecord requeued = job(jobId);
        assertThat(requeued.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(requeued.getResultKey()).isNull();
        verify(notifier, never()).jobCompleted(any());

        dispatcher.runAll();
        JobRecord completed = job(jobId);
        assertThat(completed.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.getAttemptCount()).isEqualTo(2);
        verify(notifier, times(1)).jobCompleted(any());
    }

    @Test
    void sweepDispatchesQueuedJobsNobodyPickedUp() {
        when(engine.extract(any())).thenReturn(success(table(1, "a", "b")));
        String jobId = uploadedJob("report.pdf");
        handshake.confirmUpload(jobId, OWNER);

        assertThat(orchestrator.sweepStuckJobs()).isZero();
        clock.advance(Duration.ofMinutes(6));
        assertThat(orchestrator.sweepStuckJobs()).isEqualTo(1);
        assertThat(dispatcher.dispatchedJobs()).containsExactly(jobId, jobId);

        dispatcher.runAll();
        assertThat(job(jobId).getStatus()).isEqualTo(JobStatus.COMPLETED);
        verify(engine, times(1)).extract(any());
    }

    @Test
    void sweepFailsAStuckJobOnItsLastAttempt() {
        String jobId = uploadedJob("stuck.pdf");
        handshake.confirmUpload(jobId, OWNER);
        JobRecord queued = job(jobId);
        JobRecord processing = queued.toBuilder()
                .status(JobStatus.PROCESSING)
                .attemptCount(3)
                .processingStartedAt(clock.instant())
                .updatedAt(clock.instant())
                .version(queued.getVersion() + 1)
                .build();
        assertThat(jobStore.compareAndSet(queued.getVersion(), processing)).isTrue();

        clock.advance(Duration.ofMinutes(10));
        orchestrator.sweepStuckJobs();

        JobRecord job = job(jobId);
        assertThat(job.getStatus()).isEqualTo(JobStatus.FAILED);
        assertThat(job.getErrorKind()).isEqualTo(ErrorKind.RETRIES_EXHAUSTED);
        assertThat(job.getErrorDetail()).contains("timed out");
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    private String uploadedJob(String fileName) {
        UploadResponse upload = handshake.requestUpload(OWNER, pdfRequest(fileName));
        blobStore.put(job(upload.getJobId()).getSourceKey(), PDF, "application/pdf");
        return upload.getJobId();
    }

    private static UploadRequest pdfRequest(String fileName) {
        return UploadRequest.builder().fileName(fileName).contentType("application/pdf").build();
    }

    private JobRecord job(String jobId) {
        return jobStore.find(jobId).orElseThrow();
    }

    private static ExtractedTable table(int page, String left, String right) {
        return new ExtractedTable(page, 100f, List.of(List.of(left, right), List.of("1", "2")));
    }

    private static ExtractionOutcome success(ExtractedTable... tables) {
        return ExtractionOutcome.success(new ExtractionResult(List.of(tables), List.of(), ExtractionStrategy.STRUCTURED));
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /**
     * Job store that can be told to fail every write into one status.
     */
    static class FlakyJobStore extends InMemoryJobStore {

        private volatile JobStatus failingStatus;

        void failWritesTo(JobStatus status) {
            failingStatus = status;
        }

        @Override
        public boolean compareAndSet(long expectedVersion, JobRecord next) {
            if (next.getStatus() == failingStatus) {
                throw new StoreException("DynamoDB unavailable", null);
            }
            return super.compareAndSet(expectedVersion, next);
        }
    }

    /**
     * Delegates to the shared quota store and runs hooks around each reservation.
     */
    private class HookedQuotaStore implements QuotaStore {

        private final Runnable beforeReserve;
        private final Runnable afterReserve;
        private final AtomicInteger reservations = new AtomicInteger();

        HookedQuotaStore(Runnable beforeReserve, Runnable afterReserve) {
            this.beforeReserve = beforeReserve;
            this.afterReserve = afterReserve;
        }

        int reservations() {
            return reservations.get();
        }

        @Override
        public QuotaRecord getOrCreate(String ownerId, Instant periodAnchor, Instant now) {
            return quotaStore.getOrCreate(ownerId, periodAnchor, now);
        }

        @Override
        public QuotaDecision reserve(String ownerId, int allotment, Instant windowStart, Instant now) {
            beforeReserve.run();
            reservations.incrementAndGet();
            QuotaDecision decision = quotaStore.reserve(ownerId, allotment, windowStart, now);
            afterReserve.run();
            return decision;
        }

        @Override
        public void release(String ownerId, Instant now) {
            quotaStore.release(ownerId, now);
        }

        @Override
        public QuotaRecord applyTier(String ownerId, Tier tier, Instant periodAnchor, Instant now) {
            return quotaStore.applyTier(ownerId, tier, periodAnchor, now);
        }
    }

    private static ErrorKind kindOf(ThrowingCallable call) {
        ConversionException e = catchThrowableOfType(call, ConversionException.class);
        assertThat(e).as("expected a ConversionException").isNotNull();
        return e.getKind();
    }
}
