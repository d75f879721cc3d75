package com.enterprise.sheetconvert.service;

import com.enterprise.sheetconvert.config.ConversionSettings;
import com.enterprise.sheetconvert.exception.ConversionException;
import com.enterprise.sheetconvert.model.ConfirmResponse;
import com.enterprise.sheetconvert.model.ErrorKind;
import com.enterprise.sheetconvert.model.JobRecord;
import com.enterprise.sheetconvert.model.JobStatus;
import com.enterprise.sheetconvert.model.UploadRequest;
import com.enterprise.sheetconvert.model.UploadResponse;
import com.enterprise.sheetconvert.storage.BlobStore;
import com.enterprise.sheetconvert.storage.PresignedUrl;
import com.enterprise.sheetconvert.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * First half of a conversion: hands out a presigned upload location and registers the
 * pending job, then admits it once the client confirms the upload.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UploadHandshakeService {

    static final String PDF_CONTENT_TYPE = "application/pdf";

    private final JobStore jobStore;
    private final BlobStore blobStore;
    private final ConversionOrchestrator orchestrator;
    private final ConversionSettings settings;
    private final Clock clock;

    public UploadResponse requestUpload(String ownerId, UploadRequest request) {
        String contentType = normaliseContentType(request.getContentType());
        if (!PDF_CONTENT_TYPE.equals(contentType)) {
            throw new ConversionException(ErrorKind.UNSUPPORTED_TYPE,
                    "Unsupported content type '" + request.getContentType() + "'. Only PDF documents are accepted.");
        }

        String jobId = UUID.randomUUID().toString();
        String fileName = BlobKeys.displayName(request.getFileName());
        String sourceKey = BlobKeys.sourceKey(settings.getUploadPrefix(), ownerId, jobId, fileName);

        // presign before registering so a storage failure leaves no orphaned job
        PresignedUrl upload = blobStore.issueUploadUrl(sourceKey, PDF_CONTENT_TYPE, settings.getUploadUrlTtl());

        Instant now = clock.instant();
        jobStore.create(JobRecord.builder()
                .jobId(jobId)
                .ownerId(ownerId)
                .fileName(fileName)
                .status(JobStatus.PENDING_UPLOAD)
                .sourceKey(sourceKey)
                .createdAt(now)
                .updatedAt(now)
                .attemptCount(0)
                .quotaCounted(false)
                .warnings(List.of())
                .version(0)
                .build());
        log.info("Upload slot issued: jobId={}, owner={}, file={}", jobId, ownerId, fileName);

        return UploadResponse.builder()
                .jobId(jobId)
                .fileName(fileName)
                .status(JobStatus.PENDING_UPLOAD)
                .uploadUrl(upload.getUrl())
                .uploadMethod(upload.getMethod())
                .uploadFields(upload.getHeaders())
                .expiresAt(upload.getExpiresAt())
                .message("Upload the PDF to uploadUrl, then confirm the job to start the conversion.")
                .build();
    }

    public ConfirmResponse confirmUpload(String jobId, String ownerId) {
        JobRecord job = orchestrator.ownedJob(jobId, ownerId);
        if (job.getStatus() != JobStatus.PENDING_UPLOAD) {
            throw new ConversionException(ErrorKind.INVALID_STATE,
                    "Job " + jobId + " is " + job.getStatus() + " and cannot be confirmed again");
        }
        JobRecord queued = orchestrator.admit(job);
        log.info("Upload confirmed: jobId={}, owner={}", jobId, ownerId);
        return ConfirmResponse.builder()
                .jobId(queued.getJobId())
                .status(queued.getStatus())
                .build();
    }

    // "Application/PDF; charset=binary" is still a PDF
    static String normaliseContentType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int params = contentType.indexOf(';');
        String base = params >= 0 ? contentType.substring(0, params) : contentType;
        return base.strip().toLowerCase(Locale.ROOT);
    }
}
