package com.enterprise.sheetconvert.controller;

import com.enterprise.sheetconvert.identity.OwnerResolver;
import com.enterprise.sheetconvert.model.ConfirmResponse;
import com.enterprise.sheetconvert.model.DownloadResponse;
import com.enterprise.sheetconvert.model.JobListResponse;
import com.enterprise.sheetconvert.model.JobView;
import com.enterprise.sheetconvert.model.UploadRequest;
import com.enterprise.sheetconvert.model.UploadResponse;
import com.enterprise.sheetconvert.service.ConversionOrchestrator;
import com.enterprise.sheetconvert.service.UploadHandshakeService;
import com.enterprise.sheetconvert.storage.PresignedUrl;
import com.enterprise.sheetconvert.store.JobPage;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/jobs")
@RequiredArgsConstructor
@Tag(name = "Conversion Jobs", description = "Upload handshake, status polling and workbook download")
public class JobController {

    private final UploadHandshakeService handshakeService;
    private final ConversionOrchestrator orchestrator;
    private final OwnerResolver ownerResolver;

    // ─────────────────────────────────────────────────────────────────────
    // POST /jobs
    // ─────────────────────────────────────────────────────────────────────
    @PostMapping
    @Operation(summary = "Request a presigned upload location and register a pending job")
    public ResponseEntity<UploadResponse> requestUpload(@Valid @RequestBody UploadRequest request,
            HttpServletRequest httpRequest) {
        String ownerId = ownerResolver.resolve(httpRequest);
        return ResponseEntity.ok(handshakeService.requestUpload(ownerId, request));
    }

    // ─────────────────────────────────────────────────────────────────────
    // POST /jobs/{jobId}/confirm
    // ─────────────────────────────────────────────────────────────────────
    @PostMapping("/{jobId}/confirm")
    @Operation(summary = "Confirm the upload and queue the job for conversion")
    public ResponseEntity<ConfirmResponse> confirm(@PathVariable String jobId, HttpServletRequest httpRequest) {
        String ownerId = ownerResolver.resolve(httpRequest);
        return ResponseEntity.ok(handshakeService.confirmUpload(jobId, ownerId));
    }

    // ─────────────────────────────────────────────────────────────────────
    // GET /jobs/{jobId}
    // ─────────────────────────────────────────────────────────────────────
    @GetMapping("/{jobId}")
    @Operation(summary = "Get the status of a conversion job")
    public JobView getStatus(@PathVariable String jobId, HttpServletRequest httpRequest) {
        String ownerId = ownerResolver.resolve(httpRequest);
        return JobView.from(orchestrator.getStatus(jobId, ownerId));
    }

    // ─────────────────────────────────────────────────────────────────────
    // GET /jobs/{jobId}/download
    // ─────────────────────────────────────────────────────────────────────
    @GetMapping("/{jobId}/download")
    @Operation(summary = "Get a presigned download URL for the generated workbook")
    public DownloadResponse download(@PathVariable String jobId, HttpServletRequest httpRequest) {
        String ownerId = ownerResolver.resolve(httpRequest);
        PresignedUrl url = orchestrator.getDownloadUrl(jobId, ownerId);
        return DownloadResponse.builder()
                .jobId(jobId)
                .downloadUrl(url.getUrl())
                .expiresAt(url.getExpiresAt())
                .build();
    }

    // ─────────────────────────────────────────────────────────────────────
    // GET /jobs
    // ─────────────────────────────────────────────────────────────────────
    @GetMapping
    @Operation(summary = "List the caller's conversion jobs, newest first, one page at a time")
    public JobListResponse listJobs(
            @RequestParam(defaultValue = "" + ConversionOrchestrator.DEFAULT_PAGE_SIZE) int limit,
            @RequestParam(required = false) String pageToken,
            HttpServletRequest httpRequest) {
        String ownerId = ownerResolver.resolve(httpRequest);
        JobPage page = orchestrator.listJobs(ownerId, limit, pageToken);
        return JobListResponse.builder()
                .jobs(page.getJobs().stream().map(JobView::from).collect(Collectors.toList()))
                .nextPageToken(page.getNext() != null ? page.getNext().encode() : null)
                .build();
    }
}
