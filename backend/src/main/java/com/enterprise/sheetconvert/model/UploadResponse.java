package com.enterprise.sheetconvert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Upload descriptor: where and how the client sends the PDF before confirming the job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UploadResponse {
    private String jobId;
    private String fileName;
    private JobStatus status;
    private String uploadUrl;
    private String uploadMethod;
    private Map<String, String> uploadFields; // headers the client must send with the upload
    private Instant expiresAt;
    private String message;
}
