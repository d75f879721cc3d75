package com.enterprise.sheetconvert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A conversion job as persisted in the job store. Only the orchestrator changes it,
 * always through a version-checked write.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {
    private String jobId;
    private String ownerId;
    private String fileName;
    private JobStatus status;
    private String sourceKey;
    private String resultKey;      // COMPLETED only
    private ErrorKind errorKind;   // FAILED only
    private String errorDetail;    // FAILED only
    private Instant createdAt;
    private Instant updatedAt;
    private Instant confirmedAt;   // set by the confirm that owns admission
    private Instant processingStartedAt;
    private int attemptCount;
    private boolean quotaCounted;
    private boolean extractionAttempted;
    private Integer tableCount;
    private String strategy;
    private List<String> warnings;
    private long version;
}
