package com.enterprise.sheetconvert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Client-facing projection of a {@link JobRecord}. Storage keys and the version stay internal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobView {
    private String jobId;
    private String fileName;
    private JobStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private int attemptCount;
    private boolean hasResult;
    private Integer tableCount;
    private String strategy;
    private List<String> warnings;
    private String errorKind;
    private ErrorKind.Category errorCategory;
    private String errorDetail;

    public static JobView from(JobRecord job) {
        JobViewBuilder view = JobView.builder()
                .jobId(job.getJobId())
                .fileName(job.getFileName())
                .status(job.getStatus())
                .createdAt(job.getCreatedAt())
                .updatedAt(job.getUpdatedAt())
                .attemptCount(job.getAttemptCount())
                .hasResult(job.getResultKey() != null)
                .tableCount(job.getTableCount())
                .strategy(job.getStrategy())
                .warnings(job.getWarnings())
                .errorDetail(job.getErrorDetail());
        if (job.getErrorKind() != null) {
            view.errorKind(job.getErrorKind().code()).errorCategory(job.getErrorKind().category());
        }
        return view.build();
    }
}
