package com.enterprise.sheetconvert.service;

import com.enterprise.sheetconvert.model.JobRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingJobNotifier implements JobNotifier {

    @Override
    public void jobCompleted(JobRecord job) {
        log.info("Conversion ready: jobId={}, owner={}, file={}, tables={}",
                job.getJobId(), job.getOwnerId(), job.getFileName(), job.getTableCount());
    }

    @Override
    public void jobFailed(JobRecord job) {
        log.info("Conversion failed: jobId={}, owner={}, file={}, kind={}, detail={}",
                job.getJobId(), job.getOwnerId(), job.getFileName(),
                job.getErrorKind() != null ? job.getErrorKind().code() : null, job.getErrorDetail());
    }
}
