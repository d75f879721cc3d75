package com.enterprise.sheetconvert.service;

import com.enterprise.sheetconvert.model.JobRecord;

/**
 * Told about every job that reaches a terminal state. Called after the state is
 * persisted; implementations must not throw.
 */
public interface JobNotifier {

    void jobCompleted(JobRecord job);

    void jobFailed(JobRecord job);
}
