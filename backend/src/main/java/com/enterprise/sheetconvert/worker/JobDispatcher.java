package com.enterprise.sheetconvert.worker;

import java.time.Duration;

/**
 * Hands a job's processing task to a worker, optionally after a delay.
 */
public interface JobDispatcher {

    void dispatch(String jobId, Duration delay, Runnable task);
}
