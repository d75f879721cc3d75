package com.enterprise.sheetconvert.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Runs processing tasks on the dedicated worker pool. Nothing a task throws escapes
 * into the pool.
 */
@Slf4j
@Component
public class ExecutorJobDispatcher implements JobDispatcher {

    private final ScheduledExecutorService workerPool;

    public ExecutorJobDispatcher(@Qualifier("conversionWorkerPool") ScheduledExecutorService workerPool) {
        this.workerPool = workerPool;
    }

    @Override
    public void dispatch(String jobId, Duration delay, Runnable task) {
        Runnable guarded = () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Worker task failed for jobId={}", jobId, e);
            }
        };
        try {
            workerPool.schedule(guarded, delay.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Dispatched jobId={} with delay {}", jobId, delay);
        } catch (RejectedExecutionException e) {
            // pool shutting down; the stuck-job sweep picks the job up after restart
            log.warn("Worker pool rejected jobId={}: {}", jobId, e.getMessage());
        }
    }
}
