package com.enterprise.sheetconvert.worker;

import com.enterprise.sheetconvert.service.ConversionOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "conversion.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class StuckJobSweeper {

    private final ConversionOrchestrator orchestrator;

    @Scheduled(fixedDelayString = "${conversion.sweep.interval-ms:60000}",
            initialDelayString = "${conversion.sweep.interval-ms:60000}")
    public void sweep() {
        try {
            orchestrator.sweepStuckJobs();
        } catch (RuntimeException e) {
            log.error("Stuck-job sweep failed", e);
        }
    }
}
