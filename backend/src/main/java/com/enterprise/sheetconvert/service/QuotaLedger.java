package com.enterprise.sheetconvert.service;

import com.enterprise.sheetconvert.config.ConversionSettings;
import com.enterprise.sheetconvert.model.QuotaDecision;
import com.enterprise.sheetconvert.model.QuotaRecord;
import com.enterprise.sheetconvert.model.Tier;
import com.enterprise.sheetconvert.model.UsageResponse;
import com.enterprise.sheetconvert.store.QuotaStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Per-owner admission counter on top of {@link QuotaStore}. Only jobs admitted to
 * QUEUED consume a slot; the window comes from the configured {@link QuotaResetPolicy}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuotaLedger {

    private final QuotaStore quotaStore;
    private final ConversionSettings settings;
    private final Clock clock;

    public QuotaDecision checkAndReserve(String ownerId) {
        Instant now = clock.instant();
        QuotaDecision decision = quotaStore.reserve(ownerId, settings.getFreeAllotment(), windowStart(now), now);
        if (decision.isAllowed()) {
            log.info("Quota reserved: owner={}, counted={}", ownerId, decision.isCounted());
        } else {
            log.info("Quota exceeded: owner={}, allotment={}", ownerId, settings.getFreeAllotment());
        }
        return decision;
    }

    public void release(String ownerId) {
        quotaStore.release(ownerId, clock.instant());
    }

    public QuotaRecord applyTierChange(String ownerId, Tier tier) {
        Instant now = clock.instant();
        return quotaStore.applyTier(ownerId, tier, windowStart(now), now);
    }

    public UsageResponse usage(String ownerId) {
        Instant now = clock.instant();
        Instant windowStart = windowStart(now);
        QuotaRecord record = quotaStore.getOrCreate(ownerId, windowStart, now);
        // a counter from an earlier window is reset lazily on the next reservation
        boolean stale = record.getPeriodAnchor().isBefore(windowStart);
        int used = stale ? 0 : record.getUsedCount();
        int allotment = settings.getFreeAllotment();
        return UsageResponse.builder()
                .ownerId(ownerId)
                .tier(record.getTier())
                .usedCount(used)
                .allotment(allotment)
                .remaining(record.getTier() == Tier.PAID ? null : Math.max(0, allotment - used))
                .periodAnchor(stale ? windowStart : record.getPeriodAnchor())
                .resetPolicy(settings.getQuotaResetPolicy().name())
                .build();
    }

    private Instant windowStart(Instant now) {
        return settings.getQuotaResetPolicy().windowStart(now);
    }
}
