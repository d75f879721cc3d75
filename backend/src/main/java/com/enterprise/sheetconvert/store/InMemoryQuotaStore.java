package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.model.QuotaDecision;
import com.enterprise.sheetconvert.model.QuotaRecord;
import com.enterprise.sheetconvert.model.Tier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Quota store for local runs and tests. Each operation is a single per-key compute,
 * which makes check-and-increment atomic per owner.
 */
@Repository
@ConditionalOnProperty(name = "conversion.store", havingValue = "memory")
public class InMemoryQuotaStore implements QuotaStore {

    private final ConcurrentMap<String, QuotaRecord> quotas = new ConcurrentHashMap<>();

    @Override
    public QuotaRecord getOrCreate(String ownerId, Instant periodAnchor, Instant now) {
        return quotas.computeIfAbsent(ownerId, id -> fresh(id, periodAnchor, now)).toBuilder().build();
    }

    @Override
    public QuotaDecision reserve(String ownerId, int allotment, Instant windowStart, Instant now) {
        AtomicReference<QuotaDecision> decision = new AtomicReference<>();
        quotas.compute(ownerId, (id, current) -> {
            QuotaRecord record = current != null ? current : fresh(id, windowStart, now);
            if (record.getTier() == Tier.PAID) {
                decision.set(QuotaDecision.allowedUncounted());
                return record;
            }
            QuotaRecord.QuotaRecordBuilder next = record.toBuilder();
            int used = record.getUsedCount();
            if (record.getPeriodAnchor().isBefore(windowStart)) {
                used = 0;
                next.periodAnchor(windowStart);
            }
            if (used >= allotment) {
                decision.set(QuotaDecision.denied());
                return record;
            }
            decision.set(QuotaDecision.allowedCounted());
            return next.usedCount(used + 1).updatedAt(now).version(record.getVersion() + 1).build();
        });
        return decision.get();
    }

    @Override
    public void release(String ownerId, Instant now) {
        quotas.computeIfPresent(ownerId, (id, record) -> record.getUsedCount() == 0
                ? record
                : record.toBuilder()
                        .usedCount(record.getUsedCount() - 1)
                        .updatedAt(now)
                        .version(record.getVersion() + 1)
                        .build());
    }

    @Override
    public QuotaRecord applyTier(String ownerId, Tier tier, Instant periodAnchor, Instant now) {
        return quotas.compute(ownerId, (id, current) -> {
            QuotaRecord record = current != null ? current : fresh(id, periodAnchor, now);
            return record.toBuilder().tier(tier).updatedAt(now).version(record.getVersion() + 1).build();
        }).toBuilder().build();
    }

    private static QuotaRecord fresh(String ownerId, Instant periodAnchor, Instant now) {
        return QuotaRecord.builder()
                .ownerId(ownerId)
                .tier(Tier.FREE)
                .usedCount(0)
                .periodAnchor(periodAnchor)
                .updatedAt(now)
                .version(0)
                .build();
    }
}
