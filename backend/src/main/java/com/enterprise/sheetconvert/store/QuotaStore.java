package com.enterprise.sheetconvert.store;

import com.enterprise.sheetconvert.model.QuotaDecision;
import com.enterprise.sheetconvert.model.QuotaRecord;
import com.enterprise.sheetconvert.model.Tier;

import java.time.Instant;

/**
 * Per-owner quota counters. Records are created lazily as FREE with a zero count.
 */
public interface QuotaStore {

    QuotaRecord getOrCreate(String ownerId, Instant periodAnchor, Instant now);

    /**
     * Atomically takes one free-tier slot if fewer than {@code allotment} are used in the
     * window starting at {@code windowStart}. A counter anchored before the window is
     * reset first. Paid owners are always allowed and never counted.
     *
     * @throws com.enterprise.sheetconvert.exception.StoreException when no decision could be reached
     */
    QuotaDecision reserve(String ownerId, int allotment, Instant windowStart, Instant now);

    /**
     * Gives back one slot, never going below zero.
     */
    void release(String ownerId, Instant now);

    QuotaRecord applyTier(String ownerId, Tier tier, Instant periodAnchor, Instant now);
}
