package com.enterprise.sheetconvert.model;

import lombok.Value;

/**
 * Result of a quota reservation. {@code counted} is true only when a free-tier slot
 * was actually taken, so a later release gives back exactly what was reserved.
 */
@Value
public class QuotaDecision {
    boolean allowed;
    boolean counted;
    ErrorKind reason;

    public static QuotaDecision allowedCounted() {
        return new QuotaDecision(true, true, null);
    }

    public static QuotaDecision allowedUncounted() {
        return new QuotaDecision(true, false, null);
    }

    public static QuotaDecision denied() {
        return new QuotaDecision(false, false, ErrorKind.QUOTA_EXCEEDED);
    }
}
