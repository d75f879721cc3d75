package com.enterprise.sheetconvert.service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;

/**
 * When free-tier counters start over. Windows are aligned to UTC.
 */
public enum QuotaResetPolicy {
    NEVER {
        @Override
        public Instant windowStart(Instant now) {
            return Instant.EPOCH;
        }
    },
    DAILY {
        @Override
        public Instant windowStart(Instant now) {
            return now.truncatedTo(ChronoUnit.DAYS);
        }
    },
    MONTHLY {
        @Override
        public Instant windowStart(Instant now) {
            LocalDate date = LocalDate.ofInstant(now, ZoneOffset.UTC);
            return date.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
        }
    };

    /**
     * Start of the window {@code now} falls into.
     */
    public abstract Instant windowStart(Instant now);
}
