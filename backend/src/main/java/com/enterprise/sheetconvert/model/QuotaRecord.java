package com.enterprise.sheetconvert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuotaRecord {
    private String ownerId;
    private Tier tier;
    private int usedCount;
    private Instant periodAnchor; // start of the window usedCount belongs to
    private Instant updatedAt;
    private long version;
}
