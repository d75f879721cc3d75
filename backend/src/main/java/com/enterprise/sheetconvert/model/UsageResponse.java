package com.enterprise.sheetconvert.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageResponse {
    private String ownerId;
    private Tier tier;
    private int usedCount;
    private int allotment;
    private Integer remaining; // null when the tier is unlimited
    private Instant periodAnchor;
    private String resetPolicy;
}
