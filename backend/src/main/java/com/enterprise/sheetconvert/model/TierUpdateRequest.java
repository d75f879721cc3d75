package com.enterprise.sheetconvert.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of the billing provider's tier-change webhook.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TierUpdateRequest {
    @NotBlank
    private String ownerId;
    @NotNull
    private Tier tier;
}
