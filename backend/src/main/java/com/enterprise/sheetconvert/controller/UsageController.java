package com.enterprise.sheetconvert.controller;

import com.enterprise.sheetconvert.identity.OwnerResolver;
import com.enterprise.sheetconvert.model.UsageResponse;
import com.enterprise.sheetconvert.service.QuotaLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Usage", description = "Conversion quota of the caller")
public class UsageController {

    private final QuotaLedger quotaLedger;
    private final OwnerResolver ownerResolver;

    @GetMapping("/usage")
    @Operation(summary = "Get the caller's tier and conversions used in the current window")
    public UsageResponse usage(HttpServletRequest httpRequest) {
        return quotaLedger.usage(ownerResolver.resolve(httpRequest));
    }
}
