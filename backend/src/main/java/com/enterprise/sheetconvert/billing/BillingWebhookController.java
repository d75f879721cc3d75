package com.enterprise.sheetconvert.billing;

import com.enterprise.sheetconvert.exception.ConversionException;
import com.enterprise.sheetconvert.model.ErrorKind;
import com.enterprise.sheetconvert.model.QuotaRecord;
import com.enterprise.sheetconvert.model.TierUpdateRequest;
import com.enterprise.sheetconvert.model.UsageResponse;
import com.enterprise.sheetconvert.service.QuotaLedger;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Receives tier changes from the payment provider. Callers prove themselves with the
 * shared secret in {@code X-Billing-Secret}; with no secret configured every call is refused.
 */
@Slf4j
@RestController
@Tag(name = "Billing", description = "Tier-change webhook for the payment provider")
public class BillingWebhookController {

    public static final String SECRET_HEADER = "X-Billing-Secret";

    private final QuotaLedger quotaLedger;
    private final byte[] webhookSecret;

    public BillingWebhookController(QuotaLedger quotaLedger, @Value("${billing.webhook-secret:}") String webhookSecret) {
        this.quotaLedger = quotaLedger;
        this.webhookSecret = webhookSecret.getBytes(StandardCharsets.UTF_8);
    }

    @PostMapping("/billing/tier")
    @Operation(summary = "Apply a tier change for a user")
    public UsageResponse updateTier(@RequestHeader(value = SECRET_HEADER, required = false) String secret,
            @Valid @RequestBody TierUpdateRequest request) {
        if (!authorised(secret)) {
            log.warn("Rejected billing webhook for owner={}", request.getOwnerId());
            throw new ConversionException(ErrorKind.FORBIDDEN, "Invalid billing secret");
        }
        QuotaRecord record = quotaLedger.applyTierChange(request.getOwnerId(), request.getTier());
        log.info("Billing tier applied: owner={}, tier={}", record.getOwnerId(), record.getTier());
        return quotaLedger.usage(request.getOwnerId());
    }

    private boolean authorised(String secret) {
        if (webhookSecret.length == 0 || secret == null) {
            return false;
        }
        return MessageDigest.isEqual(webhookSecret, secret.getBytes(StandardCharsets.UTF_8));
    }
}
