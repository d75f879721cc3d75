package com.enterprise.sheetconvert.config;

import com.enterprise.sheetconvert.service.QuotaResetPolicy;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Tunables of the conversion pipeline, bound from {@code conversion.*} and {@code aws.s3.*}.
 */
@Value
@Builder
public class ConversionSettings {
    String uploadPrefix;
    String resultPrefix;
    Duration uploadUrlTtl;
    Duration downloadUrlTtl;
    int maxAttempts;
    Duration retryBackoff;
    Duration processingTimeout;
    long maxSourceBytes;
    int freeAllotment;
    QuotaResetPolicy quotaResetPolicy;
}
