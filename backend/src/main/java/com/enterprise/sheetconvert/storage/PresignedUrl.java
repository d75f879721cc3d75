package com.enterprise.sheetconvert.storage;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A time-limited URL granting direct access to one blob.
 */
@Value
@Builder
public class PresignedUrl {
    String url;
    String method;
    Map<String, String> headers;
    Instant expiresAt;
}
