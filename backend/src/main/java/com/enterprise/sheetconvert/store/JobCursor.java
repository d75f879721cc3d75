package com.enterprise.sheetconvert.store;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Position in an owner's job list, newest first: the last job of the previous page.
 * Travels to clients as an opaque URL-safe token.
 */
@Value
public class JobCursor {
    Instant createdAt;
    String jobId;

    public String encode() {
        String raw = createdAt + "|" + jobId;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws IllegalArgumentException when the token was not produced by {@link #encode()}
     */
    public static JobCursor decode(String token) {
        String raw = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
        int separator = raw.indexOf('|');
        if (separator <= 0 || separator == raw.length() - 1) {
            throw new IllegalArgumentException("Malformed page token");
        }
        try {
            return new JobCursor(Instant.parse(raw.substring(0, separator)), raw.substring(separator + 1));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Malformed page token", e);
        }
    }
}
