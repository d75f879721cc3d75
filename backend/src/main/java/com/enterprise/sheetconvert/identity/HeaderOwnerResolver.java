package com.enterprise.sheetconvert.identity;

import com.enterprise.sheetconvert.exception.ConversionException;
import com.enterprise.sheetconvert.model.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.stereotype.Component;

/**
 * Trusts the owner id the upstream gateway puts in {@code X-Owner-Id} after authenticating the caller.
 */
@Component
public class HeaderOwnerResolver implements OwnerResolver {

    public static final String OWNER_HEADER = "X-Owner-Id";

    @Override
    public String resolve(HttpServletRequest request) {
        String ownerId = request.getHeader(OWNER_HEADER);
        if (ownerId == null || ownerId.isBlank()) {
            throw new ConversionException(ErrorKind.UNAUTHENTICATED, "Missing " + OWNER_HEADER + " header");
        }
        return ownerId.strip();
    }
}
