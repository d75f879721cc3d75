package com.enterprise.sheetconvert.identity;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Determines the authenticated owner of a request.
 */
public interface OwnerResolver {

    /**
     * @throws com.enterprise.sheetconvert.exception.ConversionException with kind
     *         UNAUTHENTICATED when the request carries no identity
     */
    String resolve(HttpServletRequest request);
}
