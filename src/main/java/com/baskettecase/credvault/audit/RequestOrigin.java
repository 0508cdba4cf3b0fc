package com.baskettecase.credvault.audit;

/**
 * Where a vault call came from, as reported by the layer that received it.
 * Either field may be null.
 *
 * @param ipAddress client address, IPv4 or IPv6 (at most 45 characters)
 * @param userAgent client user agent string
 */
public record RequestOrigin(
    String ipAddress,
    String userAgent
) {

    public static final RequestOrigin UNKNOWN = new RequestOrigin(null, null);
}
