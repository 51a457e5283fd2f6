package com.bookedbarber.ratelimit.identity;

/**
 * Subject being rate limited, derived fresh for every request.
 *
 * @param apiKeyId  stable identifier of the presented API key, never the raw secret
 * @param userId    authenticated user, if any
 * @param ipAddress client address, always present ("unknown" when it cannot be determined)
 */
public record Identity(String apiKeyId, String userId, String ipAddress) {

    public Identity {
        ipAddress = (ipAddress == null || ipAddress.isBlank()) ? "unknown" : ipAddress;
    }

    /**
     * Builds an identity from loosely supplied fields; blank values count as absent.
     */
    public static Identity of(String apiKeyId, String userId, String ipAddress) {
        return new Identity(blankToNull(apiKeyId), blankToNull(userId), ipAddress);
    }

    public static Identity ofIp(String ipAddress) {
        return new Identity(null, null, ipAddress);
    }

    public static Identity ofUser(String userId, String ipAddress) {
        return new Identity(null, userId, ipAddress);
    }

    public static Identity ofApiKey(String apiKeyId, String ipAddress) {
        return new Identity(apiKeyId, null, ipAddress);
    }

    public boolean isAuthenticated() {
        return apiKeyId != null || userId != null;
    }

    /**
     * Counter key fragment: API key, then user, then IP.
     */
    public String subjectKey() {
        if (apiKeyId != null) {
            return "api:" + apiKeyId;
        }
        if (userId != null) {
            return "user:" + userId;
        }
        return "ip:" + ipAddress;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
