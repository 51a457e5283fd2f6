package com.bookedbarber.ratelimit.audit;

import java.util.regex.Pattern;

/**
 * Collapses id segments so usage counters group by route, not by resource.
 */
public final class EndpointNormalizer {

    private static final Pattern UUID_SEGMENT = Pattern.compile(
            "/[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}(?=/|$)");
    private static final Pattern NUMERIC_SEGMENT = Pattern.compile("/\\d+(?=/|$)");

    private EndpointNormalizer() {
    }

    public static String normalize(String path) {
        if (path == null || path.isEmpty()) {
            return "/";
        }
        String normalized = UUID_SEGMENT.matcher(path).replaceAll("/{uuid}");
        normalized = NUMERIC_SEGMENT.matcher(normalized).replaceAll("/{id}");
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }
}
