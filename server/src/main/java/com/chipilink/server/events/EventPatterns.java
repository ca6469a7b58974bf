package com.chipilink.server.events;

/**
 * Matching rule shared by subscriptions and history queries.
 */
public final class EventPatterns {

    public static final String ANY = "*";
    private static final String WILDCARD_SUFFIX = ".*";

    private EventPatterns() {
    }

    /**
     * {@code "*"} matches everything, {@code "prefix.*"} matches any type starting with
     * {@code "prefix."}, anything else must be equal.
     */
    public static boolean matches(String eventType, String pattern) {
        if (eventType == null || pattern == null) {
            return false;
        }
        if (ANY.equals(pattern)) {
            return true;
        }
        if (pattern.endsWith(WILDCARD_SUFFIX)) {
            String prefix = pattern.substring(0, pattern.length() - 1); // keeps the trailing dot
            return eventType.startsWith(prefix);
        }
        return eventType.equals(pattern);
    }
}
