package com.botical.common.bus;

/**
 * Event type matching: exact type, {@code prefix.*} wildcard, or {@code *}.
 */
public final class EventPattern {

    public static final String ALL = "*";

    private EventPattern() {
    }

    public static boolean matches(String pattern, String eventType) {
        if (pattern == null || eventType == null) {
            return false;
        }
        if (ALL.equals(pattern) || pattern.equals(eventType)) {
            return true;
        }
        if (pattern.endsWith(".*")) {
            String prefix = pattern.substring(0, pattern.length() - 2);
            return eventType.startsWith(prefix + ".");
        }
        return false;
    }

    public static boolean isValid(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return false;
        }
        if (ALL.equals(pattern)) {
            return true;
        }
        int star = pattern.indexOf('*');
        return star < 0 || (star == pattern.length() - 1 && pattern.endsWith(".*") && pattern.length() > 2);
    }
}
