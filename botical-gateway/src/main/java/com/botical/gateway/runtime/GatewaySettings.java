package com.botical.gateway.runtime;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Resolved gateway settings snapshot, frozen at startup from the
 * {@code botical.gateway.*} properties.
 */
@Getter
@Builder
public class GatewaySettings {

    public static final String DEFAULT_PATH = "/ws";
    public static final String GLOBAL_PROJECT = "global";
    public static final String LOCAL_USER = "local";
    /** Project-access entry granting every project. */
    public static final String ANY_PROJECT = "*";

    @Builder.Default
    private final String path = DEFAULT_PATH;
    @Builder.Default
    private final boolean singleUser = true;
    /** token to userId, consulted only in multi-user mode. */
    @Singular
    private final Map<String, String> authTokens;
    /** userId to the projects it may connect to; multi-user mode only. */
    @Builder.Default
    private final Map<String, Set<String>> projectAccess = Map.of();
    @Builder.Default
    private final Duration approvalTimeout = Duration.ofMinutes(5);
    @Builder.Default
    private final Duration decisionCacheTtl = Duration.ofHours(8);
    @Builder.Default
    private final int sendTimeLimitMs = 10_000;
    @Builder.Default
    private final int sendBufferLimit = 512 * 1024;

    /**
     * Parse {@code token=userId} pairs separated by commas. Blank entries are
     * skipped; an entry without {@code =} is rejected.
     */
    public static Map<String, String> parseTokens(String raw) {
        Map<String, String> tokens = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return tokens;
        }
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("auth token entry must be token=userId: " + trimmed);
            }
            tokens.put(trimmed.substring(0, eq).trim(), trimmed.substring(eq + 1).trim());
        }
        return tokens;
    }

    /**
     * Parse {@code userId=project|project} entries separated by commas, e.g.
     * {@code alice=p1|p2,admin=*}.
     */
    public static Map<String, Set<String>> parseProjectAccess(String raw) {
        Map<String, Set<String>> access = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return access;
        }
        for (String entry : raw.split(",")) {
            String trimmed = entry.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("project access entry must be userId=project|...: " + trimmed);
            }
            Set<String> projects = access.computeIfAbsent(trimmed.substring(0, eq).trim(),
                    k -> new LinkedHashSet<>());
            for (String project : trimmed.substring(eq + 1).split("\\|")) {
                if (!project.isBlank()) {
                    projects.add(project.trim());
                }
            }
        }
        return access;
    }

    public boolean hasProjectAccess(String userId, String projectId) {
        Set<String> projects = projectAccess.get(userId);
        return projects != null && (projects.contains(ANY_PROJECT) || projects.contains(projectId));
    }
}
