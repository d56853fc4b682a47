package com.botical.gateway.auth;

import com.botical.gateway.protocol.ProtocolTypes;
import com.botical.gateway.runtime.GatewaySettings;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Map;

/**
 * Decides who a new WebSocket connection belongs to.
 *
 * <p>
 * Single-user mode trusts every connection as the local user; the project
 * comes from the query string or falls back to the global scope. Multi-user
 * mode needs both a known token and a project id the token's user may access.
 */
@Slf4j
public class ConnectionAuthenticator {

    private final GatewaySettings settings;

    public ConnectionAuthenticator(GatewaySettings settings) {
        this.settings = settings;
    }

    public record AuthResult(boolean ok, String userId, String projectId, boolean singleUser,
            int closeCode, String reason) {

        static AuthResult success(String userId, String projectId, boolean singleUser) {
            return new AuthResult(true, userId, projectId, singleUser, 0, null);
        }

        static AuthResult failure(int closeCode, String reason) {
            return new AuthResult(false, null, null, false, closeCode, reason);
        }
    }

    public AuthResult authenticate(String token, String projectId) {
        String project = isNotBlank(projectId) ? projectId.trim() : null;

        if (settings.isSingleUser()) {
            return AuthResult.success(GatewaySettings.LOCAL_USER,
                    project != null ? project : GatewaySettings.GLOBAL_PROJECT, true);
        }

        if (!isNotBlank(token) || project == null) {
            return AuthResult.failure(ProtocolTypes.CLOSE_UNAUTHORIZED, "Missing token or projectId");
        }
        String userId = lookupToken(token.trim());
        if (userId == null) {
            return AuthResult.failure(ProtocolTypes.CLOSE_UNAUTHORIZED, "Invalid token");
        }
        if (!settings.hasProjectAccess(userId, project)) {
            log.debug("auth:project-denied user={} project={}", userId, project);
            return AuthResult.failure(ProtocolTypes.CLOSE_FORBIDDEN, "Access denied to project");
        }
        return AuthResult.success(userId, project, false);
    }

    private String lookupToken(String token) {
        Map<String, String> tokens = settings.getAuthTokens();
        if (tokens == null) {
            return null;
        }
        for (Map.Entry<String, String> e : tokens.entrySet()) {
            if (safeEqual(token, e.getKey())) {
                return e.getValue();
            }
        }
        return null;
    }

    /**
     * Constant-time string comparison.
     */
    private static boolean safeEqual(String a, String b) {
        return MessageDigest.isEqual(
                a.getBytes(StandardCharsets.UTF_8),
                b.getBytes(StandardCharsets.UTF_8));
    }

    private static boolean isNotBlank(String s) {
        return s != null && !s.isBlank();
    }
}
