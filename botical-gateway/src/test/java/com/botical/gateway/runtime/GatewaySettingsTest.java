package com.botical.gateway.runtime;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GatewaySettingsTest {

    @Test
    void builder_defaults() {
        GatewaySettings settings = GatewaySettings.builder().build();

        assertEquals("/ws", settings.getPath());
        assertTrue(settings.isSingleUser());
        assertTrue(settings.getAuthTokens().isEmpty());
        assertTrue(settings.getProjectAccess().isEmpty());
        assertEquals(Duration.ofMinutes(5), settings.getApprovalTimeout());
        assertEquals(512 * 1024, settings.getSendBufferLimit());
    }

    @Test
    void parseTokens_readsPairs() {
        assertEquals(Map.of("a", "alice", "b", "bob"), GatewaySettings.parseTokens(" a=alice, b = bob ,"));
        assertTrue(GatewaySettings.parseTokens("").isEmpty());
        assertTrue(GatewaySettings.parseTokens(null).isEmpty());
    }

    @Test
    void parseTokens_rejectsEntryWithoutUser() {
        assertThrows(IllegalArgumentException.class, () -> GatewaySettings.parseTokens("lonely"));
        assertThrows(IllegalArgumentException.class, () -> GatewaySettings.parseTokens("tok="));
    }

    @Test
    void parseProjectAccess_readsProjectLists() {
        Map<String, Set<String>> access = GatewaySettings.parseProjectAccess("alice=p1|p2, bob=p3 ,admin=*,");

        assertEquals(List.of("p1", "p2"), List.copyOf(access.get("alice")));
        assertEquals(Set.of("p3"), access.get("bob"));
        assertEquals(Set.of("*"), access.get("admin"));
        assertTrue(GatewaySettings.parseProjectAccess(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> GatewaySettings.parseProjectAccess("alice"));
    }

    @Test
    void hasProjectAccess_checksListAndWildcard() {
        GatewaySettings settings = GatewaySettings.builder()
                .projectAccess(GatewaySettings.parseProjectAccess("alice=p1,admin=*"))
                .build();

        assertTrue(settings.hasProjectAccess("alice", "p1"));
        assertFalse(settings.hasProjectAccess("alice", "p2"));
        assertTrue(settings.hasProjectAccess("admin", "p2"));
        assertFalse(settings.hasProjectAccess("bob", "p1"));
    }
}
