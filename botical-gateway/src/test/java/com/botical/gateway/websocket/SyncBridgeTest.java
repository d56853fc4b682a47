package com.botical.gateway.websocket;

import com.botical.common.bus.BoticalEvent;
import com.botical.common.bus.EventBus;
import com.botical.common.bus.EventEnvelope;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SyncBridgeTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private EventBus bus;
    private RoomIndex rooms;
    private ConnectionRegistry registry;
    private SyncBridge bridge;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        rooms = new RoomIndex();
        registry = new ConnectionRegistry(rooms);
        bridge = new SyncBridge(bus, rooms, registry, mapper);
        bridge.setup();
    }

    private RecordingChannel connect(String id, String projectId, String... roomNames) {
        RecordingChannel channel = new RecordingChannel();
        registry.add(id, new ConnectionDescriptor(id, "u-" + id, projectId, channel));
        for (String room : roomNames) {
            rooms.join(room, id);
        }
        return channel;
    }

    private static BoticalEvent delta(String sessionId, String text) {
        return new BoticalEvent.MessageTextDelta(sessionId, "m1", "part1", text);
    }

    @Nested
    class Lifecycle {

        @Test
        void setup_twice_subscribesOnce() {
            bridge.setup();
            assertTrue(bridge.isActive());
            assertEquals(1, bridge.getSubscriptionCount());
            assertEquals(1, bus.getSubscriptionCount());
        }

        @Test
        void teardown_isIdempotent() {
            bridge.teardown();
            bridge.teardown();
            assertFalse(bridge.isActive());
            assertEquals(0, bus.getSubscriptionCount());
        }

        @Test
        void teardown_beforeSetup_isNoOp() {
            SyncBridge fresh = new SyncBridge(bus, rooms, registry, mapper);
            fresh.teardown();
            assertFalse(fresh.isActive());
        }

        @Test
        void afterTeardown_eventsAreNotForwarded() {
            RecordingChannel channel = connect("c1", "p1", "project:p1");
            bridge.teardown();

            bus.publish("p1", delta("s1", "hi"));

            assertTrue(channel.getFrames().isEmpty());
        }

        @Test
        void missingRoute_failsAtConstruction() {
            Map<Class<? extends BoticalEvent>, EventRoute> routes = SyncBridge.defaultRoutes();
            routes.remove(BoticalEvent.ProcessKilled.class);

            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> new SyncBridge(bus, rooms, registry, mapper, routes));
            assertTrue(e.getMessage().contains("ProcessKilled"));
        }

        @Test
        void defaultRoutes_coverEveryEventKind() {
            assertDoesNotThrow(() -> SyncBridge.validateRoutes(SyncBridge.defaultRoutes()));
            assertEquals(BoticalEvent.class.getPermittedSubclasses().length,
                    SyncBridge.defaultRoutes().size());
        }
    }

    @Nested
    class FanOut {

        @Test
        void sessionAndProjectMembers_eachReceiveOneFrame() throws Exception {
            RecordingChannel a = connect("A", "p1", "session:s1");
            RecordingChannel b = connect("B", "p1", "project:p1");

            bus.publish("p1", delta("s1", "hi"));

            assertEquals(1, a.getFrames().size());
            assertEquals(1, b.getFrames().size());
            JsonNode frame = mapper.readTree(a.getFrames().get(0));
            assertEquals("message.text.delta", frame.get("type").asText());
            assertEquals("hi", frame.get("payload").get("delta").asText());
            assertEquals("s1", frame.get("payload").get("sessionId").asText());
            assertEquals(a.getFrames().get(0), b.getFrames().get(0));
        }

        @Test
        void sessionUpdated_sendsOnlyChangedFields() throws Exception {
            RecordingChannel channel = connect("A", "p1", "project:p1");

            bus.publish("p1", new BoticalEvent.SessionUpdated("s1", "Renamed", null, null));

            JsonNode payload = mapper.readTree(channel.getFrames().get(0)).get("payload");
            assertEquals("session.updated", mapper.readTree(channel.getFrames().get(0)).get("type").asText());
            assertEquals("s1", payload.get("sessionId").asText());
            assertEquals("Renamed", payload.get("title").asText());
            assertFalse(payload.has("status"));
            assertFalse(payload.has("agent"));
        }

        @Test
        void memberOfBothRooms_receivesOneFrame() {
            RecordingChannel channel = connect("c1", "p1", "session:s1", "project:p1");

            SyncBridge.FanOutResult result = bridge.deliver(
                    new EventEnvelope("evt_1", 1L, "p1", delta("s1", "x")));

            assertEquals(1, result.recipients());
            assertEquals(1, result.delivered());
            assertEquals(1, channel.getFrames().size());
        }

        @Test
        void projectOnlyEvent_skipsSessionRoom() {
            RecordingChannel sessionOnly = connect("c1", "p1", "session:s1");
            RecordingChannel project = connect("c2", "p1", "project:p1");

            bus.publish("p1", new BoticalEvent.FileDeleted("f1", "src/a.ts"));

            assertTrue(sessionOnly.getFrames().isEmpty());
            assertEquals(1, project.getFrames().size());
        }

        @Test
        void fileUpdatedWithSession_reachesSessionRoom() {
            RecordingChannel sessionOnly = connect("c1", "p1", "session:s1");

            bus.publish("p1", new BoticalEvent.FileUpdated("f1", "src/a.ts", "s1", "m1"));
            bus.publish("p1", new BoticalEvent.FileUpdated("f2", "src/b.ts", null, null));

            assertEquals(1, sessionOnly.getFrames().size());
        }

        @Test
        void globalEvent_isNotDelivered() {
            RecordingChannel channel = connect("c1", "p1", "project:p1");

            bus.publishGlobal(new BoticalEvent.ProcessOutput("proc1", "out", "stdout"));

            assertTrue(channel.getFrames().isEmpty());
        }

        @Test
        void otherTenantMember_isSkipped() {
            // joined a session room of p1 while scoped to p2
            RecordingChannel foreign = connect("c1", "p2", "session:s1");
            RecordingChannel local = connect("c2", "p1", "session:s1");

            SyncBridge.FanOutResult result = bridge.deliver(
                    new EventEnvelope("evt_1", 1L, "p1", delta("s1", "secret")));

            assertTrue(foreign.getFrames().isEmpty());
            assertEquals(1, local.getFrames().size());
            assertEquals(2, result.recipients());
            assertEquals(1, result.delivered());
        }

        @Test
        void closedConnection_isSkippedWithoutSend() {
            RecordingChannel closed = connect("c1", "p1", "project:p1");
            closed.markClosed();
            RecordingChannel open = connect("c2", "p1", "project:p1");

            SyncBridge.FanOutResult result = bridge.deliver(
                    new EventEnvelope("evt_1", 1L, "p1", delta("s1", "x")));

            assertEquals(1, result.skippedClosed());
            assertEquals(1, result.delivered());
            assertTrue(closed.getFrames().isEmpty());
            assertEquals(1, open.getFrames().size());
        }

        @Test
        void failingConnection_doesNotStopOthers() {
            registry.add("bad", new ConnectionDescriptor("bad", "u", "p1", RecordingChannel.failing()));
            rooms.join("project:p1", "bad");
            RecordingChannel good = connect("good", "p1", "project:p1");

            SyncBridge.FanOutResult result = bridge.deliver(
                    new EventEnvelope("evt_1", 1L, "p1", delta("s1", "x")));

            assertEquals(1, result.failed());
            assertEquals(1, result.delivered());
            assertEquals(1, good.getFrames().size());
        }

        @Test
        void staleMembership_isPruned() {
            rooms.join("project:p1", "ghost");
            RecordingChannel live = connect("c1", "p1", "project:p1");

            bus.publish("p1", delta("s1", "x"));

            assertFalse(rooms.isMember("project:p1", "ghost"));
            assertTrue(rooms.getRooms("ghost").isEmpty());
            assertEquals(1, live.getFrames().size());
        }

        @Test
        void noMembers_returnsEmptyResult() {
            SyncBridge.FanOutResult result = bridge.deliver(
                    new EventEnvelope("evt_1", 1L, "p1", delta("s1", "x")));
            assertEquals(0, result.recipients());
        }

        @Test
        void framesFollowPublishOrder() throws Exception {
            RecordingChannel channel = connect("c1", "p1", "session:s1");

            for (String text : List.of("a", "b", "c")) {
                bus.publish("p1", delta("s1", text));
            }

            assertEquals(3, channel.getFrames().size());
            for (int i = 0; i < 3; i++) {
                JsonNode frame = mapper.readTree(channel.getFrames().get(i));
                assertEquals(List.of("a", "b", "c").get(i), frame.get("payload").get("delta").asText());
            }
        }
    }

    @Test
    void targetRooms_sessionEvent_listsSessionThenProject() {
        assertEquals(List.of("session:s1", "project:p1"), bridge.targetRooms("p1", delta("s1", "x")));
        assertEquals(List.of("project:p1"),
                bridge.targetRooms("p1", new BoticalEvent.ProcessKilled("proc1", "p1")));
    }
}
