package com.botical.common.store;

import com.botical.common.model.Message;
import com.botical.common.model.MessagePart;
import com.botical.common.model.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkspaceStoreTest {

    private InMemoryWorkspaceStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryWorkspaceStore();
    }

    @Test
    void createSession_assignsIdAndTenant() {
        Session session = store.createSession("prj_1", Session.builder().title("First").build());

        assertNotNull(session.getId());
        assertEquals("prj_1", session.getProjectId());
        assertEquals(Session.STATUS_ACTIVE, session.getStatus());
        assertTrue(store.getSession("prj_1", session.getId()).isPresent());
    }

    @Test
    void getSession_isPartitionedByProject() {
        Session session = store.createSession("prj_1", Session.builder().title("First").build());

        assertTrue(store.getSession("prj_2", session.getId()).isEmpty());
    }

    @Test
    void listMessages_equalTimestampsKeepInsertionOrder() {
        Session session = store.createSession("prj_1", Session.builder().build());
        for (String id : List.of("m_c", "m_a", "m_b")) {
            store.createMessage("prj_1", Message.builder()
                    .id(id).sessionId(session.getId()).role("user").createdAt(1000).build());
        }

        List<Message> messages = store.listMessages("prj_1", session.getId());

        assertEquals(List.of("m_c", "m_a", "m_b"), messages.stream().map(Message::getId).toList());
    }

    @Test
    void listMessages_ordersByCreationTime() {
        Session session = store.createSession("prj_1", Session.builder().build());
        store.createMessage("prj_1", Message.builder().id("late").sessionId(session.getId()).createdAt(2000).build());
        store.createMessage("prj_1", Message.builder().id("early").sessionId(session.getId()).createdAt(1000).build());

        assertEquals(List.of("early", "late"),
                store.listMessages("prj_1", session.getId()).stream().map(Message::getId).toList());
    }

    @Test
    void listSessions_filtersByStatus() {
        store.createSession("prj_1", Session.builder().id("a").build());
        store.createSession("prj_1", Session.builder().id("b").status(Session.STATUS_ARCHIVED).build());

        assertEquals(1, store.listSessions("prj_1", Session.STATUS_ACTIVE).size());
        assertEquals(2, store.listSessions("prj_1", null).size());
        assertTrue(store.listSessions("prj_x", null).isEmpty());
    }

    @Test
    void toolPart_lookupAndStatusUpdate() {
        MessagePart part = store.createPart("prj_1", MessagePart.builder()
                .messageId("m1").sessionId("s1").type("tool")
                .toolName("bash").toolCallId("call_1").toolStatus(MessagePart.TOOL_PENDING).build());

        assertEquals(part.getId(), store.findToolPart("prj_1", "s1", "call_1").orElseThrow().getId());
        assertTrue(store.findToolPart("prj_1", "s2", "call_1").isEmpty());

        assertTrue(store.updateToolStatus("prj_1", part.getId(), MessagePart.TOOL_RUNNING));
        assertEquals(MessagePart.TOOL_RUNNING, store.listParts("prj_1", "m1").get(0).getToolStatus());
        assertFalse(store.updateToolStatus("prj_1", "missing", MessagePart.TOOL_RUNNING));
    }
}
