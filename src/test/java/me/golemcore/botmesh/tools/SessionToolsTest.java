package me.golemcore.botmesh.tools;

import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.port.outbound.ConversationPort;
import me.golemcore.botmesh.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SessionToolsTest {

    @Mock
    private SessionPort sessionPort;

    @Mock
    private ConversationPort conversationPort;

    private ChatSession session;
    private AgentContext context;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        session = ChatSession.builder().id("session-1").botId("bot-1").build();
        context = AgentContext.builder().session(session).build();
    }

    @Test
    void shouldToggleSessionAiWhenNoValueGiven() {
        ToolResult result = new SetSessionAiTool(sessionPort).execute(context, Map.of()).join();

        assertTrue(result.isSuccess());
        assertFalse(session.isAiEnabled());
        assertEquals(Map.of("aiEnabled", false), result.getData());
        verify(sessionPort).save(session);
    }

    @Test
    void shouldSetExplicitSessionAiValue() {
        ToolResult result = new SetSessionAiTool(sessionPort).execute(context, Map.of("enabled", true)).join();

        assertTrue(result.isSuccess());
        assertTrue(session.isAiEnabled());
    }

    @Test
    void shouldClearConversation() {
        ToolResult result = new ClearConversationTool(conversationPort).execute(context, Map.of()).join();

        assertTrue(result.isSuccess());
        verify(conversationPort).clear("session-1");
    }

    @Test
    void shouldFailWithoutSession() {
        AgentContext empty = AgentContext.builder().build();

        assertFalse(new ClearConversationTool(conversationPort).execute(empty, Map.of()).join().isSuccess());
        assertFalse(new SetSessionAiTool(sessionPort).execute(empty, Map.of()).join().isSuccess());
        verifyNoInteractions(conversationPort, sessionPort);
    }
}
