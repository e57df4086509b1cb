package me.golemcore.botmesh.tools;

import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import me.golemcore.botmesh.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MessagingToolsTest {

    private static final String BOT_ID = "bot-1";
    private static final String IDENTIFIER = "+15550001";

    @Mock
    private GatewayActionRouter actionRouter;

    @Mock
    private SessionPort sessionPort;

    private AgentContext context;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        context = AgentContext.builder()
                .bot(Bot.builder().id(BOT_ID).build())
                .session(ChatSession.builder().id("session-1").botId(BOT_ID).identifier(IDENTIFIER).build())
                .build();
    }

    @Test
    void shouldReplyQuotingMessage() {
        ToolResult result = new ReplyToMessageTool(actionRouter)
                .execute(context, Map.of("message_id", "m-7", "text", "Yes, it is.")).join();

        assertTrue(result.isSuccess());
        verify(actionRouter).send(BOT_ID, IDENTIFIER, OutboundPayload.quotedReply("Yes, it is.", "m-7"));
    }

    @Test
    void shouldRequireReplyText() {
        ToolResult result = new ReplyToMessageTool(actionRouter).execute(context, Map.of("message_id", "m-7"))
                .join();

        assertFalse(result.isSuccess());
        verifyNoInteractions(actionRouter);
    }

    @Test
    void shouldSendFollowupToSessionOfSameBot() {
        when(sessionPort.findSession("session-2")).thenReturn(Optional.of(
                ChatSession.builder().id("session-2").botId(BOT_ID).identifier("+15550002").build()));

        ToolResult result = new SendFollowupMessageTool(sessionPort, actionRouter)
                .execute(context, Map.of("session_id", "session-2", "message", "Your order shipped")).join();

        assertTrue(result.isSuccess());
        verify(actionRouter).send(BOT_ID, "+15550002", OutboundPayload.text("Your order shipped"));
    }

    @Test
    void shouldRefuseFollowupToAnotherBotsSession() {
        when(sessionPort.findSession("session-9")).thenReturn(Optional.of(
                ChatSession.builder().id("session-9").botId("bot-2").identifier("+15550009").build()));

        ToolResult result = new SendFollowupMessageTool(sessionPort, actionRouter)
                .execute(context, Map.of("session_id", "session-9", "message", "hi")).join();

        assertFalse(result.isSuccess());
        assertEquals("Session not found: session-9", result.getError());
        verify(actionRouter, never()).send(any(), any(), any());
    }
}
