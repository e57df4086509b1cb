package me.golemcore.botmesh.domain.service;

import me.golemcore.botmesh.domain.loop.AgentLoop;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.CommandEnvelope;
import me.golemcore.botmesh.domain.model.CommandType;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ReplyEnvelope;
import me.golemcore.botmesh.infrastructure.config.AutoConfiguration;
import me.golemcore.botmesh.port.outbound.MessagePort;
import me.golemcore.botmesh.port.outbound.MessagingTransportPort;
import me.golemcore.botmesh.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GatewayCommandDispatcherTest {

    private static final String BOT_ID = "bot-1";
    private static final String SESSION_ID = "session-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private MessagingTransportPort transport;

    @Mock
    private SessionPort sessionPort;

    @Mock
    private MessagePort messagePort;

    @Mock
    private AgentLoop agentLoop;

    @Mock
    private ExecutorService executor;

    private GatewayCommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return null;
        }).when(executor).execute(any(Runnable.class));
        dispatcher = new GatewayCommandDispatcher(transport, sessionPort, messagePort, agentLoop, executor,
                AutoConfiguration.objectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldStartAndStopConnection() {
        assertTrue(dispatcher.handle(command(CommandType.START_CONNECTION, Map.of())).success());
        assertTrue(dispatcher.handle(command(CommandType.STOP_CONNECTION, Map.of())).success());

        verify(transport).start(BOT_ID);
        verify(transport).stop(BOT_ID);
    }

    @Test
    void shouldSendTextContent() {
        ReplyEnvelope reply = dispatcher.handle(command(CommandType.SEND_PAYLOAD,
                Map.of("to", "+100", "content", "hello")));

        assertTrue(reply.success());
        verify(transport).send(BOT_ID, "+100", OutboundPayload.text("hello"));
    }

    @Test
    void shouldSendStructuredContent() {
        dispatcher.handle(command(CommandType.SEND_PAYLOAD, Map.of("to", "+100",
                "content", Map.of("imageUrl", "https://cdn/x.png", "caption", "look"))));

        verify(transport).send(BOT_ID, "+100", OutboundPayload.image("https://cdn/x.png", "look"));
    }

    @Test
    void shouldRejectSendWithoutRecipient() {
        CommandEnvelope envelope = command(CommandType.SEND_PAYLOAD, Map.of("content", "hello"));

        assertThrows(IllegalArgumentException.class, () -> dispatcher.handle(envelope));
        verifyNoInteractions(transport);
    }

    @Test
    void shouldSyncAndEditTags() {
        dispatcher.handle(command(CommandType.SYNC_EXTERNAL_STATE, Map.of()));
        dispatcher.handle(command(CommandType.ADD_TAG, Map.of("chatId", "chat-1", "tagId", "vip")));
        dispatcher.handle(command(CommandType.REMOVE_TAG, Map.of("chatId", "chat-1", "tagId", "lead")));

        verify(transport).syncTags(BOT_ID);
        verify(transport).addTag(BOT_ID, "chat-1", "vip");
        verify(transport).removeTag(BOT_ID, "chat-1", "lead");
    }

    @Test
    void shouldForceProcessingWithStoredMessage() {
        Message stored = Message.builder().id("m-1").sessionId(SESSION_ID).content("hi").build();
        when(sessionPort.findSession(SESSION_ID)).thenReturn(Optional.of(session()));
        when(messagePort.findMessage("m-1")).thenReturn(Optional.of(stored));

        ReplyEnvelope reply = dispatcher.handle(command(CommandType.FORCE_PROCESSING,
                Map.of("sessionId", SESSION_ID, "messageId", "m-1")));

        assertTrue(reply.success());
        assertEquals(Map.of("messageId", "m-1"), reply.data());
        verify(agentLoop).processMessage(SESSION_ID, stored);
    }

    @Test
    void shouldForceProcessingWithOperatorMessage() {
        when(sessionPort.findSession(SESSION_ID)).thenReturn(Optional.of(session()));
        when(messagePort.save(any(Message.class))).thenAnswer(invocation -> {
            Message message = invocation.getArgument(0);
            message.setId("m-new");
            return message;
        });

        ReplyEnvelope reply = dispatcher.handle(command(CommandType.FORCE_PROCESSING,
                Map.of("sessionId", SESSION_ID, "context", "Follow up on the order")));

        assertTrue(reply.success());
        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(agentLoop).processMessage(eq(SESSION_ID), captor.capture());
        assertEquals("Follow up on the order", captor.getValue().getContent());
        assertEquals("operator", captor.getValue().getSender());
        assertEquals(NOW, captor.getValue().getTimestamp());
    }

    @Test
    void shouldFailForcedProcessingForUnknownSession() {
        when(sessionPort.findSession(SESSION_ID)).thenReturn(Optional.empty());
        CommandEnvelope envelope = command(CommandType.FORCE_PROCESSING, Map.of("sessionId", SESSION_ID));

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> dispatcher.handle(envelope));

        assertTrue(error.getMessage().startsWith("Session not found"));
        verifyNoInteractions(agentLoop);
    }

    private CommandEnvelope command(CommandType type, Map<String, Object> payload) {
        return new CommandEnvelope("c-1", type, BOT_ID, payload, "cmd:reply:c-1");
    }

    private ChatSession session() {
        return ChatSession.builder().id(SESSION_ID).botId(BOT_ID).identifier("+100").build();
    }
}
