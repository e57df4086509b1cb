package me.golemcore.botmesh.domain.service;

import me.golemcore.botmesh.domain.model.CommandType;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ReplyEnvelope;
import me.golemcore.botmesh.infrastructure.config.AutoConfiguration;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.MessagingTransportPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GatewayActionRouterTest {

    private static final String BOT_ID = "bot-1";
    private static final String LOCAL_GATEWAY = "gw-local";

    @Mock
    private MessagingTransportPort transport;

    @Mock
    private GatewayRegistryService registry;

    @Mock
    private GatewayCommandClient commandClient;

    private BotProperties properties;
    private GatewayActionRouter router;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        properties = new BotProperties();
        properties.getGateway().setEnabled(true);
        properties.getGateway().setId(LOCAL_GATEWAY);
        router = new GatewayActionRouter(transport, registry, commandClient, properties,
                AutoConfiguration.objectMapper());
    }

    @Test
    void shouldSendLocallyWhenThisGatewayOwnsBot() {
        when(registry.gatewayFor(BOT_ID)).thenReturn(Optional.of(LOCAL_GATEWAY));
        OutboundPayload payload = OutboundPayload.text("hello");

        router.send(BOT_ID, "+100", payload);

        verify(transport).send(BOT_ID, "+100", payload);
        verifyNoInteractions(commandClient);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendThroughBusWhenAnotherGatewayOwnsBot() {
        when(registry.gatewayFor(BOT_ID)).thenReturn(Optional.of("gw-remote"));
        when(commandClient.send(eq(BOT_ID), eq(CommandType.SEND_PAYLOAD), anyMap())).thenReturn(ReplyEnvelope.ok());

        router.send(BOT_ID, "+100", OutboundPayload.quotedReply("hi", "m-1"));

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(commandClient).send(eq(BOT_ID), eq(CommandType.SEND_PAYLOAD), captor.capture());
        assertEquals("+100", captor.getValue().get("to"));
        assertEquals(Map.of("text", "hi", "quotedMessageId", "m-1"), captor.getValue().get("content"));
        verify(transport, never()).send(any(), any(), any());
    }

    @Test
    void shouldAlwaysUseBusWhenGatewayRoleIsDisabled() {
        properties.getGateway().setEnabled(false);
        when(registry.gatewayFor(BOT_ID)).thenReturn(Optional.of(LOCAL_GATEWAY));
        when(commandClient.send(eq(BOT_ID), eq(CommandType.ADD_TAG), anyMap())).thenReturn(ReplyEnvelope.ok());

        router.addTag(BOT_ID, "chat-1", "vip");

        verify(commandClient).send(BOT_ID, CommandType.ADD_TAG, Map.of("chatId", "chat-1", "tagId", "vip"));
        verifyNoInteractions(transport);
    }

    @Test
    void shouldThrowWhenRemoteReportsFailure() {
        when(registry.gatewayFor(BOT_ID)).thenReturn(Optional.of("gw-remote"));
        when(commandClient.send(eq(BOT_ID), eq(CommandType.REMOVE_TAG), anyMap()))
                .thenReturn(ReplyEnvelope.failure("Command REMOVE_TAG timed out after 15000ms"));

        GatewayCommandException error = assertThrows(GatewayCommandException.class,
                () -> router.removeTag(BOT_ID, "chat-1", "vip"));

        assertTrue(error.getMessage().contains("timed out"));
    }

    @Test
    void shouldPropagateRoutingFailure() {
        when(registry.gatewayFor(BOT_ID)).thenReturn(Optional.empty());
        when(commandClient.send(eq(BOT_ID), eq(CommandType.SEND_PAYLOAD), anyMap()))
                .thenThrow(new GatewayRoutingException(BOT_ID, "No gateway assigned to bot " + BOT_ID));

        assertThrows(GatewayRoutingException.class, () -> router.send(BOT_ID, "+1", OutboundPayload.text("x")));
    }

    @Test
    void shouldRemoveTagLocally() {
        when(registry.gatewayFor(BOT_ID)).thenReturn(Optional.of(LOCAL_GATEWAY));

        router.removeTag(BOT_ID, "chat-1", "vip");

        verify(transport).removeTag(BOT_ID, "chat-1", "vip");
        assertTrue(router.isLocal(BOT_ID));
    }
}
