package me.golemcore.botmesh.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import me.golemcore.botmesh.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CommandEnvelopeTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @Test
    void shouldSerializeWireFields() throws Exception {
        CommandEnvelope envelope = new CommandEnvelope("1700000000000-42-1", CommandType.ADD_TAG, "bot-1",
                Map.of("chatId", "c-1", "tagId", "vip"), GatewayKeys.reply("1700000000000-42-1"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(envelope));

        assertEquals("ADD_TAG", json.get("type").asText());
        assertEquals("bot-1", json.get("targetId").asText());
        assertEquals("vip", json.get("payload").get("tagId").asText());
        assertEquals("cmd:reply:1700000000000-42-1", json.get("replyTo").asText());
    }

    @Test
    void shouldRejectUnknownCommandType() {
        String raw = "{\"id\":\"c-1\",\"type\":\"REBOOT\",\"targetId\":\"bot-1\"}";

        assertThrows(InvalidFormatException.class, () -> objectMapper.readValue(raw, CommandEnvelope.class));
    }

    @Test
    void shouldKeepNullPayloadValues() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("messageId", null);
        payload.put("sessionId", "s-1");

        CommandEnvelope envelope = new CommandEnvelope("c-1", CommandType.FORCE_PROCESSING, "bot-1", payload, null);

        assertNull(envelope.payloadString("messageId"));
        assertEquals("s-1", envelope.requirePayloadString("sessionId"));
        assertThrows(IllegalArgumentException.class, () -> envelope.requirePayloadString("messageId"));
        assertThrows(UnsupportedOperationException.class, () -> envelope.payload().put("x", "y"));
    }

    @Test
    void shouldOmitAbsentReplyFields() throws Exception {
        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(ReplyEnvelope.ok()));

        assertTrue(json.get("success").asBoolean());
        assertFalse(json.has("error"));
        assertFalse(json.has("data"));
    }

    @Test
    void shouldDeriveKeysFromIds() {
        assertEquals("gateway:gw-1:commands", GatewayKeys.commands("gw-1"));
        assertEquals("cmd_handler_gw-1", GatewayKeys.consumerGroup("gw-1"));
        assertEquals("accumulator:gw-1:s-9", GatewayKeys.accumulator("gw-1", "s-9"));
        assertEquals("s-9", GatewayKeys.sessionOfAccumulator("gw-1", GatewayKeys.accumulator("gw-1", "s-9")));
        assertEquals("accumulator:gw-1:*", GatewayKeys.accumulatorPattern("gw-1"));
    }
}
