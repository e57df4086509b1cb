package me.golemcore.botmesh.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.CommandType;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ReplyEnvelope;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.MessagingTransportPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs transport actions for a bot where its connection lives: directly on the
 * local transport when this process is the bot's gateway, otherwise as a
 * command to the owning gateway. Commands for a bot this gateway owns never go
 * through the bus.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GatewayActionRouter {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MessagingTransportPort transport;
    private final GatewayRegistryService registry;
    private final GatewayCommandClient commandClient;
    private final BotProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * @throws GatewayCommandException
     *             if the owning gateway reports failure or does not answer
     * @throws GatewayRoutingException
     *             if the bot has no live owner
     */
    public void send(String botId, String to, OutboundPayload payload) {
        if (isLocal(botId)) {
            transport.send(botId, to, payload);
            return;
        }
        Map<String, Object> command = new LinkedHashMap<>();
        command.put("to", to);
        command.put("content", objectMapper.convertValue(payload, MAP_TYPE));
        expectSuccess(botId, CommandType.SEND_PAYLOAD, command);
    }

    public void addTag(String botId, String chatId, String tagId) {
        if (isLocal(botId)) {
            transport.addTag(botId, chatId, tagId);
            return;
        }
        expectSuccess(botId, CommandType.ADD_TAG, Map.of("chatId", chatId, "tagId", tagId));
    }

    public void removeTag(String botId, String chatId, String tagId) {
        if (isLocal(botId)) {
            transport.removeTag(botId, chatId, tagId);
            return;
        }
        expectSuccess(botId, CommandType.REMOVE_TAG, Map.of("chatId", chatId, "tagId", tagId));
    }

    public boolean isLocal(String botId) {
        BotProperties.GatewayProperties gateway = properties.getGateway();
        if (!gateway.isEnabled() || gateway.getId() == null) {
            return false;
        }
        return registry.gatewayFor(botId).filter(gateway.getId()::equals).isPresent();
    }

    private void expectSuccess(String botId, CommandType type, Map<String, Object> payload) {
        ReplyEnvelope reply = commandClient.send(botId, type, payload);
        if (!reply.success()) {
            log.warn("[ActionRouter] remote {} failed: botId={}, error={}", type, botId, reply.error());
            throw new GatewayCommandException(type + " failed for bot " + botId + ": " + reply.error());
        }
    }
}
