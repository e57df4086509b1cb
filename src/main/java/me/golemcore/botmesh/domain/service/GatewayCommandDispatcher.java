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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.loop.AgentLoop;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.CommandEnvelope;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ReplyEnvelope;
import me.golemcore.botmesh.port.outbound.MessagePort;
import me.golemcore.botmesh.port.outbound.MessagingTransportPort;
import me.golemcore.botmesh.port.outbound.SessionPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Executes commands addressed to bots owned by this gateway.
 *
 * <p>
 * Handlers run on the consumer thread except forced processing, which is
 * handed to the session executor and acknowledged immediately.
 */
@Component
@Slf4j
public class GatewayCommandDispatcher implements GatewayCommandHandler {

    private static final String OPERATOR_PLACEHOLDER = "[Operator forced AI response]";

    private final MessagingTransportPort transport;
    private final SessionPort sessionPort;
    private final MessagePort messagePort;
    private final AgentLoop agentLoop;
    private final ExecutorService sessionRunExecutor;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GatewayCommandDispatcher(MessagingTransportPort transport, SessionPort sessionPort,
            MessagePort messagePort, AgentLoop agentLoop, ExecutorService sessionRunExecutor,
            ObjectMapper objectMapper, Clock clock) {
        this.transport = transport;
        this.sessionPort = sessionPort;
        this.messagePort = messagePort;
        this.agentLoop = agentLoop;
        this.sessionRunExecutor = sessionRunExecutor;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ReplyEnvelope handle(CommandEnvelope envelope) {
        String botId = envelope.targetId();
        return switch (envelope.type()) {
        case START_CONNECTION -> {
            transport.start(botId);
            yield ReplyEnvelope.ok();
        }
        case STOP_CONNECTION -> {
            transport.stop(botId);
            yield ReplyEnvelope.ok();
        }
        case SEND_PAYLOAD -> {
            transport.send(botId, envelope.requirePayloadString("to"), toPayload(envelope));
            yield ReplyEnvelope.ok();
        }
        case FORCE_PROCESSING -> forceProcessing(envelope);
        case SYNC_EXTERNAL_STATE -> {
            transport.syncTags(botId);
            yield ReplyEnvelope.ok();
        }
        case ADD_TAG -> {
            transport.addTag(botId, envelope.requirePayloadString("chatId"), envelope.requirePayloadString("tagId"));
            yield ReplyEnvelope.ok();
        }
        case REMOVE_TAG -> {
            transport.removeTag(botId, envelope.requirePayloadString("chatId"),
                    envelope.requirePayloadString("tagId"));
            yield ReplyEnvelope.ok();
        }
        };
    }

    private OutboundPayload toPayload(CommandEnvelope envelope) {
        Object content = envelope.payload().get("content");
        if (content == null) {
            throw new IllegalArgumentException("Missing payload field 'content' for " + envelope.type());
        }
        if (content instanceof Map<?, ?>) {
            return objectMapper.convertValue(content, OutboundPayload.class);
        }
        return OutboundPayload.text(content.toString());
    }

    private ReplyEnvelope forceProcessing(CommandEnvelope envelope) {
        String sessionId = envelope.requirePayloadString("sessionId");
        ChatSession session = sessionPort.findSession(sessionId)
                .orElseThrow(() -> new IllegalArgumentException("Session not found: " + sessionId));

        String messageId = envelope.payloadString("messageId");
        Message message;
        if (messageId != null) {
            message = messagePort.findMessage(messageId)
                    .orElseThrow(() -> new IllegalArgumentException("Message not found: " + messageId));
        } else {
            String context = envelope.payloadString("context");
            message = messagePort.save(Message.builder()
                    .sessionId(session.getId())
                    .role("user")
                    .sender("operator")
                    .content(context != null && !context.isBlank() ? context : OPERATOR_PLACEHOLDER)
                    .timestamp(clock.instant())
                    .build());
        }

        sessionRunExecutor.execute(() -> {
            try {
                agentLoop.processMessage(session.getId(), message);
            } catch (RuntimeException e) {
                log.error("[CommandDispatcher] forced processing failed: sessionId={}", session.getId(), e);
            }
        });
        log.info("[CommandDispatcher] forced processing scheduled: sessionId={}, messageId={}",
                session.getId(), message.getId());
        return ReplyEnvelope.ok(Map.of("messageId", message.getId()));
    }
}
