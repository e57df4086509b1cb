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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.CommandEnvelope;
import me.golemcore.botmesh.domain.model.CommandType;
import me.golemcore.botmesh.domain.model.GatewayKeys;
import me.golemcore.botmesh.domain.model.ReplyEnvelope;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.BrokerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Producer side of the command bus: routes a command to the stream of the
 * gateway that owns the bot and waits for the correlated reply.
 *
 * <p>
 * Routing failures throw {@link GatewayRoutingException} before anything is
 * written to a stream. A timeout, or a broker error while waiting for the
 * reply, is returned as a failure reply and never retried. The remote handler
 * may still complete, and its late reply key expires on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GatewayCommandClient {

    private static final long PID = ProcessHandle.current().pid();

    private final GatewayRegistryService registry;
    private final BrokerPort broker;
    private final ObjectMapper objectMapper;
    private final BotProperties properties;
    private final Clock clock;

    private final AtomicLong counter = new AtomicLong();

    public ReplyEnvelope send(String botId, CommandType type, Map<String, Object> payload) {
        return send(botId, type, payload, properties.getCommands().getDefaultTimeout());
    }

    /**
     * Sends a command and blocks for its reply.
     *
     * @throws GatewayRoutingException
     *             if the bot has no owner or the owner is not live
     * @throws IllegalArgumentException
     *             if {@code timeout} is not positive
     */
    public ReplyEnvelope send(String botId, CommandType type, Map<String, Object> payload, Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Reply timeout must be positive, got " + timeout);
        }
        String gatewayId = resolveOwner(botId);
        String commandId = nextCommandId();
        String replyKey = GatewayKeys.reply(commandId);
        CommandEnvelope envelope = new CommandEnvelope(commandId, type, botId, payload, replyKey);

        append(gatewayId, envelope);
        log.debug("[CommandBus] sent: id={}, type={}, botId={}, gatewayId={}", commandId, type, botId, gatewayId);

        long started = clock.millis();
        Optional<String> raw;
        try {
            raw = broker.blockingPop(replyKey, timeout);
        } catch (BrokerException e) {
            log.warn("[CommandBus] reply wait failed: id={}, type={}, botId={}, waited={}ms, error={}",
                    commandId, type, botId, clock.millis() - started, e.getMessage());
            cleanupReplyKey(replyKey);
            return ReplyEnvelope.failure("Command " + type + " reply wait failed: " + e.getMessage());
        }
        if (raw.isEmpty()) {
            log.warn("[CommandBus] reply timeout: id={}, type={}, botId={}, waited={}ms",
                    commandId, type, botId, clock.millis() - started);
            cleanupReplyKey(replyKey);
            return ReplyEnvelope.failure("Command " + type + " timed out after " + timeout.toMillis() + "ms");
        }
        return parseReply(commandId, raw.get());
    }

    /**
     * Publishes a command without waiting for a reply.
     *
     * @return false if the bot has no live owner
     */
    public boolean publish(String botId, CommandType type, Map<String, Object> payload) {
        String gatewayId;
        try {
            gatewayId = resolveOwner(botId);
        } catch (GatewayRoutingException e) {
            log.warn("[CommandBus] publish dropped: type={}, botId={}, reason={}", type, botId, e.getMessage());
            return false;
        }
        CommandEnvelope envelope = new CommandEnvelope(nextCommandId(), type, botId, payload, null);
        append(gatewayId, envelope);
        log.debug("[CommandBus] published: id={}, type={}, botId={}", envelope.id(), type, botId);
        return true;
    }

    private String resolveOwner(String botId) {
        String gatewayId = registry.gatewayFor(botId)
                .orElseThrow(() -> new GatewayRoutingException(botId, "No gateway assigned to bot " + botId));
        if (!registry.isAlive(gatewayId)) {
            throw new GatewayRoutingException(botId,
                    "Gateway " + gatewayId + " owning bot " + botId + " is not alive");
        }
        return gatewayId;
    }

    private void append(String gatewayId, CommandEnvelope envelope) {
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Command payload is not serializable: " + e.getOriginalMessage(), e);
        }
        broker.streamAppend(GatewayKeys.commands(gatewayId), Map.of(GatewayKeys.COMMAND_FIELD, json),
                properties.getCommands().getStreamMaxLength());
    }

    private ReplyEnvelope parseReply(String commandId, String raw) {
        try {
            return objectMapper.readValue(raw, ReplyEnvelope.class);
        } catch (JsonProcessingException e) {
            log.warn("[CommandBus] unparsable reply: id={}, error={}", commandId, e.getOriginalMessage());
            return ReplyEnvelope.failure("Unparsable reply: " + e.getOriginalMessage());
        }
    }

    private void cleanupReplyKey(String replyKey) {
        CompletableFuture.runAsync(() -> broker.delete(replyKey))
                .exceptionally(e -> {
                    log.debug("[CommandBus] reply key cleanup failed: key={}, error={}", replyKey, e.getMessage());
                    return null;
                });
    }

    String nextCommandId() {
        return clock.millis() + "-" + PID + "-" + counter.incrementAndGet();
    }
}
