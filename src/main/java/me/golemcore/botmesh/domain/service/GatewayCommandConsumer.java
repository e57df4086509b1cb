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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.BrokerStreamEntry;
import me.golemcore.botmesh.domain.model.CommandEnvelope;
import me.golemcore.botmesh.domain.model.GatewayKeys;
import me.golemcore.botmesh.domain.model.ReplyEnvelope;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.BrokerPort;

import java.util.List;
import java.util.Objects;

/**
 * Consumer side of the command bus, one per gateway.
 *
 * <p>
 * Reads its gateway's command stream through a consumer group on a dedicated
 * daemon thread, hands each envelope to the {@link GatewayCommandHandler},
 * pushes the reply and acknowledges the entry. Unparsable entries are logged
 * and acknowledged. Handler exceptions become failure replies. Read errors are
 * retried after a pause until {@link #stop()}.
 */
@Slf4j
public class GatewayCommandConsumer {

    private static final long JOIN_GRACE_MILLIS = 1000;

    private final BrokerPort broker;
    private final ObjectMapper objectMapper;
    private final GatewayCommandHandler handler;
    private final BotProperties.CommandProperties settings;
    private final String streamKey;
    private final String group;
    private final String consumerName;

    private volatile boolean running;
    private Thread worker;

    public GatewayCommandConsumer(BrokerPort broker, ObjectMapper objectMapper, GatewayCommandHandler handler,
            BotProperties.CommandProperties settings, String gatewayId) {
        this.broker = broker;
        this.objectMapper = objectMapper;
        this.handler = handler;
        this.settings = settings;
        Objects.requireNonNull(gatewayId, "gatewayId");
        this.streamKey = GatewayKeys.commands(gatewayId);
        this.group = GatewayKeys.consumerGroup(gatewayId);
        this.consumerName = "handler_" + ProcessHandle.current().pid();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        broker.createGroup(streamKey, group);
        running = true;
        worker = new Thread(this::runLoop, "cmd-consumer-" + group);
        worker.setDaemon(true);
        worker.start();
        log.info("[CommandConsumer] listening: stream={}, group={}, consumer={}", streamKey, group, consumerName);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        Thread current = worker;
        worker = null;
        current.interrupt();
        try {
            current.join(settings.getBlockTimeout().toMillis() + JOIN_GRACE_MILLIS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[CommandConsumer] stopped: stream={}", streamKey);
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running) {
            List<BrokerStreamEntry> entries;
            try {
                entries = broker.readGroup(streamKey, group, consumerName, settings.getBatchSize(),
                        settings.getBlockTimeout());
            } catch (RuntimeException e) {
                if (!running) {
                    break;
                }
                log.error("[CommandConsumer] read failed, retrying: stream={}, error={}", streamKey, e.getMessage());
                backoff();
                continue;
            }
            for (BrokerStreamEntry entry : entries) {
                processEntry(entry);
            }
        }
    }

    void processEntry(BrokerStreamEntry entry) {
        try {
            String raw = entry.fields().get(GatewayKeys.COMMAND_FIELD);
            if (raw == null) {
                log.warn("[CommandConsumer] entry without command field, dropping: entryId={}", entry.id());
                return;
            }
            CommandEnvelope envelope;
            try {
                envelope = objectMapper.readValue(raw, CommandEnvelope.class);
            } catch (JsonProcessingException e) {
                log.error("[CommandConsumer] unparsable command, dropping: entryId={}, error={}",
                        entry.id(), e.getOriginalMessage());
                return;
            }
            ReplyEnvelope reply = dispatch(envelope);
            if (envelope.replyTo() != null) {
                broker.pushWithTtl(envelope.replyTo(), serialize(envelope, reply), settings.getReplyTtl());
            }
        } catch (RuntimeException e) {
            log.error("[CommandConsumer] failed to process entry: entryId={}", entry.id(), e);
        } finally {
            acknowledge(entry);
        }
    }

    private ReplyEnvelope dispatch(CommandEnvelope envelope) {
        try {
            ReplyEnvelope reply = handler.handle(envelope);
            log.debug("[CommandConsumer] handled: id={}, type={}, success={}",
                    envelope.id(), envelope.type(), reply != null && reply.success());
            return reply != null ? reply : ReplyEnvelope.ok();
        } catch (RuntimeException e) {
            log.warn("[CommandConsumer] handler failed: id={}, type={}, error={}",
                    envelope.id(), envelope.type(), e.getMessage());
            return ReplyEnvelope.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    private String serialize(CommandEnvelope envelope, ReplyEnvelope reply) {
        try {
            return objectMapper.writeValueAsString(reply);
        } catch (JsonProcessingException e) {
            log.warn("[CommandConsumer] reply not serializable: id={}, error={}", envelope.id(), e.getMessage());
            return "{\"success\":false,\"error\":\"Reply not serializable\"}";
        }
    }

    private void acknowledge(BrokerStreamEntry entry) {
        try {
            broker.acknowledge(streamKey, group, entry.id());
        } catch (RuntimeException e) {
            log.error("[CommandConsumer] ack failed: entryId={}, error={}", entry.id(), e.getMessage());
        }
    }

    private void backoff() {
        try {
            Thread.sleep(settings.getErrorBackoff().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
