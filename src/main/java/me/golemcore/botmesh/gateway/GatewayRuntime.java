package me.golemcore.botmesh.gateway;

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
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.service.ConnectionRegistry;
import me.golemcore.botmesh.domain.service.GatewayCommandConsumer;
import me.golemcore.botmesh.domain.service.GatewayCommandDispatcher;
import me.golemcore.botmesh.domain.service.GatewayRegistryService;
import me.golemcore.botmesh.domain.service.InboundMessageService;
import me.golemcore.botmesh.domain.service.MessageAccumulator;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.BotPort;
import me.golemcore.botmesh.port.outbound.BrokerPort;
import me.golemcore.botmesh.port.outbound.MessagingTransportPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Lifecycle of this process as a gateway.
 *
 * <p>
 * On start: register and heartbeat, load the bots assigned to this gateway
 * (claiming every unowned bot on a first run), open their connections and
 * start the command consumer. On stop: flush the accumulator, stop the
 * consumer and the heartbeat, close connections. Active only with
 * {@code bot.gateway.enabled=true}.
 */
@Component
@ConditionalOnProperty(prefix = "bot.gateway", name = "enabled", havingValue = "true")
@Slf4j
public class GatewayRuntime {

    private final BotProperties properties;
    private final GatewayRegistryService registry;
    private final BotPort botPort;
    private final MessagingTransportPort transport;
    private final MessageAccumulator accumulator;
    private final InboundMessageService inboundMessageService;
    private final BrokerPort broker;
    private final ObjectMapper objectMapper;
    private final GatewayCommandDispatcher dispatcher;
    private final ConnectionRegistry connections;

    private final Set<String> ownedBots = new LinkedHashSet<>();
    private ScheduledExecutorService heartbeatScheduler;
    private GatewayCommandConsumer consumer;
    private String gatewayId;

    public GatewayRuntime(BotProperties properties, GatewayRegistryService registry, BotPort botPort,
            MessagingTransportPort transport, MessageAccumulator accumulator,
            InboundMessageService inboundMessageService, BrokerPort broker, ObjectMapper objectMapper,
            GatewayCommandDispatcher dispatcher, ConnectionRegistry connections) {
        this.properties = properties;
        this.registry = registry;
        this.botPort = botPort;
        this.transport = transport;
        this.accumulator = accumulator;
        this.inboundMessageService = inboundMessageService;
        this.broker = broker;
        this.objectMapper = objectMapper;
        this.dispatcher = dispatcher;
        this.connections = connections;
    }

    @PostConstruct
    public void start() {
        BotProperties.GatewayProperties settings = properties.getGateway();
        gatewayId = settings.getId();
        if (gatewayId == null || gatewayId.isBlank()) {
            throw new IllegalStateException("bot.gateway.id is required when bot.gateway.enabled=true");
        }
        Duration interval = settings.getHeartbeatInterval();
        if (interval.compareTo(settings.getHeartbeatTtl()) >= 0) {
            throw new IllegalStateException("bot.gateway.heartbeat-interval (" + interval
                    + ") must be shorter than bot.gateway.heartbeat-ttl (" + settings.getHeartbeatTtl() + ")");
        }

        log.info("[Gateway] starting: id={}", gatewayId);
        registry.register(gatewayId);
        startHeartbeat(interval);

        ownedBots.addAll(loadAssignedBots());
        log.info("[Gateway] {} bot(s) assigned to {}", ownedBots.size(), gatewayId);
        for (String botId : ownedBots) {
            try {
                transport.start(botId);
            } catch (RuntimeException e) {
                log.error("[Gateway] failed to start connection: botId={}", botId, e);
            }
        }

        consumer = new GatewayCommandConsumer(broker, objectMapper, dispatcher, properties.getCommands(), gatewayId);
        consumer.start();
        log.info("[Gateway] started: id={}, connections={}", gatewayId, connections.snapshot());
    }

    @PreDestroy
    public void stop() {
        log.info("[Gateway] shutting down: id={}", gatewayId);
        try {
            accumulator.flushAll(inboundMessageService::onFlush);
        } catch (RuntimeException e) {
            log.error("[Gateway] accumulator flush on shutdown failed", e);
        }
        if (consumer != null) {
            consumer.stop();
        }
        stopHeartbeat();
        Set<String> open = new LinkedHashSet<>(ownedBots);
        open.addAll(connections.openBots());
        for (String botId : open) {
            try {
                transport.stop(botId);
            } catch (RuntimeException e) {
                log.warn("[Gateway] failed to stop connection: botId={}, error={}", botId, e.getMessage());
            }
        }
        ownedBots.clear();
    }

    public String getGatewayId() {
        return gatewayId;
    }

    public Set<String> getOwnedBots() {
        return Set.copyOf(ownedBots);
    }

    private Set<String> loadAssignedBots() {
        Set<String> assigned = registry.botsOf(gatewayId);
        if (!assigned.isEmpty() || !properties.getGateway().isAutoAssignOnFirstRun()) {
            return assigned;
        }
        Set<String> claimed = new LinkedHashSet<>();
        for (Bot bot : botPort.findAllBots()) {
            if (registry.gatewayFor(bot.getId()).isEmpty()) {
                registry.assign(bot.getId(), gatewayId);
                claimed.add(bot.getId());
            }
        }
        log.info("[Gateway] first run: assigned {} bot(s) to {}", claimed.size(), gatewayId);
        return claimed;
    }

    private void startHeartbeat(Duration interval) {
        heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-heartbeat");
            t.setDaemon(true);
            return t;
        });
        long periodMs = interval.toMillis();
        heartbeatScheduler.scheduleAtFixedRate(this::beat, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void beat() {
        try {
            registry.heartbeat(gatewayId);
        } catch (RuntimeException e) {
            log.warn("[Gateway] heartbeat failed: id={}, error={}", gatewayId, e.getMessage());
        }
    }

    private void stopHeartbeat() {
        if (heartbeatScheduler == null) {
            return;
        }
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        heartbeatScheduler = null;
    }
}
