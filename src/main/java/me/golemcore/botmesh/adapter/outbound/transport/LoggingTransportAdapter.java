package me.golemcore.botmesh.adapter.outbound.transport;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.ConnectionState;
import me.golemcore.botmesh.domain.model.ConnectionStateChangedEvent;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.infrastructure.event.SpringEventBus;
import me.golemcore.botmesh.port.inbound.InboundMessagePort;
import me.golemcore.botmesh.port.outbound.MessagePort;
import me.golemcore.botmesh.port.outbound.MessagingTransportPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Transport that keeps connections as in-process state and logs outbound
 * traffic instead of talking to an external network.
 *
 * <p>
 * Connection transitions are published as {@link ConnectionStateChangedEvent}s.
 * {@link #receive(String, Message)} is the inbound side: it stores the message
 * and forwards it to the {@link InboundMessagePort}.
 */
@Component
@Slf4j
public class LoggingTransportAdapter implements MessagingTransportPort {

    private final SpringEventBus eventBus;
    private final MessagePort messagePort;
    private final ObjectProvider<InboundMessagePort> inboundPort;
    private final Clock clock;

    private final Set<String> connected = ConcurrentHashMap.newKeySet();
    private final Map<String, Set<String>> chatTags = new ConcurrentHashMap<>();

    public LoggingTransportAdapter(SpringEventBus eventBus, MessagePort messagePort,
            ObjectProvider<InboundMessagePort> inboundPort, Clock clock) {
        this.eventBus = eventBus;
        this.messagePort = messagePort;
        this.inboundPort = inboundPort;
        this.clock = clock;
    }

    @Override
    public void start(String botId) {
        publish(botId, ConnectionState.CONNECTING);
        connected.add(botId);
        publish(botId, ConnectionState.CONNECTED);
    }

    @Override
    public void stop(String botId) {
        if (connected.remove(botId)) {
            publish(botId, ConnectionState.DISCONNECTED);
        }
    }

    @Override
    public void send(String botId, String to, OutboundPayload payload) {
        requireConnected(botId);
        log.info("[Transport] send: botId={}, to={}, payload={}", botId, to, payload);
    }

    @Override
    public void syncTags(String botId) {
        requireConnected(botId);
        log.info("[Transport] tags synced: botId={}, chats={}", botId, chatTags.size());
    }

    @Override
    public void addTag(String botId, String chatId, String tagId) {
        requireConnected(botId);
        chatTags.computeIfAbsent(botId + ":" + chatId, k -> ConcurrentHashMap.newKeySet()).add(tagId);
        log.info("[Transport] tag added: botId={}, chatId={}, tagId={}", botId, chatId, tagId);
    }

    @Override
    public void removeTag(String botId, String chatId, String tagId) {
        requireConnected(botId);
        Set<String> tags = chatTags.get(botId + ":" + chatId);
        if (tags != null) {
            tags.remove(tagId);
        }
        log.info("[Transport] tag removed: botId={}, chatId={}, tagId={}", botId, chatId, tagId);
    }

    /**
     * Inbound message from the network for a connected bot.
     */
    public void receive(String botId, Message message) {
        requireConnected(botId);
        Message stored = messagePort.save(message);
        inboundPort.getObject().onInbound(botId, stored);
    }

    public boolean isConnected(String botId) {
        return connected.contains(botId);
    }

    public Set<String> tagsOf(String botId, String chatId) {
        return Set.copyOf(chatTags.getOrDefault(botId + ":" + chatId, Set.of()));
    }

    private void requireConnected(String botId) {
        if (!connected.contains(botId)) {
            throw new IllegalStateException("No active connection for bot " + botId);
        }
    }

    private void publish(String botId, ConnectionState state) {
        eventBus.publish(new ConnectionStateChangedEvent(botId, state, null, clock.instant()));
    }
}
