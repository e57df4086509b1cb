package me.golemcore.botmesh.port.outbound;

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

import me.golemcore.botmesh.domain.model.OutboundPayload;

/**
 * Port for the duplex messaging transport to the external network.
 * Implementations report connection state transitions as
 * {@link me.golemcore.botmesh.domain.model.ConnectionStateChangedEvent}s and
 * forward inbound traffic to
 * {@link me.golemcore.botmesh.port.inbound.InboundMessagePort}.
 */
public interface MessagingTransportPort {

    void start(String botId);

    void stop(String botId);

    void send(String botId, String to, OutboundPayload payload);

    /**
     * Re-reads tag definitions from the external network.
     */
    void syncTags(String botId);

    void addTag(String botId, String chatId, String tagId);

    void removeTag(String botId, String chatId, String tagId);
}
