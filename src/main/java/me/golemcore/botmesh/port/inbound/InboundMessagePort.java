package me.golemcore.botmesh.port.inbound;

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

import me.golemcore.botmesh.domain.model.Message;

/**
 * Entry point for external input arriving at the gateway that owns the bot's
 * connection.
 */
public interface InboundMessagePort {

    /**
     * Handles a persisted inbound message.
     *
     * @param botId
     *            owning bot
     * @param message
     *            message already stored in the record store (has an id and a
     *            session id)
     */
    void onInbound(String botId, Message message);
}
