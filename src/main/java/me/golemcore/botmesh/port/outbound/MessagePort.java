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

import me.golemcore.botmesh.domain.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Record store access for inbound messages.
 */
public interface MessagePort {

    Optional<Message> findMessage(String messageId);

    /**
     * Resolves ids to messages, preserving the order of {@code messageIds}.
     * Unknown ids are skipped.
     */
    List<Message> findAllById(List<String> messageIds);

    /**
     * Persists a message, assigning an id when it has none.
     *
     * @return the stored message
     */
    Message save(Message message);
}
