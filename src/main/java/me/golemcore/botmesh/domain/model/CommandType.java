package me.golemcore.botmesh.domain.model;

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

/**
 * Closed set of commands a gateway accepts on its inbound command stream.
 */
public enum CommandType {

    /**
     * Open the external connection for the target bot.
     */
    START_CONNECTION,

    /**
     * Close the external connection for the target bot.
     */
    STOP_CONNECTION,

    /**
     * Deliver an outbound payload. Payload: {@code to}, {@code content}.
     */
    SEND_PAYLOAD,

    /**
     * Run the orchestration loop for a session now. Payload: {@code sessionId},
     * optional {@code messageId}, optional {@code context}.
     */
    FORCE_PROCESSING,

    /**
     * Re-read external state (tags) from the transport.
     */
    SYNC_EXTERNAL_STATE,

    /**
     * Attach a tag to a chat. Payload: {@code chatId}, {@code tagId}.
     */
    ADD_TAG,

    /**
     * Detach a tag from a chat. Payload: {@code chatId}, {@code tagId}.
     */
    REMOVE_TAG
}
