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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Represents a single message in a conversation. Inbound messages from the
 * counterparty are persisted by the record store and referenced by id from the
 * accumulator buffer; conversation history entries use the same type with
 * roles user, assistant and tool.
 */
@Data
@Builder
public class Message {

    private String id;
    private String sessionId;
    private String role; // user, assistant, tool
    private String content;
    private String sender;
    private boolean fromMe;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool response messages
    private String toolName; // Tool name for tool response messages

    private Map<String, Object> metadata;
    private Instant timestamp;

    public boolean isUserMessage() {
        return "user".equals(role);
    }

    public boolean isToolMessage() {
        return "tool".equals(role);
    }

    /**
     * Checks if this message contains tool calls from the decision service.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * Action requested by the decision service.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
