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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution context for one orchestration turn. Holds the bot and session, the
 * conversation history sent to the decision service, the action definitions
 * offered to it, and the results of the actions executed so far. Tools read
 * the bot and session from here.
 */
@Data
@Builder
public class AgentContext {

    private Bot bot;
    private ChatSession session;

    /**
     * Inbound message that triggered the turn (last of a coalesced batch).
     */
    private Message trigger;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    private String systemPrompt;

    @Builder.Default
    private List<ToolDefinition> availableTools = new ArrayList<>();

    @Builder.Default
    private Map<String, ToolResult> toolResults = new HashMap<>();

    private int currentIteration;
    private int maxIterations;

    /**
     * Tokens reported by the decision service over the turn so far.
     */
    private int totalTokens;

    /**
     * Adds a tool execution result to the context for correlation with tool calls.
     */
    public void addToolResult(String toolCallId, ToolResult result) {
        if (toolResults == null) {
            toolResults = new HashMap<>();
        }
        toolResults.put(toolCallId, result);
    }

    public void addTokens(Integer tokens) {
        if (tokens != null) {
            totalTokens += tokens;
        }
    }

    public String getBotId() {
        return bot != null ? bot.getId() : null;
    }

    public String getSessionId() {
        return session != null ? session.getId() : null;
    }
}
