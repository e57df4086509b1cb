package me.golemcore.botmesh.domain.system.toolloop;

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

import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.LlmResponse;
import me.golemcore.botmesh.domain.model.Message;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Appends the turn's assistant and tool messages to the in-turn conversation
 * held by the {@link AgentContext}.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(AgentContext context, LlmResponse llmResponse,
            List<Message.ToolCall> toolCalls) {
        context.getMessages().add(Message.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(context.getSessionId())
                .role("assistant")
                .content(llmResponse != null ? llmResponse.getContent() : null)
                .toolCalls(toolCalls)
                .fromMe(true)
                .timestamp(now())
                .build());
    }

    @Override
    public void appendToolResult(AgentContext context, ToolExecutionOutcome outcome) {
        context.getMessages().add(Message.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(context.getSessionId())
                .role("tool")
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(now())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(AgentContext context, LlmResponse llmResponse, String finalText) {
        context.getMessages().add(Message.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(context.getSessionId())
                .role("assistant")
                .content(finalText)
                .fromMe(true)
                .timestamp(now())
                .build());
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
