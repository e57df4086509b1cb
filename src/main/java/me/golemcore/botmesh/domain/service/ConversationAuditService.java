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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.ConversationLogEntry;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.port.outbound.ConversationLogPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the audit trail of orchestration turns. Writes are best effort: a
 * failing log store is reported and never fails the turn.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationAuditService {

    private final ConversationLogPort logPort;
    private final Clock clock;

    /**
     * Records the merged user input and, when present, the final reply.
     */
    public void recordTurn(String sessionId, String userContent, String assistantContent, String model,
            Integer tokenCount) {
        List<ConversationLogEntry> entries = new ArrayList<>(2);
        entries.add(ConversationLogEntry.builder()
                .sessionId(sessionId)
                .role("user")
                .content(userContent)
                .model(model)
                .timestamp(clock.instant())
                .build());
        if (assistantContent != null && !assistantContent.isBlank()) {
            entries.add(ConversationLogEntry.builder()
                    .sessionId(sessionId)
                    .role("assistant")
                    .content(assistantContent)
                    .model(model)
                    .tokenCount(tokenCount)
                    .timestamp(clock.instant())
                    .build());
        }
        for (ConversationLogEntry entry : entries) {
            write(entry);
        }
    }

    public void recordToolCall(String sessionId, Message.ToolCall toolCall, ToolResult result, String model) {
        boolean success = result != null && result.isSuccess();
        write(ConversationLogEntry.builder()
                .sessionId(sessionId)
                .role("tool")
                .toolName(toolCall.getName())
                .toolArgs(toolCall.getArguments())
                .toolSuccess(success)
                .toolResult(resultPayload(result))
                .model(model)
                .timestamp(clock.instant())
                .build());
    }

    private static Object resultPayload(ToolResult result) {
        if (result == null) {
            return null;
        }
        if (result.getData() != null) {
            return result.getData();
        }
        return result.isSuccess() ? result.getOutput() : result.getError();
    }

    private void write(ConversationLogEntry entry) {
        try {
            logPort.appendLog(entry);
        } catch (RuntimeException e) {
            log.warn("[Audit] log write failed: sessionId={}, role={}, error={}",
                    entry.getSessionId(), entry.getRole(), e.getMessage());
        }
    }
}
