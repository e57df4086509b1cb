package me.golemcore.botmesh.tools;

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
import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import me.golemcore.botmesh.port.outbound.SessionPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a text message to another chat of the same bot.
 *
 * <p>
 * The target session must belong to the bot running the turn.
 */
@Component
@RequiredArgsConstructor
public class SendFollowupMessageTool implements ToolComponent {

    private final SessionPort sessionPort;
    private final GatewayActionRouter actionRouter;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("send_followup_message")
                .description("Send a follow-up message to another chat of this bot.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "session_id", Map.of("type", "string", "description", "Target session id"),
                                "message", Map.of("type", "string", "description", "Message text")),
                        "required", List.of("session_id", "message")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object sessionId = parameters.get("session_id");
            Object message = parameters.get("message");
            if (sessionId == null || message == null || message.toString().isBlank()) {
                return ToolResult.failure("Missing required fields: session_id, message");
            }

            Optional<ChatSession> target = sessionPort.findSession(sessionId.toString());
            if (target.isEmpty() || !context.getBotId().equals(target.get().getBotId())) {
                return ToolResult.failure("Session not found: " + sessionId);
            }

            actionRouter.send(context.getBotId(), target.get().getIdentifier(), OutboundPayload.text(message.toString()));
            return ToolResult.success("Follow-up sent to session " + sessionId);
        });
    }
}
