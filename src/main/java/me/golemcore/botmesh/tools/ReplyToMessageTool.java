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
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sends a reply quoting a specific message of the current chat.
 */
@Component
@RequiredArgsConstructor
public class ReplyToMessageTool implements ToolComponent {

    private final GatewayActionRouter actionRouter;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("reply_to_message")
                .description("Reply quoting a specific user message. Use the id shown as [msg:ID] in the context.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "message_id", Map.of("type", "string", "description", "Id of the message to quote"),
                                "text", Map.of("type", "string", "description", "Reply text")),
                        "required", List.of("message_id", "text")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object messageId = parameters.get("message_id");
            Object text = parameters.get("text");
            if (messageId == null || text == null || text.toString().isBlank()) {
                return ToolResult.failure("Missing required fields: message_id, text");
            }
            actionRouter.send(context.getBotId(), context.getSession().getIdentifier(),
                    OutboundPayload.quotedReply(text.toString(), messageId.toString()));
            return ToolResult.success("Reply sent quoting message " + messageId);
        });
    }
}
