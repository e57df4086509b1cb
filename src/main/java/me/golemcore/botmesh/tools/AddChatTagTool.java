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
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Attaches a tag to the current chat on the external network.
 */
@Component
@RequiredArgsConstructor
public class AddChatTagTool implements ToolComponent {

    private final GatewayActionRouter actionRouter;

    @Override
    public ToolDefinition getDefinition() {
        return tagDefinition("add_chat_tag", "Attach a tag to the current chat.");
    }

    @Override
    public CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object tagId = parameters.get("tag_id");
            if (tagId == null || tagId.toString().isBlank()) {
                return ToolResult.failure("Missing required field: tag_id");
            }
            actionRouter.addTag(context.getBotId(), context.getSession().getIdentifier(), tagId.toString());
            return ToolResult.success("Tag " + tagId + " added.");
        });
    }

    static ToolDefinition tagDefinition(String name, String description) {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "tag_id", Map.of("type", "string", "description", "Tag id on the external network")),
                        "required", List.of("tag_id")))
                .build();
    }
}
