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

import java.util.Map;

/**
 * Tool configured for a bot in the record store. The {@link #actionType}
 * selects the executor; {@link #actionConfig} carries executor settings
 * ({@code flowId}, {@code url}/{@code method}/{@code headers}, or
 * {@code builtinName}).
 */
@Data
@Builder
public class BotTool {

    private String id;
    private String botId;
    private String name;
    private String description;
    private Map<String, Object> parameters; // JSON Schema
    private ActionType actionType;
    private Map<String, Object> actionConfig;

    @Builder.Default
    private ToolStatus status = ToolStatus.ACTIVE;

    public boolean isActive() {
        return status == ToolStatus.ACTIVE;
    }

    public ToolDefinition toDefinition() {
        return ToolDefinition.builder()
                .name(name)
                .description(description)
                .inputSchema(parameters != null ? parameters : Map.of("type", "object", "properties", Map.of()))
                .build();
    }

    public String configString(String key) {
        if (actionConfig == null) {
            return null;
        }
        Object value = actionConfig.get(key);
        return value != null ? value.toString() : null;
    }
}
