package me.golemcore.botmesh.domain.component;

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
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Built-in tool offered to every bot alongside its configured tools. Tools
 * expose their JSON Schema definition to the decision service and implement
 * the execution logic against the session in the {@link AgentContext}.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool for the current session.
     *
     * @param context
     *            bot, session and trigger message of the running turn
     * @param parameters
     *            arguments requested by the decision service
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
