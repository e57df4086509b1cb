package me.golemcore.botmesh.port.outbound;

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

import me.golemcore.botmesh.domain.model.BotTool;
import me.golemcore.botmesh.domain.model.Flow;

import java.util.List;
import java.util.Optional;

/**
 * Record store access for bot tools and the flows they run.
 */
public interface ToolPort {

    List<BotTool> findActiveTools(String botId);

    Optional<BotTool> findActiveTool(String botId, String name);

    /**
     * Loads a flow with its steps sorted by order.
     */
    Optional<Flow> findFlow(String flowId);
}
