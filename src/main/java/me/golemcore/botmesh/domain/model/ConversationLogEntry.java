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
import java.util.Map;

/**
 * One row of the per-session audit trail: a user or assistant turn, or an
 * executed action with its arguments and result.
 */
@Data
@Builder
public class ConversationLogEntry {

    private String sessionId;
    private String role; // user, assistant, tool
    private String content;
    private String model;
    private Integer tokenCount;

    private String toolName;
    private Map<String, Object> toolArgs;
    private Boolean toolSuccess;
    private Object toolResult;

    private Instant timestamp;
}
