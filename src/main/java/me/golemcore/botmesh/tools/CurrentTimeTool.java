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

import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool for getting the current date and time.
 *
 * <p>
 * Returns the time in the requested IANA timezone, or in
 * {@code bot.tools.default-timezone} when none is given. Output includes the
 * formatted string and structured data (timezone, epoch millis, day of week).
 *
 * <p>
 * Always offered.
 */
@Component
public class CurrentTimeTool implements ToolComponent {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final Clock clock;
    private final BotProperties properties;

    public CurrentTimeTool(Clock clock, BotProperties properties) {
        this.clock = clock;
        this.properties = properties;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("get_current_time")
                .description("Get the current date and time in the given timezone.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "timezone", Map.of(
                                        "type", "string",
                                        "description",
                                        "IANA timezone (e.g., 'America/Mexico_City', 'Europe/London'). Default is "
                                                + properties.getTools().getDefaultTimezone() + ".")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object requested = parameters.get("timezone");
            String timezone = requested instanceof String s && !s.isBlank()
                    ? s
                    : properties.getTools().getDefaultTimezone();

            ZoneId zoneId;
            try {
                zoneId = ZoneId.of(timezone);
            } catch (DateTimeException e) {
                return ToolResult.failure("Invalid timezone: " + timezone);
            }

            ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneId));
            String formatted = now.format(FORMATTER);
            Map<String, Object> data = Map.of(
                    "time", formatted,
                    "timezone", zoneId.getId(),
                    "timestamp", now.toInstant().toEpochMilli(),
                    "dayOfWeek", now.getDayOfWeek().name());
            return ToolResult.success(formatted, data);
        });
    }
}
