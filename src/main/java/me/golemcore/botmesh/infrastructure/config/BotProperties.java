package me.golemcore.botmesh.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link GatewayProperties} - gateway identity and heartbeat</li>
 * <li>{@link CommandProperties} - command bus stream and reply settings</li>
 * <li>{@link LockProperties} - per-session lease</li>
 * <li>{@link AccumulatorProperties} - debounce buffer safety expiry</li>
 * <li>{@link ToolLoopProperties} - orchestration loop budget</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private GatewayProperties gateway = new GatewayProperties();
    private CommandProperties commands = new CommandProperties();
    private LockProperties lock = new LockProperties();
    private AccumulatorProperties accumulator = new AccumulatorProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private MessagesProperties messages = new MessagesProperties();
    private ToolsProperties tools = new ToolsProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== GATEWAY ====================

    @Data
    public static class GatewayProperties {
        /**
         * Run this process as a gateway (registry member, command consumer,
         * connection owner). Disabled processes only produce commands.
         */
        private boolean enabled = false;
        private String id;
        private Duration heartbeatInterval = Duration.ofSeconds(10);
        private Duration heartbeatTtl = Duration.ofSeconds(30);
        /**
         * When nothing is assigned to this gateway at start, claim every known
         * bot.
         */
        private boolean autoAssignOnFirstRun = true;
    }

    @Data
    public static class CommandProperties {
        private Duration defaultTimeout = Duration.ofSeconds(15);
        private long streamMaxLength = 1000;
        private int batchSize = 10;
        private Duration blockTimeout = Duration.ofSeconds(5);
        private Duration replyTtl = Duration.ofSeconds(30);
        private Duration errorBackoff = Duration.ofSeconds(1);
    }

    @Data
    public static class LockProperties {
        private Duration lease = Duration.ofSeconds(60);
    }

    @Data
    public static class AccumulatorProperties {
        private Duration safetyTtl = Duration.ofMinutes(10);
    }

    // ==================== ORCHESTRATION ====================

    @Data
    public static class ToolLoopProperties {
        /**
         * Maximum decision calls per turn.
         */
        private int maxIterations = 5;
        private Duration decisionTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class MessagesProperties {
        private String fallbackText = "Sorry, something went wrong while processing your message. Please try again later.";
    }

    @Data
    public static class ToolsProperties {
        private String defaultTimezone = "UTC";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
