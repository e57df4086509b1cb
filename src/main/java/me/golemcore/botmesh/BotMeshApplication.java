package me.golemcore.botmesh;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore BotMesh.
 *
 * <p>
 * Distributes bot connections across a pool of gateway processes and routes
 * commands to the gateway that owns a bot over a Redis command bus.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Gateway runtime    → registry heartbeat, command consumer, connections
 * Domain Layer       → CommandBus, SessionLock, Accumulator, AgentLoop
 * Infrastructure     → Redis broker, transport, webhook, record store adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code bot.*}
 * prefix; Redis via {@code spring.data.redis.*}. Set
 * {@code bot.gateway.enabled=true} and {@code bot.gateway.id} to run as a
 * gateway.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BotMeshApplication {

    public static void main(String[] args) {
        SpringApplication.run(BotMeshApplication.class, args);
    }

}
