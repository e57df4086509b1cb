package me.golemcore.botmesh.domain.service;

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

/**
 * A command could not be routed: the bot has no owning gateway, or the owner's
 * heartbeat has expired.
 */
public class GatewayRoutingException extends RuntimeException {

    private final String botId;

    public GatewayRoutingException(String botId, String message) {
        super(message);
        this.botId = botId;
    }

    public String getBotId() {
        return botId;
    }
}
