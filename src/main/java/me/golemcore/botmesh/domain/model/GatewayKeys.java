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

/**
 * Broker keyspace shared by every process in the mesh.
 */
public final class GatewayKeys {

    public static final String REGISTRY = "gateway:registry";
    public static final String ASSIGNMENTS = "gateway:assignments";
    public static final String COMMAND_FIELD = "command";

    private static final String ACCUMULATOR_PREFIX = "accumulator:";

    private GatewayKeys() {
    }

    public static String heartbeat(String gatewayId) {
        return "gateway:heartbeat:" + gatewayId;
    }

    public static String bots(String gatewayId) {
        return "gateway:" + gatewayId + ":bots";
    }

    public static String commands(String gatewayId) {
        return "gateway:" + gatewayId + ":commands";
    }

    public static String consumerGroup(String gatewayId) {
        return "cmd_handler_" + gatewayId;
    }

    public static String reply(String commandId) {
        return "cmd:reply:" + commandId;
    }

    public static String sessionLock(String sessionId) {
        return "session:lock:" + sessionId;
    }

    /**
     * Debounce buffer of a session, scoped to the process that owns its timer.
     */
    public static String accumulator(String ownerId, String sessionId) {
        return accumulatorPrefix(ownerId) + sessionId;
    }

    /**
     * Match pattern for every buffer owned by {@code ownerId}.
     */
    public static String accumulatorPattern(String ownerId) {
        return accumulatorPrefix(ownerId) + "*";
    }

    /**
     * Extracts the session id from a buffer key of {@code ownerId}.
     */
    public static String sessionOfAccumulator(String ownerId, String key) {
        String prefix = accumulatorPrefix(ownerId);
        return key.startsWith(prefix) ? key.substring(prefix.length()) : key;
    }

    private static String accumulatorPrefix(String ownerId) {
        return ACCUMULATOR_PREFIX + ownerId + ":";
    }
}
