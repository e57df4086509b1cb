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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Correlated request published to the command stream of the gateway that owns
 * {@code targetId}. Serialized as JSON with fields {@code id}, {@code type},
 * {@code targetId}, {@code payload}, {@code replyTo}.
 */
public record CommandEnvelope(
        String id,
        CommandType type,
        String targetId,
        Map<String, Object> payload,
        String replyTo) {

    public CommandEnvelope {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(targetId, "targetId");
        payload = payload != null ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Map.of();
    }

    /**
     * Reads a string payload field, or {@code null} when absent.
     */
    public String payloadString(String field) {
        Object value = payload.get(field);
        return value != null ? value.toString() : null;
    }

    /**
     * Reads a required string payload field.
     *
     * @throws IllegalArgumentException
     *             if the field is missing or blank
     */
    public String requirePayloadString(String field) {
        String value = payloadString(field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing payload field '" + field + "' for " + type);
        }
        return value;
    }
}
