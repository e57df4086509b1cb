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

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reply written once by the owning gateway to the command's reply key.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplyEnvelope(boolean success, Object data, String error) {

    public static ReplyEnvelope ok() {
        return new ReplyEnvelope(true, null, null);
    }

    public static ReplyEnvelope ok(Object data) {
        return new ReplyEnvelope(true, data, null);
    }

    public static ReplyEnvelope failure(String error) {
        return new ReplyEnvelope(false, null, error);
    }
}
