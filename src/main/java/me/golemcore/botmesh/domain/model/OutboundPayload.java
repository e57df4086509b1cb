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
 * Payload handed to the messaging transport. Exactly one of text, image or
 * audio is set; {@code quotedMessageId} turns a text into a quote-reply.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutboundPayload(
        String text,
        String imageUrl,
        String caption,
        String audioUrl,
        Boolean ptt,
        String quotedMessageId) {

    public static OutboundPayload text(String text) {
        return new OutboundPayload(text, null, null, null, null, null);
    }

    public static OutboundPayload quotedReply(String text, String quotedMessageId) {
        return new OutboundPayload(text, null, null, null, null, quotedMessageId);
    }

    public static OutboundPayload image(String url, String caption) {
        return new OutboundPayload(null, url, caption, null, null, null);
    }

    public static OutboundPayload audio(String url, boolean ptt) {
        return new OutboundPayload(null, null, null, url, ptt, null);
    }
}
