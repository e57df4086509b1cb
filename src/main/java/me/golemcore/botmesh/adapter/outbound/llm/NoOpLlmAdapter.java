package me.golemcore.botmesh.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.LlmRequest;
import me.golemcore.botmesh.domain.model.LlmResponse;
import me.golemcore.botmesh.port.outbound.LlmPort;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * No-op decision service used when no provider is configured.
 *
 * <p>
 * Always answers with no text and no requested actions, so a turn completes
 * after one iteration without sending anything.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmPort {

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] chat() called for session {} - no provider configured", request.getSessionId());
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .model("none")
                .finishReason("stop")
                .build());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
