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

/**
 * A unit of ownership: one external connection identity, owned by exactly one
 * gateway at a time.
 */
@Data
@Builder
public class Bot {

    private String id;
    private String name;

    @Builder.Default
    private boolean aiEnabled = true;

    private boolean paused;

    private String systemPrompt;
    private String model;

    @Builder.Default
    private double temperature = 0.7;

    /**
     * Debounce window in seconds for bursts of inbound messages. Zero disables
     * accumulation.
     */
    private int messageDelaySeconds;
}
