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

import me.golemcore.botmesh.domain.model.CommandEnvelope;
import me.golemcore.botmesh.domain.model.ReplyEnvelope;

/**
 * Executes one command on the gateway that owns its target.
 */
@FunctionalInterface
public interface GatewayCommandHandler {

    /**
     * @return the reply for the caller; exceptions are converted to a failure
     *         reply by the consumer
     */
    ReplyEnvelope handle(CommandEnvelope envelope);
}
