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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.GatewayKeys;
import me.golemcore.botmesh.port.outbound.BrokerPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.UUID;

/**
 * Per-session mutual-exclusion lease in the broker.
 *
 * <p>
 * Acquisition is a single set-if-absent with expiry. Release deletes the key
 * without checking the holder token, so a slow former holder can release a
 * lease that a newer holder took after expiry. A lease that is never released
 * lapses on its own.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionLockService {

    private final BrokerPort broker;

    public boolean acquire(String sessionId, Duration lease) {
        if (lease == null || lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("Lease must be positive: " + lease);
        }
        String token = UUID.randomUUID().toString();
        boolean acquired = broker.setIfAbsent(GatewayKeys.sessionLock(sessionId), token, lease);
        if (acquired) {
            log.debug("[SessionLock] acquired: sessionId={}, lease={}", sessionId, lease);
        } else {
            log.debug("[SessionLock] busy: sessionId={}", sessionId);
        }
        return acquired;
    }

    public void release(String sessionId) {
        broker.delete(GatewayKeys.sessionLock(sessionId));
        log.debug("[SessionLock] released: sessionId={}", sessionId);
    }
}
