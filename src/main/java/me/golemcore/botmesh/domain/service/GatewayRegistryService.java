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
import me.golemcore.botmesh.domain.model.GatewayRecord;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.BrokerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tracks live gateways and the bot to gateway assignment.
 *
 * <p>
 * Liveness is a point-in-time check of the gateway's heartbeat key; the
 * registry set only records gateways that ever registered and is always
 * filtered by liveness before use. The assignment hash (bot to gateway) is
 * authoritative; the per-gateway reverse sets are a load index kept in step
 * with it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GatewayRegistryService {

    private final BrokerPort broker;
    private final BotProperties properties;
    private final Clock clock;

    /**
     * Adds the gateway to the registry and marks it live.
     */
    public void register(String gatewayId) {
        Objects.requireNonNull(gatewayId, "gatewayId");
        broker.addToSet(GatewayKeys.REGISTRY, gatewayId);
        heartbeat(gatewayId);
        log.info("[Registry] gateway registered: id={}", gatewayId);
    }

    /**
     * Marks the gateway live until now plus the heartbeat TTL. Idempotent.
     */
    public void heartbeat(String gatewayId) {
        Duration ttl = properties.getGateway().getHeartbeatTtl();
        broker.setWithTtl(GatewayKeys.heartbeat(gatewayId), String.valueOf(clock.millis()), ttl);
        log.trace("[Registry] heartbeat: id={}", gatewayId);
    }

    public boolean isAlive(String gatewayId) {
        return broker.exists(GatewayKeys.heartbeat(gatewayId));
    }

    /**
     * Makes {@code gatewayId} the single owner of {@code botId}, moving it out of
     * any previous owner's reverse set.
     */
    public void assign(String botId, String gatewayId) {
        Objects.requireNonNull(botId, "botId");
        Objects.requireNonNull(gatewayId, "gatewayId");
        Optional<String> previous = broker.hashGet(GatewayKeys.ASSIGNMENTS, botId);

        // Reverse index first: a crash before the hash write leaves only an
        // over-counted load entry, never an owner without a reverse entry.
        broker.addToSet(GatewayKeys.bots(gatewayId), botId);
        broker.hashPut(GatewayKeys.ASSIGNMENTS, botId, gatewayId);
        previous.filter(old -> !old.equals(gatewayId))
                .ifPresent(old -> broker.removeFromSet(GatewayKeys.bots(old), botId));

        log.info("[Registry] bot assigned: botId={}, gatewayId={}, previous={}",
                botId, gatewayId, previous.orElse("none"));
    }

    public void unassign(String botId) {
        Optional<String> owner = broker.hashGet(GatewayKeys.ASSIGNMENTS, botId);
        broker.hashDelete(GatewayKeys.ASSIGNMENTS, botId);
        owner.ifPresent(gatewayId -> broker.removeFromSet(GatewayKeys.bots(gatewayId), botId));
        log.info("[Registry] bot unassigned: botId={}, gatewayId={}", botId, owner.orElse("none"));
    }

    public Optional<String> gatewayFor(String botId) {
        return broker.hashGet(GatewayKeys.ASSIGNMENTS, botId);
    }

    /**
     * Bots owned by a gateway. Reverse-set members whose forward entry points
     * elsewhere (a torn assign) are dropped.
     */
    public Set<String> botsOf(String gatewayId) {
        Set<String> result = new LinkedHashSet<>();
        for (String botId : new TreeSet<>(broker.members(GatewayKeys.bots(gatewayId)))) {
            if (gatewayFor(botId).filter(gatewayId::equals).isPresent()) {
                result.add(botId);
            }
        }
        return result;
    }

    /**
     * Live gateway with the fewest assigned bots. Ties go to the first gateway
     * in id order.
     */
    public Optional<String> leastLoaded() {
        String best = null;
        long bestLoad = Long.MAX_VALUE;
        for (String gatewayId : sortedRegistry()) {
            if (!isAlive(gatewayId)) {
                continue;
            }
            long load = broker.setSize(GatewayKeys.bots(gatewayId));
            if (load < bestLoad) {
                best = gatewayId;
                bestLoad = load;
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Assigns the bot to the least loaded live gateway.
     *
     * @return the chosen gateway, or empty when no gateway is live
     */
    public Optional<String> assignToLeastLoaded(String botId) {
        Optional<String> target = leastLoaded();
        if (target.isEmpty()) {
            log.warn("[Registry] no live gateway for bot: botId={}", botId);
            return Optional.empty();
        }
        assign(botId, target.get());
        return target;
    }

    public List<GatewayRecord> liveGateways() {
        List<GatewayRecord> records = new ArrayList<>();
        for (String gatewayId : sortedRegistry()) {
            Optional<String> beat = broker.get(GatewayKeys.heartbeat(gatewayId));
            if (beat.isEmpty()) {
                continue;
            }
            records.add(new GatewayRecord(gatewayId, parseInstant(beat.get()),
                    broker.setSize(GatewayKeys.bots(gatewayId))));
        }
        return records;
    }

    private Set<String> sortedRegistry() {
        return new TreeSet<>(broker.members(GatewayKeys.REGISTRY));
    }

    private Instant parseInstant(String epochMillis) {
        try {
            return Instant.ofEpochMilli(Long.parseLong(epochMillis));
        } catch (NumberFormatException e) {
            log.debug("[Registry] unparsable heartbeat value: {}", epochMillis);
            return null;
        }
    }
}
