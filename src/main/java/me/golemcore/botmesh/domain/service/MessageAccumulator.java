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
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.BrokerPort;
import me.golemcore.botmesh.port.outbound.MessagePort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Crash-safe per-session debounce buffer.
 *
 * <p>
 * Message ids are appended to a broker list; the in-process timer only decides
 * when to flush. A flush drains the list atomically, resolves the ids through
 * the {@link MessagePort} and hands the messages to the callback in arrival
 * order. Ids appended after the drain belong to the next buffer.
 *
 * <p>
 * On shutdown {@link #flushAll(FlushCallback)} fires pending timers and then
 * flushes buffers left behind by a previous crash of this gateway, which have
 * data in the broker but no timer. Buffer keys carry the gateway id, so the
 * sweep never touches buffers whose timers live in another process.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MessageAccumulator {

    private static final int SAFETY_TTL_DEBOUNCE_FACTOR = 4;
    static final String STANDALONE_OWNER = "local";

    private final BrokerPort broker;
    private final MessagePort messagePort;
    private final DebounceTimerRegistry timers;
    private final BotProperties properties;

    /**
     * Receives a drained batch. Exceptions are logged; the batch is not
     * re-buffered.
     */
    @FunctionalInterface
    public interface FlushCallback {
        void onFlush(String sessionId, List<Message> messages);
    }

    public void accumulate(String sessionId, Message message, Duration debounce, FlushCallback onFlush) {
        Objects.requireNonNull(message.getId(), "message id");
        broker.pushWithTtl(GatewayKeys.accumulator(ownerId(), sessionId), message.getId(), safetyTtl(debounce));
        timers.schedule(sessionId, debounce, () -> flush(sessionId, onFlush));
        log.debug("[Accumulator] buffered: sessionId={}, messageId={}, debounce={}",
                sessionId, message.getId(), debounce);
    }

    /**
     * Flushes every pending timer now, then every orphaned buffer.
     *
     * @return number of sessions that were flushed
     */
    public int flushAll(FlushCallback onFlush) {
        int fired = timers.fireAll();
        int orphans = 0;
        String ownerId = ownerId();
        for (String key : broker.scanKeys(GatewayKeys.accumulatorPattern(ownerId))) {
            String sessionId = GatewayKeys.sessionOfAccumulator(ownerId, key);
            if (timers.isPending(sessionId)) {
                continue;
            }
            if (flush(sessionId, onFlush)) {
                orphans++;
            }
        }
        log.info("[Accumulator] flushAll: timers={}, orphans={}", fired, orphans);
        return fired + orphans;
    }

    public int pendingCount() {
        return timers.size();
    }

    boolean flush(String sessionId, FlushCallback onFlush) {
        List<String> ids = broker.drainList(GatewayKeys.accumulator(ownerId(), sessionId));
        if (ids.isEmpty()) {
            log.debug("[Accumulator] nothing to flush: sessionId={}", sessionId);
            return false;
        }
        List<Message> messages = messagePort.findAllById(ids);
        if (messages.size() < ids.size()) {
            log.warn("[Accumulator] {} buffered message(s) not found: sessionId={}",
                    ids.size() - messages.size(), sessionId);
        }
        if (messages.isEmpty()) {
            return false;
        }
        log.info("[Accumulator] flushing: sessionId={}, messages={}", sessionId, messages.size());
        try {
            onFlush.onFlush(sessionId, messages);
        } catch (RuntimeException e) {
            log.error("[Accumulator] flush callback failed: sessionId={}", sessionId, e);
        }
        return true;
    }

    String ownerId() {
        String gatewayId = properties.getGateway().getId();
        return gatewayId != null && !gatewayId.isBlank() ? gatewayId : STANDALONE_OWNER;
    }

    private Duration safetyTtl(Duration debounce) {
        Duration floor = debounce.multipliedBy(SAFETY_TTL_DEBOUNCE_FACTOR);
        Duration configured = properties.getAccumulator().getSafetyTtl();
        return configured.compareTo(floor) >= 0 ? configured : floor;
    }
}
