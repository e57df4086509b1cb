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
import me.golemcore.botmesh.domain.loop.AgentLoop;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.port.inbound.InboundMessagePort;
import me.golemcore.botmesh.port.outbound.BotPort;
import me.golemcore.botmesh.port.outbound.SessionPort;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Entry point for messages arriving on a connection this gateway owns.
 *
 * <p>
 * Paused bots, bots with AI disabled and sessions with AI disabled are not
 * processed. Bots with a message delay are debounced through the
 * {@link MessageAccumulator}; all other messages start a turn right away on
 * the session executor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InboundMessageService implements InboundMessagePort {

    private final BotPort botPort;
    private final SessionPort sessionPort;
    private final MessageAccumulator accumulator;
    private final AgentLoop agentLoop;
    private final ExecutorService sessionRunExecutor;

    @Override
    public void onInbound(String botId, Message message) {
        if (message.isFromMe()) {
            return;
        }
        Optional<Bot> bot = botPort.findBot(botId);
        if (bot.isEmpty()) {
            log.warn("[Inbound] unknown bot: botId={}", botId);
            return;
        }
        if (bot.get().isPaused() || !bot.get().isAiEnabled()) {
            log.debug("[Inbound] bot not processing: botId={}, paused={}, aiEnabled={}",
                    botId, bot.get().isPaused(), bot.get().isAiEnabled());
            return;
        }
        Optional<ChatSession> session = sessionPort.findSession(message.getSessionId());
        if (session.isEmpty() || !session.get().isAiEnabled()) {
            log.debug("[Inbound] session not processing: sessionId={}", message.getSessionId());
            return;
        }

        int delaySeconds = bot.get().getMessageDelaySeconds();
        if (delaySeconds > 0) {
            accumulator.accumulate(message.getSessionId(), message, Duration.ofSeconds(delaySeconds),
                    this::onFlush);
        } else {
            submit(message.getSessionId(), List.of(message));
        }
    }

    /**
     * Flush callback for the accumulator. Hands the batch off to the session
     * executor.
     */
    public void onFlush(String sessionId, List<Message> messages) {
        submit(sessionId, messages);
    }

    private void submit(String sessionId, List<Message> messages) {
        sessionRunExecutor.execute(() -> {
            try {
                agentLoop.processMessages(sessionId, messages);
            } catch (RuntimeException e) {
                log.error("[Inbound] turn failed: sessionId={}", sessionId, e);
            }
        });
    }
}
