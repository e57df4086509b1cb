package me.golemcore.botmesh.domain.loop;

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
import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.model.BotTool;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.service.ConversationAuditService;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import me.golemcore.botmesh.domain.service.SessionLockService;
import me.golemcore.botmesh.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.botmesh.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.BotPort;
import me.golemcore.botmesh.port.outbound.ConversationPort;
import me.golemcore.botmesh.port.outbound.SessionPort;
import me.golemcore.botmesh.port.outbound.ToolPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Runs one processing turn for a session under the session lease.
 *
 * <p>
 * A turn merges the triggering messages into one user message, gathers the
 * conversation history and the bot's active tools, runs the
 * {@link ToolLoopSystem} and delivers its final text. Completed turns are
 * written to the audit trail. If the lease is held by another turn the call
 * returns without doing anything. The lease is released on every exit path.
 * When the turn fails, a fallback text is sent on a best effort basis.
 */
@Component
@Slf4j
public class AgentLoop {

    private static final String EMPTY_MESSAGE = "[empty message]";

    private final SessionLockService lockService;
    private final SessionPort sessionPort;
    private final BotPort botPort;
    private final ConversationPort conversationPort;
    private final ToolPort toolPort;
    private final ToolLoopSystem toolLoopSystem;
    private final GatewayActionRouter actionRouter;
    private final ConversationAuditService audit;
    private final List<ToolComponent> builtinTools;
    private final BotProperties properties;
    private final Clock clock;

    public AgentLoop(SessionLockService lockService, SessionPort sessionPort, BotPort botPort,
            ConversationPort conversationPort, ToolPort toolPort, ToolLoopSystem toolLoopSystem,
            GatewayActionRouter actionRouter, ConversationAuditService audit, List<ToolComponent> builtinTools,
            BotProperties properties, Clock clock) {
        this.lockService = lockService;
        this.sessionPort = sessionPort;
        this.botPort = botPort;
        this.conversationPort = conversationPort;
        this.toolPort = toolPort;
        this.toolLoopSystem = toolLoopSystem;
        this.actionRouter = actionRouter;
        this.audit = audit;
        this.builtinTools = builtinTools;
        this.properties = properties;
        this.clock = clock;
    }

    public void processMessage(String sessionId, Message message) {
        processMessages(sessionId, List.of(message));
    }

    /**
     * Processes a batch of inbound messages for a session as one turn.
     */
    public void processMessages(String sessionId, List<Message> messages) {
        if (messages == null || messages.isEmpty()) {
            return;
        }
        if (!lockService.acquire(sessionId, properties.getLock().getLease())) {
            log.debug("[AgentLoop] turn already in flight, skipping: sessionId={}", sessionId);
            return;
        }

        ChatSession session = null;
        Bot bot = null;
        try {
            session = sessionPort.findSession(sessionId).orElse(null);
            if (session == null) {
                log.error("[AgentLoop] session not found: sessionId={}", sessionId);
                return;
            }
            bot = botPort.findBot(session.getBotId()).orElse(null);
            if (bot == null) {
                log.error("[AgentLoop] bot not found: sessionId={}, botId={}", sessionId, session.getBotId());
                return;
            }
            runTurn(bot, session, messages);
        } catch (RuntimeException e) {
            log.error("[AgentLoop] turn failed: sessionId={}", sessionId, e);
            sendFallback(bot, session);
        } finally {
            lockService.release(sessionId);
        }
    }

    private void runTurn(Bot bot, ChatSession session, List<Message> batch) {
        Message trigger = batch.get(batch.size() - 1);
        Message userMessage = Message.builder()
                .id(UUID.randomUUID().toString())
                .sessionId(session.getId())
                .role("user")
                .content(mergeContents(batch))
                .sender(trigger.getSender())
                .timestamp(clock.instant())
                .build();

        List<Message> conversation = new ArrayList<>(conversationPort.getHistory(session.getId()));
        conversation.add(userMessage);
        conversationPort.append(session.getId(), userMessage);

        AgentContext context = AgentContext.builder()
                .bot(bot)
                .session(session)
                .trigger(trigger)
                .messages(conversation)
                .systemPrompt(bot.getSystemPrompt())
                .availableTools(collectTools(bot))
                .build();
        int turnStart = conversation.size();

        log.info("[AgentLoop] turn start: sessionId={}, botId={}, batch={}, tools={}",
                session.getId(), bot.getId(), batch.size(), context.getAvailableTools().size());
        ToolLoopTurnResult result = toolLoopSystem.processTurn(context);

        if (result.hasFinalText()) {
            actionRouter.send(bot.getId(), session.getIdentifier(), OutboundPayload.text(result.finalText()));
        }
        List<Message> produced = context.getMessages();
        if (produced.size() > turnStart) {
            conversationPort.appendAll(session.getId(), new ArrayList<>(produced.subList(turnStart, produced.size())));
        }
        audit.recordTurn(session.getId(), userMessage.getContent(), result.finalText(), bot.getModel(),
                context.getTotalTokens() > 0 ? context.getTotalTokens() : null);
        log.info("[AgentLoop] turn done: sessionId={}, llmCalls={}, toolExecutions={}, capReached={}",
                session.getId(), result.llmCalls(), result.toolExecutions(), result.iterationCapReached());
    }

    private List<ToolDefinition> collectTools(Bot bot) {
        List<ToolDefinition> definitions = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (ToolComponent builtin : builtinTools) {
            definitions.add(builtin.getDefinition());
            names.add(builtin.getToolName());
        }
        for (BotTool tool : toolPort.findActiveTools(bot.getId())) {
            if (names.add(tool.getName())) {
                definitions.add(tool.toDefinition());
            } else {
                log.debug("[AgentLoop] tool '{}' shadowed by built-in: botId={}", tool.getName(), bot.getId());
            }
        }
        return definitions;
    }

    static String mergeContents(List<Message> batch) {
        String merged = batch.stream()
                .map(Message::getContent)
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(content -> !content.isEmpty())
                .collect(Collectors.joining("\n\n"));
        return merged.isEmpty() ? EMPTY_MESSAGE : merged;
    }

    private void sendFallback(Bot bot, ChatSession session) {
        if (bot == null || session == null) {
            return;
        }
        String text = Optional.ofNullable(properties.getMessages().getFallbackText()).orElse("");
        if (text.isBlank()) {
            return;
        }
        try {
            actionRouter.send(bot.getId(), session.getIdentifier(), OutboundPayload.text(text));
        } catch (RuntimeException e) {
            log.warn("[AgentLoop] fallback message not delivered: sessionId={}, error={}",
                    session.getId(), e.getMessage());
        }
    }
}
