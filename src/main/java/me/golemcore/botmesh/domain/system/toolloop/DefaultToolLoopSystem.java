package me.golemcore.botmesh.domain.system.toolloop;

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

import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.LlmRequest;
import me.golemcore.botmesh.domain.model.LlmResponse;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.service.ConversationAuditService;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded decide and act loop for a single turn.
 *
 * <p>
 * One iteration is one decision call followed by executing every action it
 * requested. The loop ends when a decision requests no actions or after
 * {@code maxIterations} decision calls; the text of the last decision is the
 * turn's final text either way. Action failures are recorded as that action's
 * result and seen by the next decision. A failing decision call ends the turn
 * with {@link DecisionServiceException}. Every executed action is written to
 * the audit trail.
 */
public class DefaultToolLoopSystem implements ToolLoopSystem {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolLoopSystem.class);

    private static final int DEFAULT_MAX_ITERATIONS = 5;

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ConversationAuditService audit;
    private final BotProperties.ToolLoopProperties settings;

    public DefaultToolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ConversationAuditService audit, BotProperties.ToolLoopProperties settings) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.audit = audit;
        this.settings = settings;
    }

    @Override
    public ToolLoopTurnResult processTurn(AgentContext context) {
        if (context.getMessages() == null) {
            context.setMessages(new ArrayList<>());
        }

        int maxIterations = settings != null ? settings.getMaxIterations() : DEFAULT_MAX_ITERATIONS;
        context.setMaxIterations(maxIterations);

        int llmCalls = 0;
        int toolExecutions = 0;
        LlmResponse last = null;

        while (llmCalls < maxIterations) {
            context.setCurrentIteration(llmCalls + 1);

            // 1) Decide
            LlmResponse response = decide(context);
            llmCalls++;
            last = response;
            if (response != null) {
                context.addTokens(response.getTotalTokens());
            }

            // 2) No actions requested: final answer
            if (response == null || !response.hasToolCalls()) {
                String finalText = response != null ? response.getContent() : null;
                if (response != null && response.hasContent()) {
                    historyWriter.appendFinalAssistantAnswer(context, response, finalText);
                }
                log.debug("[ToolLoop] turn complete: sessionId={}, llmCalls={}, toolExecutions={}",
                        context.getSessionId(), llmCalls, toolExecutions);
                return new ToolLoopTurnResult(context, finalText, llmCalls, toolExecutions, false);
            }

            // 3) Act
            historyWriter.appendAssistantToolCalls(context, response, response.getToolCalls());
            for (Message.ToolCall toolCall : response.getToolCalls()) {
                ToolExecutionOutcome outcome;
                try {
                    outcome = toolExecutor.execute(context, toolCall);
                } catch (RuntimeException e) {
                    log.warn("[ToolLoop] tool '{}' failed: {}", toolCall.getName(), e.getMessage());
                    outcome = ToolExecutionOutcome.synthetic(toolCall, "Tool execution failed: " + e.getMessage());
                }
                toolExecutions++;
                context.addToolResult(outcome.toolCallId(), outcome.toolResult());
                historyWriter.appendToolResult(context, outcome);
                audit.recordToolCall(context.getSessionId(), toolCall, outcome.toolResult(), modelOf(context));
            }
        }

        String finalText = last != null ? last.getContent() : null;
        if (last != null && last.hasContent()) {
            historyWriter.appendFinalAssistantAnswer(context, last, finalText);
        }
        log.info("[ToolLoop] iteration cap reached: sessionId={}, llmCalls={}, toolExecutions={}",
                context.getSessionId(), llmCalls, toolExecutions);
        return new ToolLoopTurnResult(context, finalText, llmCalls, toolExecutions, true);
    }

    private LlmResponse decide(AgentContext context) {
        Duration timeout = settings != null ? settings.getDecisionTimeout() : Duration.ofSeconds(60);
        try {
            return llmPort.chat(buildRequest(context)).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DecisionServiceException("Interrupted while waiting for decision", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new DecisionServiceException("Decision service failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new DecisionServiceException("Decision service timed out after " + timeout.toMillis() + "ms", e);
        }
    }

    private static String modelOf(AgentContext context) {
        return context.getBot() != null ? context.getBot().getModel() : null;
    }

    private LlmRequest buildRequest(AgentContext context) {
        LlmRequest.LlmRequestBuilder builder = LlmRequest.builder()
                .systemPrompt(context.getSystemPrompt())
                .messages(new ArrayList<>(context.getMessages()))
                .tools(context.getAvailableTools())
                .sessionId(context.getSessionId());
        if (context.getBot() != null) {
            builder.model(context.getBot().getModel());
            builder.temperature(context.getBot().getTemperature());
        }
        return builder.build();
    }
}
