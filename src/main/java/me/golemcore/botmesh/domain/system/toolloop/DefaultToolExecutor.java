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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.BotTool;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.Flow;
import me.golemcore.botmesh.domain.model.FlowStep;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.OutboundPayload;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import me.golemcore.botmesh.port.outbound.ToolPort;
import me.golemcore.botmesh.port.outbound.WebhookPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Resolves a requested action to its executor and runs it.
 *
 * <p>
 * Built-in tools are matched by name first. Other names are looked up among
 * the bot's active tools and dispatched on their {@link me.golemcore.botmesh.domain.model.ActionType}:
 * scripted flows, outbound webhooks, or a named built-in.
 */
public class DefaultToolExecutor implements ToolExecutorPort {

    private static final Logger log = LoggerFactory.getLogger(DefaultToolExecutor.class);

    private static final int SUMMARY_LENGTH = 50;

    private final Map<String, ToolComponent> builtins;
    private final ToolPort toolPort;
    private final WebhookPort webhookPort;
    private final GatewayActionRouter actionRouter;
    private final ObjectMapper objectMapper;

    public DefaultToolExecutor(List<ToolComponent> builtins, ToolPort toolPort, WebhookPort webhookPort,
            GatewayActionRouter actionRouter, ObjectMapper objectMapper) {
        this.builtins = builtins.stream()
                .collect(Collectors.toMap(ToolComponent::getToolName, Function.identity(), (a, b) -> a,
                        LinkedHashMap::new));
        this.toolPort = toolPort;
        this.webhookPort = webhookPort;
        this.actionRouter = actionRouter;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolExecutionOutcome execute(AgentContext context, Message.ToolCall toolCall) {
        Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        log.info("[ToolLoop] executing tool: name={}, sessionId={}", toolCall.getName(), context.getSessionId());

        ToolResult result;
        try {
            result = resolveAndRun(context, toolCall.getName(), args);
        } catch (RuntimeException e) {
            log.warn("[ToolLoop] tool '{}' threw: {}", toolCall.getName(), e.getMessage());
            result = ToolResult.failure(e.getMessage() != null ? e.getMessage() : "Tool execution failed");
        }
        return ToolExecutionOutcome.of(toolCall, result, render(result));
    }

    private ToolResult resolveAndRun(AgentContext context, String name, Map<String, Object> args) {
        ToolComponent builtin = builtins.get(name);
        if (builtin != null) {
            return runBuiltin(builtin, context, args);
        }
        Optional<BotTool> tool = toolPort.findActiveTool(context.getBotId(), name);
        if (tool.isEmpty()) {
            return ToolResult.failure("Tool '" + name + "' not found or disabled.");
        }
        BotTool botTool = tool.get();
        return switch (botTool.getActionType()) {
        case FLOW -> runFlow(context, botTool, args);
        case WEBHOOK -> runWebhook(context, botTool, args);
        case BUILTIN -> runNamedBuiltin(context, botTool, args);
        };
    }

    private ToolResult runBuiltin(ToolComponent builtin, AgentContext context, Map<String, Object> args) {
        try {
            return builtin.execute(context, args).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return ToolResult.failure(cause.getMessage());
        }
    }

    private ToolResult runNamedBuiltin(AgentContext context, BotTool tool, Map<String, Object> args) {
        String builtinName = Optional.ofNullable(tool.configString("builtinName")).orElse(tool.getName());
        ToolComponent builtin = builtins.get(builtinName);
        if (builtin == null) {
            return ToolResult.failure("Unknown builtin: " + builtinName);
        }
        return runBuiltin(builtin, context, args);
    }

    // ==================== FLOW ====================

    private ToolResult runFlow(AgentContext context, BotTool tool, Map<String, Object> args) {
        String flowId = tool.configString("flowId");
        if (flowId == null) {
            return ToolResult.failure("No flowId configured for this tool.");
        }
        Optional<Flow> flow = toolPort.findFlow(flowId);
        if (flow.isEmpty()) {
            return ToolResult.failure("Flow '" + flowId + "' not found.");
        }

        ChatSession session = context.getSession();
        List<FlowStep> steps = new ArrayList<>(flow.get().getSteps());
        steps.sort(Comparator.comparingInt(FlowStep::getOrder));

        List<String> results = new ArrayList<>();
        for (FlowStep step : steps) {
            String content = interpolate(step.getContent(), args);
            try {
                OutboundPayload payload = toPayload(step, content);
                if (payload != null) {
                    actionRouter.send(context.getBotId(), session.getIdentifier(), payload);
                    results.add(describe(step, content));
                }
            } catch (RuntimeException e) {
                results.add("Failed step " + step.getOrder() + ": " + e.getMessage());
            }
            if (step.getDelayMs() > 0) {
                pause(step.getDelayMs());
            }
        }
        return ToolResult.success("Executed flow '" + flow.get().getName() + "' with " + steps.size() + " steps. "
                + String.join("; ", results));
    }

    private OutboundPayload toPayload(FlowStep step, String content) {
        if (step.getType() == null) {
            return null;
        }
        return switch (step.getType()) {
        case TEXT -> content.isEmpty() ? null : OutboundPayload.text(content);
        case IMAGE -> step.getMediaUrl() == null ? null
                : OutboundPayload.image(step.getMediaUrl(), content.isEmpty() ? null : content);
        case AUDIO -> step.getMediaUrl() == null ? null : OutboundPayload.audio(step.getMediaUrl(), false);
        case PTT -> step.getMediaUrl() == null ? null : OutboundPayload.audio(step.getMediaUrl(), true);
        };
    }

    private String describe(FlowStep step, String content) {
        return switch (step.getType()) {
        case TEXT -> "Sent text: " + content.substring(0, Math.min(SUMMARY_LENGTH, content.length()));
        case IMAGE -> "Sent image";
        case AUDIO -> "Sent audio";
        case PTT -> "Sent ptt";
        };
    }

    static String interpolate(String template, Map<String, Object> args) {
        String content = template != null ? template : "";
        for (Map.Entry<String, Object> entry : args.entrySet()) {
            content = content.replace("{{" + entry.getKey() + "}}", String.valueOf(entry.getValue()));
        }
        return content;
    }

    private void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during flow step delay", e);
        }
    }

    // ==================== WEBHOOK ====================

    private ToolResult runWebhook(AgentContext context, BotTool tool, Map<String, Object> args) {
        String url = tool.configString("url");
        if (url == null || url.isBlank()) {
            return ToolResult.failure("No webhook URL configured.");
        }
        String method = Optional.ofNullable(tool.configString("method")).orElse("POST").toUpperCase(Locale.ROOT);

        Map<String, String> headers = new LinkedHashMap<>();
        Object configured = tool.getActionConfig().get("headers");
        if (configured instanceof Map<?, ?> map) {
            map.forEach((k, v) -> headers.put(String.valueOf(k), String.valueOf(v)));
        }

        Map<String, Object> body = new LinkedHashMap<>(args);
        body.put("sessionId", context.getSessionId());
        body.put("identifier", context.getSession() != null ? context.getSession().getIdentifier() : null);

        WebhookPort.WebhookResponse response = webhookPort.call(url, method, headers, body);
        String rendered = stringify(response.body());
        if (response.isSuccessful()) {
            return ToolResult.success(rendered, response.body());
        }
        return ToolResult.builder()
                .success(false)
                .data(response.body())
                .error("Webhook returned HTTP " + response.status() + ": " + rendered)
                .build();
    }

    private String render(ToolResult result) {
        if (result.isSuccess()) {
            if (result.getOutput() != null) {
                return result.getOutput();
            }
            return stringify(result.getData());
        }
        return "Error: " + result.getError();
    }

    private String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
