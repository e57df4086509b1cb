package me.golemcore.botmesh.tools;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.port.outbound.SessionPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Turns automatic processing on or off for the current chat. Without the
 * {@code enabled} argument the current setting is toggled.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SetSessionAiTool implements ToolComponent {

    private final SessionPort sessionPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("set_session_ai")
                .description("Enable or disable automatic replies for the current chat. Omit 'enabled' to toggle.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "enabled", Map.of("type", "boolean", "description", "New setting")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters) {
        ChatSession session = context.getSession();
        if (session == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("No active session"));
        }

        Object requested = parameters.get("enabled");
        boolean enabled = requested != null ? Boolean.parseBoolean(requested.toString()) : !session.isAiEnabled();
        session.setAiEnabled(enabled);
        sessionPort.save(session);
        log.info("[Tools] session AI {}: sessionId={}", enabled ? "enabled" : "disabled", session.getId());

        return CompletableFuture.completedFuture(ToolResult.success(
                "AI " + (enabled ? "enabled" : "disabled") + " for this chat.", Map.of("aiEnabled", enabled)));
    }
}
