package me.golemcore.botmesh.tools;

import lombok.RequiredArgsConstructor;
import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.port.outbound.ConversationPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Clears the conversation history of the current session.
 */
@Component
@RequiredArgsConstructor
public class ClearConversationTool implements ToolComponent {

    private final ConversationPort conversationPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.simple("clear_conversation", "Clear the conversation history of the current chat.");
    }

    @Override
    public CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters) {
        String sessionId = context.getSessionId();
        if (sessionId == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("No active session"));
        }
        conversationPort.clear(sessionId);
        return CompletableFuture.completedFuture(ToolResult.success("Conversation history cleared."));
    }
}
