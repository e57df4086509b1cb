package me.golemcore.botmesh.tools;

import lombok.RequiredArgsConstructor;
import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.ToolDefinition;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Detaches a tag from the current chat.
 */
@Component
@RequiredArgsConstructor
public class RemoveChatTagTool implements ToolComponent {

    private final GatewayActionRouter actionRouter;

    @Override
    public ToolDefinition getDefinition() {
        return AddChatTagTool.tagDefinition("remove_chat_tag", "Remove a tag from the current chat.");
    }

    @Override
    public CompletableFuture<ToolResult> execute(AgentContext context, Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> {
            Object tagId = parameters.get("tag_id");
            if (tagId == null || tagId.toString().isBlank()) {
                return ToolResult.failure("Missing required field: tag_id");
            }
            actionRouter.removeTag(context.getBotId(), context.getSession().getIdentifier(), tagId.toString());
            return ToolResult.success("Tag " + tagId + " removed.");
        });
    }
}
