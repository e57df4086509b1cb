package me.golemcore.botmesh.domain.system.toolloop;

import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.Message;

public interface ToolExecutorPort {

    ToolExecutionOutcome execute(AgentContext context, Message.ToolCall toolCall);
}
