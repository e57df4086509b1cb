package me.golemcore.botmesh.domain.system.toolloop;

import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.LlmResponse;
import me.golemcore.botmesh.domain.model.Message;

import java.util.List;

public interface HistoryWriter {

    void appendAssistantToolCalls(AgentContext context, LlmResponse llmResponse, List<Message.ToolCall> toolCalls);

    void appendToolResult(AgentContext context, ToolExecutionOutcome outcome);

    void appendFinalAssistantAnswer(AgentContext context, LlmResponse llmResponse, String finalText);
}
