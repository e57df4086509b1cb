package me.golemcore.botmesh.domain.system.toolloop;

import me.golemcore.botmesh.domain.model.AgentContext;

/**
 * Summary of one orchestration turn.
 */
public record ToolLoopTurnResult(
        AgentContext context,
        String finalText,
        int llmCalls,
        int toolExecutions,
        boolean iterationCapReached) {

    public boolean hasFinalText() {
        return finalText != null && !finalText.isBlank();
    }
}
