package me.golemcore.botmesh.domain.system.toolloop;

import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.ToolResult;

/**
 * Outcome of one requested action.
 *
 * @param toolCallId
 *            call id issued by the decision service
 * @param toolName
 *            action name as recorded in history
 * @param toolResult
 *            structured result
 * @param messageContent
 *            text written into the tool message
 * @param synthetic
 *            true when the action never ran (executor crashed or refused)
 */
public record ToolExecutionOutcome(
        String toolCallId,
        String toolName,
        ToolResult toolResult,
        String messageContent,
        boolean synthetic) {

    public static ToolExecutionOutcome of(Message.ToolCall toolCall, ToolResult result, String messageContent) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, messageContent, false);
    }

    public static ToolExecutionOutcome synthetic(Message.ToolCall toolCall, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), ToolResult.failure(reason), reason,
                true);
    }
}
