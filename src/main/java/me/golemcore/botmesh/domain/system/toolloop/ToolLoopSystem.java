package me.golemcore.botmesh.domain.system.toolloop;

import me.golemcore.botmesh.domain.model.AgentContext;

public interface ToolLoopSystem {

    /**
     * Runs decide and act iterations for one turn until the decision service
     * requests no actions or the iteration cap is reached.
     *
     * @throws DecisionServiceException
     *             if a decision call fails
     */
    ToolLoopTurnResult processTurn(AgentContext context);
}
