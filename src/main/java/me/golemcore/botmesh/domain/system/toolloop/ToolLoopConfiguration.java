package me.golemcore.botmesh.domain.system.toolloop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.botmesh.domain.component.ToolComponent;
import me.golemcore.botmesh.domain.service.ConversationAuditService;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.LlmPort;
import me.golemcore.botmesh.port.outbound.ToolPort;
import me.golemcore.botmesh.port.outbound.WebhookPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Wires the tool loop and its collaborators.
 */
@Configuration
public class ToolLoopConfiguration {

    @Bean
    public ToolExecutorPort toolExecutorPort(List<ToolComponent> builtinTools, ToolPort toolPort,
            WebhookPort webhookPort, GatewayActionRouter actionRouter, ObjectMapper objectMapper) {
        return new DefaultToolExecutor(builtinTools, toolPort, webhookPort, actionRouter, objectMapper);
    }

    @Bean
    public HistoryWriter toolLoopHistoryWriter(Clock clock) {
        return new DefaultHistoryWriter(clock);
    }

    @Bean
    public ToolLoopSystem toolLoopSystem(LlmPort llmPort, ToolExecutorPort toolExecutorPort,
            HistoryWriter historyWriter, ConversationAuditService audit, BotProperties botProperties) {
        return new DefaultToolLoopSystem(llmPort, toolExecutorPort, historyWriter, audit,
                botProperties.getToolLoop());
    }
}
