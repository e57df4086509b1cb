package me.golemcore.botmesh.tools;

import me.golemcore.botmesh.domain.model.AgentContext;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.ToolResult;
import me.golemcore.botmesh.domain.service.GatewayActionRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ChatTagToolsTest {

    private static final String BOT_ID = "bot-1";
    private static final String CHAT_ID = "5511999@c.us";

    @Mock
    private GatewayActionRouter actionRouter;

    private AgentContext context;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        context = AgentContext.builder()
                .bot(Bot.builder().id(BOT_ID).build())
                .session(ChatSession.builder().id("session-1").botId(BOT_ID).identifier(CHAT_ID).build())
                .build();
    }

    @Test
    void shouldAddTagToCurrentChat() {
        ToolResult result = new AddChatTagTool(actionRouter).execute(context, Map.of("tag_id", "vip")).join();

        assertTrue(result.isSuccess());
        verify(actionRouter).addTag(BOT_ID, CHAT_ID, "vip");
    }

    @Test
    void shouldRemoveTagFromCurrentChat() {
        ToolResult result = new RemoveChatTagTool(actionRouter).execute(context, Map.of("tag_id", "vip")).join();

        assertTrue(result.isSuccess());
        verify(actionRouter).removeTag(BOT_ID, CHAT_ID, "vip");
    }

    @Test
    void shouldRequireTagId() {
        ToolResult result = new AddChatTagTool(actionRouter).execute(context, Map.of()).join();

        assertFalse(result.isSuccess());
        verifyNoInteractions(actionRouter);
    }

    @Test
    void shouldShareTagSchema() {
        assertEquals("remove_chat_tag", new RemoveChatTagTool(actionRouter).getToolName());
        assertEquals(new AddChatTagTool(actionRouter).getDefinition().getInputSchema(),
                new RemoveChatTagTool(actionRouter).getDefinition().getInputSchema());
    }
}
