package me.golemcore.botmesh.adapter.outbound.storage;

import me.golemcore.botmesh.domain.model.ActionType;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.model.BotTool;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.domain.model.ToolStatus;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordStoreTest {

    private final InMemoryRecordStore store = new InMemoryRecordStore();

    @Test
    void shouldAssignIdsAndResolveInRequestedOrder() {
        Message first = store.save(Message.builder().content("one").build());
        Message second = store.save(Message.builder().content("two").build());

        assertNotNull(first.getId());
        List<Message> found = store.findAllById(List.of(second.getId(), "missing", first.getId()));

        assertEquals(List.of(second, first), found);
    }

    @Test
    void shouldListBotsSortedById() {
        store.save(Bot.builder().id("bot-b").build());
        store.save(Bot.builder().id("bot-a").build());

        assertEquals(List.of("bot-a", "bot-b"), store.findAllBots().stream().map(Bot::getId).toList());
    }

    @Test
    void shouldFindSessionByBotAndIdentifier() {
        store.save(ChatSession.builder().id("s-1").botId("bot-1").identifier("+1").build());

        assertEquals("s-1", store.findByBotAndIdentifier("bot-1", "+1").map(ChatSession::getId).orElseThrow());
        assertEquals(Optional.empty(), store.findByBotAndIdentifier("bot-2", "+1"));
    }

    @Test
    void shouldOnlyReturnActiveTools() {
        store.saveTool(BotTool.builder().id("t1").botId("bot-1").name("crm").actionType(ActionType.WEBHOOK)
                .build());
        store.saveTool(BotTool.builder().id("t2").botId("bot-1").name("old").actionType(ActionType.FLOW)
                .status(ToolStatus.INACTIVE).build());

        assertEquals(1, store.findActiveTools("bot-1").size());
        assertTrue(store.findActiveTool("bot-1", "old").isEmpty());
    }

    @Test
    void shouldAppendAndClearConversation() {
        store.append("s-1", Message.builder().content("hi").build());
        store.appendAll("s-1", List.of(Message.builder().content("hello").build()));

        assertEquals(2, store.getHistory("s-1").size());

        store.clear("s-1");

        assertTrue(store.getHistory("s-1").isEmpty());
    }
}
