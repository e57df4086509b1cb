package me.golemcore.botmesh.adapter.outbound.storage;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.model.BotTool;
import me.golemcore.botmesh.domain.model.ChatSession;
import me.golemcore.botmesh.domain.model.ConversationLogEntry;
import me.golemcore.botmesh.domain.model.Flow;
import me.golemcore.botmesh.domain.model.Message;
import me.golemcore.botmesh.port.outbound.BotPort;
import me.golemcore.botmesh.port.outbound.ConversationLogPort;
import me.golemcore.botmesh.port.outbound.ConversationPort;
import me.golemcore.botmesh.port.outbound.MessagePort;
import me.golemcore.botmesh.port.outbound.SessionPort;
import me.golemcore.botmesh.port.outbound.ToolPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local record store for bots, sessions, messages, tools, flows and
 * conversation history and audit log. Contents are lost on restart.
 */
@Component
@Slf4j
public class InMemoryRecordStore implements BotPort, SessionPort, MessagePort, ToolPort, ConversationPort,
        ConversationLogPort {

    private final Map<String, Bot> bots = new ConcurrentHashMap<>();
    private final Map<String, ChatSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, Message> messages = new ConcurrentHashMap<>();
    private final Map<String, BotTool> tools = new ConcurrentHashMap<>();
    private final Map<String, Flow> flows = new ConcurrentHashMap<>();
    private final Map<String, List<Message>> conversations = new ConcurrentHashMap<>();
    private final Map<String, List<ConversationLogEntry>> conversationLogs = new ConcurrentHashMap<>();

    // ==================== BOTS ====================

    @Override
    public Optional<Bot> findBot(String botId) {
        return Optional.ofNullable(bots.get(botId));
    }

    @Override
    public List<Bot> findAllBots() {
        List<Bot> all = new ArrayList<>(bots.values());
        all.sort(Comparator.comparing(Bot::getId));
        return all;
    }

    @Override
    public void save(Bot bot) {
        bots.put(bot.getId(), bot);
    }

    // ==================== SESSIONS ====================

    @Override
    public Optional<ChatSession> findSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public Optional<ChatSession> findByBotAndIdentifier(String botId, String identifier) {
        return sessions.values().stream()
                .filter(s -> botId.equals(s.getBotId()) && identifier.equals(s.getIdentifier()))
                .findFirst();
    }

    @Override
    public void save(ChatSession session) {
        sessions.put(session.getId(), session);
    }

    // ==================== MESSAGES ====================

    @Override
    public Optional<Message> findMessage(String messageId) {
        return Optional.ofNullable(messages.get(messageId));
    }

    @Override
    public List<Message> findAllById(List<String> messageIds) {
        List<Message> found = new ArrayList<>(messageIds.size());
        for (String id : messageIds) {
            Message message = messages.get(id);
            if (message != null) {
                found.add(message);
            }
        }
        return found;
    }

    @Override
    public Message save(Message message) {
        if (message.getId() == null) {
            message.setId(UUID.randomUUID().toString());
        }
        messages.put(message.getId(), message);
        return message;
    }

    // ==================== TOOLS ====================

    @Override
    public List<BotTool> findActiveTools(String botId) {
        return tools.values().stream()
                .filter(t -> botId.equals(t.getBotId()) && t.isActive())
                .sorted(Comparator.comparing(BotTool::getName))
                .toList();
    }

    @Override
    public Optional<BotTool> findActiveTool(String botId, String name) {
        return tools.values().stream()
                .filter(t -> botId.equals(t.getBotId()) && t.isActive() && name.equals(t.getName()))
                .findFirst();
    }

    @Override
    public Optional<Flow> findFlow(String flowId) {
        return Optional.ofNullable(flows.get(flowId));
    }

    public void saveTool(BotTool tool) {
        tools.put(tool.getId(), tool);
    }

    public void saveFlow(Flow flow) {
        flows.put(flow.getId(), flow);
    }

    // ==================== CONVERSATIONS ====================

    @Override
    public List<Message> getHistory(String sessionId) {
        return Collections.unmodifiableList(new ArrayList<>(conversations.getOrDefault(sessionId, List.of())));
    }

    @Override
    public void append(String sessionId, Message message) {
        conversations.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(message);
    }

    @Override
    public void appendAll(String sessionId, List<Message> batch) {
        conversations.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).addAll(batch);
    }

    @Override
    public void clear(String sessionId) {
        conversations.remove(sessionId);
        log.debug("[Store] conversation cleared: sessionId={}", sessionId);
    }

    // ==================== AUDIT LOG ====================

    @Override
    public void appendLog(ConversationLogEntry entry) {
        conversationLogs.computeIfAbsent(entry.getSessionId(), k -> new CopyOnWriteArrayList<>()).add(entry);
    }

    @Override
    public List<ConversationLogEntry> findLog(String sessionId) {
        return List.copyOf(conversationLogs.getOrDefault(sessionId, List.of()));
    }
}
