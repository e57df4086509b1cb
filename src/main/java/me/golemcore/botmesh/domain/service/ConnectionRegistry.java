package me.golemcore.botmesh.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.ConnectionState;
import me.golemcore.botmesh.domain.model.ConnectionStateChangedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local table of the connection state of each bot this gateway owns,
 * fed by {@link ConnectionStateChangedEvent}s from the transport.
 */
@Component
@Slf4j
public class ConnectionRegistry {

    private final Map<String, ConnectionStateChangedEvent> states = new ConcurrentHashMap<>();

    @EventListener
    public void onConnectionStateChanged(ConnectionStateChangedEvent event) {
        ConnectionStateChangedEvent previous = states.put(event.botId(), event);
        log.info("[Connections] botId={}, state={} -> {}, statusCode={}", event.botId(),
                previous != null ? previous.state() : "none", event.state(), event.statusCode());
    }

    public Optional<ConnectionState> stateOf(String botId) {
        return Optional.ofNullable(states.get(botId)).map(ConnectionStateChangedEvent::state);
    }

    public void remove(String botId) {
        states.remove(botId);
    }

    public Map<String, ConnectionState> snapshot() {
        Map<String, ConnectionState> copy = new ConcurrentHashMap<>();
        states.forEach((botId, event) -> copy.put(botId, event.state()));
        return copy;
    }

    /**
     * Bots whose latest reported state is anything but disconnected,
     * including connections opened after startup by a command.
     */
    public Set<String> openBots() {
        return states.values().stream()
                .filter(event -> event.state() != ConnectionState.DISCONNECTED)
                .map(ConnectionStateChangedEvent::botId)
                .collect(Collectors.toSet());
    }

    public long countIn(ConnectionState state) {
        return states.values().stream().filter(event -> event.state() == state).count();
    }
}
