package me.golemcore.botmesh.gateway;

import me.golemcore.botmesh.adapter.outbound.storage.InMemoryRecordStore;
import me.golemcore.botmesh.domain.model.Bot;
import me.golemcore.botmesh.domain.model.ConnectionState;
import me.golemcore.botmesh.domain.model.ConnectionStateChangedEvent;
import me.golemcore.botmesh.domain.model.GatewayKeys;
import me.golemcore.botmesh.domain.service.ConnectionRegistry;
import me.golemcore.botmesh.domain.service.GatewayCommandDispatcher;
import me.golemcore.botmesh.domain.service.GatewayRegistryService;
import me.golemcore.botmesh.domain.service.InboundMessageService;
import me.golemcore.botmesh.domain.service.MessageAccumulator;
import me.golemcore.botmesh.infrastructure.config.AutoConfiguration;
import me.golemcore.botmesh.infrastructure.config.BotProperties;
import me.golemcore.botmesh.port.outbound.MessagingTransportPort;
import me.golemcore.botmesh.testsupport.broker.InMemoryBroker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GatewayRuntimeTest {

    private static final String GATEWAY_ID = "gw-1";

    @Mock
    private MessagingTransportPort transport;

    @Mock
    private MessageAccumulator accumulator;

    @Mock
    private InboundMessageService inboundMessageService;

    @Mock
    private GatewayCommandDispatcher dispatcher;

    private InMemoryBroker broker;
    private InMemoryRecordStore store;
    private BotProperties properties;
    private GatewayRegistryService registry;
    private ConnectionRegistry connections;
    private GatewayRuntime runtime;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        broker = new InMemoryBroker();
        store = new InMemoryRecordStore();
        properties = new BotProperties();
        properties.getGateway().setEnabled(true);
        properties.getGateway().setId(GATEWAY_ID);
        properties.getCommands().setBlockTimeout(Duration.ofMillis(100));
        connections = new ConnectionRegistry();
        registry = new GatewayRegistryService(broker, properties, Clock.systemUTC());
        runtime = new GatewayRuntime(properties, registry, store, transport, accumulator, inboundMessageService,
                broker, AutoConfiguration.objectMapper(), dispatcher, connections);
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
    }

    @Test
    void shouldClaimOnlyUnownedBotsOnFirstRun() {
        store.save(Bot.builder().id("bot-1").build());
        store.save(Bot.builder().id("bot-2").build());
        store.save(Bot.builder().id("bot-3").build());
        registry.assign("bot-3", "gw-other");

        runtime.start();

        assertEquals(Set.of("bot-1", "bot-2"), runtime.getOwnedBots());
        assertEquals(Optional.of("gw-other"), registry.gatewayFor("bot-3"));
        verify(transport).start("bot-1");
        verify(transport).start("bot-2");
        verify(transport, never()).start("bot-3");
    }

    @Test
    void shouldLoadExistingAssignmentsWithoutClaiming() {
        store.save(Bot.builder().id("bot-1").build());
        store.save(Bot.builder().id("bot-2").build());
        registry.assign("bot-2", GATEWAY_ID);

        runtime.start();

        assertEquals(Set.of("bot-2"), runtime.getOwnedBots());
        assertEquals(Optional.empty(), registry.gatewayFor("bot-1"));
    }

    @Test
    void shouldRegisterAndStartConsumer() {
        runtime.start();

        assertTrue(registry.isAlive(GATEWAY_ID));
        assertTrue(broker.hasGroup(GatewayKeys.commands(GATEWAY_ID), GatewayKeys.consumerGroup(GATEWAY_ID)));
        assertEquals(GATEWAY_ID, runtime.getGatewayId());
    }

    @Test
    void shouldKeepGatewayAliveThroughHeartbeats() throws InterruptedException {
        properties.getGateway().setHeartbeatInterval(Duration.ofMillis(50));
        properties.getGateway().setHeartbeatTtl(Duration.ofMillis(200));

        runtime.start();
        Thread.sleep(500);

        assertTrue(registry.isAlive(GATEWAY_ID));
    }

    @Test
    void shouldContinueWhenOneConnectionFailsToStart() {
        store.save(Bot.builder().id("bot-1").build());
        store.save(Bot.builder().id("bot-2").build());
        doThrow(new IllegalStateException("pairing required")).when(transport).start("bot-1");

        runtime.start();

        verify(transport).start("bot-2");
    }

    @Test
    void shouldFlushAndCloseConnectionsOnStop() {
        store.save(Bot.builder().id("bot-1").build());
        runtime.start();

        runtime.stop();

        verify(accumulator).flushAll(any());
        verify(transport).stop("bot-1");
        assertTrue(runtime.getOwnedBots().isEmpty());
    }

    @Test
    void shouldCloseConnectionsOpenedAfterStartupOnStop() {
        store.save(Bot.builder().id("bot-1").build());
        runtime.start();
        connections.onConnectionStateChanged(
                new ConnectionStateChangedEvent("bot-late", ConnectionState.CONNECTED, null, Instant.now()));
        connections.onConnectionStateChanged(
                new ConnectionStateChangedEvent("bot-gone", ConnectionState.DISCONNECTED, 401, Instant.now()));

        runtime.stop();

        verify(transport).stop("bot-1");
        verify(transport).stop("bot-late");
        verify(transport, never()).stop("bot-gone");
    }

    @Test
    void shouldRejectHeartbeatIntervalNotShorterThanTtl() {
        properties.getGateway().setHeartbeatInterval(Duration.ofSeconds(30));

        assertThrows(IllegalStateException.class, () -> runtime.start());
    }

    @Test
    void shouldRequireGatewayId() {
        properties.getGateway().setId(" ");

        assertThrows(IllegalStateException.class, () -> runtime.start());
    }
}
