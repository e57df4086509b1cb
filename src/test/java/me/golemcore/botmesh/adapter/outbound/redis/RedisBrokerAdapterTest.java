package me.golemcore.botmesh.adapter.outbound.redis;

import me.golemcore.botmesh.domain.model.BrokerStreamEntry;
import me.golemcore.botmesh.domain.service.BrokerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisSystemException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class RedisBrokerAdapterTest {

    private static final String KEY = "session:lock:s-1";

    private StringRedisTemplate redis;
    private ValueOperations<String, String> valueOps;
    private ListOperations<String, String> listOps;
    private HashOperations<String, Object, Object> hashOps;
    private StreamOperations<String, Object, Object> streamOps;
    private RedisBrokerAdapter adapter;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redis = mock(StringRedisTemplate.class);
        valueOps = mock(ValueOperations.class);
        listOps = mock(ListOperations.class);
        hashOps = mock(HashOperations.class);
        streamOps = mock(StreamOperations.class);
        when(redis.opsForValue()).thenReturn(valueOps);
        when(redis.opsForList()).thenReturn(listOps);
        doReturn(hashOps).when(redis).opsForHash();
        doReturn(streamOps).when(redis).opsForStream();
        adapter = new RedisBrokerAdapter(redis);
    }

    @Test
    void shouldSetIfAbsentWithExpiry() {
        when(valueOps.setIfAbsent(KEY, "token", Duration.ofSeconds(60))).thenReturn(true);

        assertTrue(adapter.setIfAbsent(KEY, "token", Duration.ofSeconds(60)));
        assertFalse(adapter.setIfAbsent("other", "token", Duration.ofSeconds(60)));
    }

    @Test
    void shouldWrapRedisFailures() {
        when(valueOps.get(KEY)).thenThrow(new QueryTimeoutException("Command timed out"));

        BrokerException error = assertThrows(BrokerException.class, () -> adapter.get(KEY));

        assertTrue(error.getMessage().startsWith("Redis GET failed"));
        assertInstanceOf(QueryTimeoutException.class, error.getCause());
    }

    @Test
    void shouldReturnEmptyForMissingHashField() {
        when(hashOps.get("gateway:assignments", "bot-1")).thenReturn(null);

        assertEquals(Optional.empty(), adapter.hashGet("gateway:assignments", "bot-1"));
    }

    @Test
    void shouldPushWithExpiryInOneScript() {
        adapter.pushWithTtl("accumulator:s-1", "m-1", Duration.ofMinutes(10));

        verify(redis).execute(eq(RedisBrokerAdapter.PUSH_WITH_TTL), eq(List.of("accumulator:s-1")), eq("m-1"),
                eq("600000"));
    }

    @Test
    void shouldDrainListAtomically() {
        when(redis.execute(eq(RedisBrokerAdapter.DRAIN_LIST), eq(List.of("accumulator:s-1"))))
                .thenReturn(List.of("m-1", "m-2"));

        List<String> drained = adapter.drainList("accumulator:s-1");

        assertEquals(List.of("m-1", "m-2"), drained);
        assertEquals(List.of(), adapter.drainList("accumulator:s-2"));
    }

    @Test
    void shouldBlockOnLeftPop() {
        when(listOps.leftPop("cmd:reply:1", 15, TimeUnit.SECONDS)).thenReturn("{\"success\":true}");

        assertEquals(Optional.of("{\"success\":true}"), adapter.blockingPop("cmd:reply:1", Duration.ofSeconds(15)));
    }

    @Test
    void shouldRoundBlockingPopUpToWholeSeconds() {
        adapter.blockingPop("cmd:reply:2", Duration.ofMillis(1999));
        adapter.blockingPop("cmd:reply:3", Duration.ofMillis(200));

        verify(listOps).leftPop("cmd:reply:2", 2, TimeUnit.SECONDS);
        verify(listOps).leftPop("cmd:reply:3", 1, TimeUnit.SECONDS);
        assertEquals(3, RedisBrokerAdapter.blockSeconds(Duration.ofMillis(2001)));
        assertEquals(2, RedisBrokerAdapter.blockSeconds(Duration.ofSeconds(2)));
    }

    @Test
    void shouldRejectUnboundedBlockingPop() {
        assertThrows(IllegalArgumentException.class, () -> adapter.blockingPop("cmd:reply:4", Duration.ZERO));
        assertThrows(IllegalArgumentException.class,
                () -> adapter.blockingPop("cmd:reply:4", Duration.ofMillis(-5)));
        verifyNoInteractions(listOps);
    }

    @Test
    void shouldFailBlockingPopOnCommandTimeout() {
        when(listOps.leftPop("cmd:reply:5", 15, TimeUnit.SECONDS))
                .thenThrow(new QueryTimeoutException("Redis command timed out"));

        assertThrows(BrokerException.class, () -> adapter.blockingPop("cmd:reply:5", Duration.ofSeconds(15)));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldAppendAndTrimApproximately() {
        when(streamOps.add(any(MapRecord.class))).thenReturn(RecordId.of("1700000000000-0"));

        String id = adapter.streamAppend("gateway:gw-1:commands", Map.of("command", "{}"), 1000);

        assertEquals("1700000000000-0", id);
        verify(streamOps).trim("gateway:gw-1:commands", 1000, true);
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldIgnoreExistingConsumerGroup() {
        when(redis.execute(any(RedisCallback.class))).thenThrow(new RedisSystemException(
                "Error in execution", new IllegalStateException("BUSYGROUP Consumer Group name already exists")));

        assertDoesNotThrow(() -> adapter.createGroup("gateway:gw-1:commands", "cmd_handler_gw-1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldFailOnOtherGroupErrors() {
        when(redis.execute(any(RedisCallback.class))).thenThrow(new RedisSystemException(
                "Error in execution", new IllegalStateException("WRONGTYPE Operation against a key")));

        assertThrows(BrokerException.class, () -> adapter.createGroup("gateway:gw-1:commands", "cmd_handler_gw-1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldMapGroupReadRecords() {
        Map<Object, Object> fields = Map.of("command", "{\"id\":\"c-1\"}");
        MapRecord<String, Object, Object> record = MapRecord.create("gateway:gw-1:commands", fields)
                .withId(RecordId.of("1-0"));
        when(streamOps.read(any(Consumer.class), any(StreamReadOptions.class), any(StreamOffset.class)))
                .thenReturn(List.of(record));

        List<BrokerStreamEntry> entries = adapter.readGroup("gateway:gw-1:commands", "cmd_handler_gw-1",
                "handler_1", 10, Duration.ofSeconds(5));

        assertEquals(List.of(new BrokerStreamEntry("1-0", Map.of("command", "{\"id\":\"c-1\"}"))), entries);
    }

    @Test
    void shouldDetectBusyGroupInCauseChain() {
        assertTrue(RedisBrokerAdapter.isBusyGroup(
                new RuntimeException("wrapper", new RuntimeException("BUSYGROUP Consumer Group name already exists"))));
        assertFalse(RedisBrokerAdapter.isBusyGroup(new RuntimeException("NOGROUP")));
    }
}
