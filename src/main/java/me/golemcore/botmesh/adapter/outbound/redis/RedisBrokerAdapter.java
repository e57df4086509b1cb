package me.golemcore.botmesh.adapter.outbound.redis;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.botmesh.domain.model.BrokerStreamEntry;
import me.golemcore.botmesh.domain.service.BrokerException;
import me.golemcore.botmesh.port.outbound.BrokerPort;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.RecordId;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * {@link BrokerPort} on Redis through Spring Data Redis (Lettuce).
 *
 * <p>
 * Multi-step list operations run as Lua scripts so each is a single atomic
 * broker call. Blocking pops are issued with whole-second timeouts rounded
 * up, so the broker never gives up before the requested wait. The Redis
 * command timeout ({@code spring.data.redis.timeout}) must exceed the longest
 * reply wait and stream block.
 */
@Component
@Slf4j
public class RedisBrokerAdapter implements BrokerPort {

    static final RedisScript<Long> PUSH_WITH_TTL = new DefaultRedisScript<>(
            "redis.call('RPUSH', KEYS[1], ARGV[1]) "
                    + "redis.call('PEXPIRE', KEYS[1], ARGV[2]) "
                    + "return 1",
            Long.class);

    @SuppressWarnings("rawtypes") // Lua multi-bulk replies are read as java.util.List
    static final RedisScript<List> DRAIN_LIST = RedisScript.of(
            "local items = redis.call('LRANGE', KEYS[1], 0, -1) "
                    + "redis.call('DEL', KEYS[1]) "
                    + "return items",
            List.class);

    private static final long MILLIS_PER_SECOND = 1000L;

    private static final int SCAN_BATCH = 100;

    private final StringRedisTemplate redis;

    public RedisBrokerAdapter(StringRedisTemplate redis) {
        this.redis = redis;
    }

    // ==================== KEYS ====================

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        call("SET", () -> {
            redis.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(call("SET NX", () -> redis.opsForValue().setIfAbsent(key, value, ttl)));
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(call("GET", () -> redis.opsForValue().get(key)));
    }

    @Override
    public boolean exists(String key) {
        return Boolean.TRUE.equals(call("EXISTS", () -> redis.hasKey(key)));
    }

    @Override
    public boolean delete(String key) {
        return Boolean.TRUE.equals(call("DEL", () -> redis.delete(key)));
    }

    @Override
    public Set<String> scanKeys(String pattern) {
        return call("SCAN", () -> {
            Set<String> keys = new LinkedHashSet<>();
            ScanOptions options = ScanOptions.scanOptions().match(pattern).count(SCAN_BATCH).build();
            try (Cursor<String> cursor = redis.scan(options)) {
                cursor.forEachRemaining(keys::add);
            }
            return keys;
        });
    }

    // ==================== SETS ====================

    @Override
    public void addToSet(String key, String member) {
        call("SADD", () -> redis.opsForSet().add(key, member));
    }

    @Override
    public void removeFromSet(String key, String member) {
        call("SREM", () -> redis.opsForSet().remove(key, member));
    }

    @Override
    public Set<String> members(String key) {
        Set<String> members = call("SMEMBERS", () -> redis.opsForSet().members(key));
        return members != null ? members : Set.of();
    }

    @Override
    public long setSize(String key) {
        Long size = call("SCARD", () -> redis.opsForSet().size(key));
        return size != null ? size : 0L;
    }

    // ==================== HASHES ====================

    @Override
    public void hashPut(String key, String field, String value) {
        call("HSET", () -> {
            hash().put(key, field, value);
            return null;
        });
    }

    @Override
    public Optional<String> hashGet(String key, String field) {
        return Optional.ofNullable(call("HGET", () -> hash().get(key, field)));
    }

    @Override
    public void hashDelete(String key, String field) {
        call("HDEL", () -> hash().delete(key, field));
    }

    private HashOperations<String, String, String> hash() {
        return redis.opsForHash();
    }

    // ==================== LISTS ====================

    @Override
    public void pushWithTtl(String key, String value, Duration ttl) {
        call("RPUSH", () -> redis.execute(PUSH_WITH_TTL, List.of(key), value, String.valueOf(ttl.toMillis())));
    }

    @Override
    public Optional<String> blockingPop(String key, Duration timeout) {
        long seconds = blockSeconds(timeout);
        return Optional.ofNullable(call("BLPOP", () -> redis.opsForList().leftPop(key, seconds, TimeUnit.SECONDS)));
    }

    /**
     * Whole seconds for BLPOP, rounded up. Zero would block forever, so only
     * positive waits are accepted.
     */
    static long blockSeconds(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Blocking pop needs a positive timeout, got " + timeout);
        }
        long millis = timeout.toMillis();
        return Math.max(1L, (millis + MILLIS_PER_SECOND - 1) / MILLIS_PER_SECOND);
    }

    @Override
    public List<String> drainList(String key) {
        List<?> items = call("DRAIN", () -> redis.execute(DRAIN_LIST, List.of(key)));
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        List<String> ids = new ArrayList<>(items.size());
        for (Object item : items) {
            ids.add(String.valueOf(item));
        }
        return ids;
    }

    // ==================== STREAMS ====================

    @Override
    public String streamAppend(String streamKey, Map<String, String> fields, long maxLength) {
        MapRecord<String, String, String> record = MapRecord.create(streamKey, fields);
        RecordId id = call("XADD", () -> redis.opsForStream().add(record));
        if (id == null) {
            throw new BrokerException("XADD returned no id for stream " + streamKey);
        }
        call("XTRIM", () -> redis.opsForStream().trim(streamKey, maxLength, true));
        return id.getValue();
    }

    @Override
    public void createGroup(String streamKey, String group) {
        byte[] rawKey = streamKey.getBytes(StandardCharsets.UTF_8);
        try {
            redis.execute((RedisCallback<String>) connection -> connection.streamCommands()
                    .xGroupCreate(rawKey, group, ReadOffset.latest(), true));
            log.info("[Redis] consumer group created: stream={}, group={}", streamKey, group);
        } catch (DataAccessException e) {
            if (isBusyGroup(e)) {
                log.debug("[Redis] consumer group exists: stream={}, group={}", streamKey, group);
                return;
            }
            throw new BrokerException("XGROUP CREATE failed for " + streamKey, e);
        }
    }

    @Override
    public List<BrokerStreamEntry> readGroup(String streamKey, String group, String consumer, int count,
            Duration block) {
        List<MapRecord<String, Object, Object>> records = call("XREADGROUP", () -> redis.opsForStream().read(
                Consumer.from(group, consumer),
                StreamReadOptions.empty().count(count).block(block),
                StreamOffset.create(streamKey, ReadOffset.lastConsumed())));
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<BrokerStreamEntry> entries = new ArrayList<>(records.size());
        for (MapRecord<String, Object, Object> record : records) {
            Map<String, String> fields = new LinkedHashMap<>();
            record.getValue().forEach((k, v) -> fields.put(String.valueOf(k), String.valueOf(v)));
            entries.add(new BrokerStreamEntry(record.getId().getValue(), fields));
        }
        return entries;
    }

    @Override
    public void acknowledge(String streamKey, String group, String entryId) {
        call("XACK", () -> redis.opsForStream().acknowledge(streamKey, group, entryId));
    }

    private <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new BrokerException("Redis " + operation + " failed: " + e.getMessage(), e);
        }
    }

    static boolean isBusyGroup(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null && t.getMessage().contains("BUSYGROUP")) {
                return true;
            }
        }
        return false;
    }
}
