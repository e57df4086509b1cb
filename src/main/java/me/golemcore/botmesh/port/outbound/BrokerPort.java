package me.golemcore.botmesh.port.outbound;

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

import me.golemcore.botmesh.domain.model.BrokerStreamEntry;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Port for the shared broker keyspace. Every method maps to a single atomic
 * broker operation; no broker-side transaction is held open across calls.
 *
 * <p>
 * Implementations wrap broker failures in
 * {@link me.golemcore.botmesh.domain.service.BrokerException}.
 */
public interface BrokerPort {

    // ==================== KEYS ====================

    /**
     * Sets a value with an expiry, overwriting any previous value.
     */
    void setWithTtl(String key, String value, Duration ttl);

    /**
     * Sets a value with an expiry only if the key is absent.
     *
     * @return true if the key was set
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    Optional<String> get(String key);

    boolean exists(String key);

    /**
     * @return true if a key was removed
     */
    boolean delete(String key);

    /**
     * Iterates keys matching a glob pattern without blocking the broker.
     */
    Set<String> scanKeys(String pattern);

    // ==================== SETS ====================

    void addToSet(String key, String member);

    void removeFromSet(String key, String member);

    Set<String> members(String key);

    long setSize(String key);

    // ==================== HASHES ====================

    void hashPut(String key, String field, String value);

    Optional<String> hashGet(String key, String field);

    void hashDelete(String key, String field);

    // ==================== LISTS ====================

    /**
     * Appends to the tail of a list and refreshes the list expiry.
     */
    void pushWithTtl(String key, String value, Duration ttl);

    /**
     * Blocks up to {@code timeout} for the head element of a list.
     */
    Optional<String> blockingPop(String key, Duration timeout);

    /**
     * Reads the whole list and deletes the key as one atomic step. Appends that
     * happen after the drain start a new list.
     */
    List<String> drainList(String key);

    // ==================== STREAMS ====================

    /**
     * Appends an entry, trimming the stream approximately to {@code maxLength}.
     *
     * @return broker-assigned entry id
     */
    String streamAppend(String streamKey, Map<String, String> fields, long maxLength);

    /**
     * Creates a consumer group reading new entries, creating the stream if
     * needed. An existing group is not an error.
     */
    void createGroup(String streamKey, String group);

    /**
     * Reads up to {@code count} entries never delivered to this group, blocking
     * up to {@code block} when none are available.
     */
    List<BrokerStreamEntry> readGroup(String streamKey, String group, String consumer, int count, Duration block);

    /**
     * Removes an entry from the group's pending list.
     */
    void acknowledge(String streamKey, String group, String entryId);
}
