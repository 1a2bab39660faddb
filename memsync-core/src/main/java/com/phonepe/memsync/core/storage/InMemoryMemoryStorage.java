/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.memsync.core.storage;

import com.google.common.base.Strings;
import com.phonepe.memsync.core.model.MemoryEntry;
import com.phonepe.memsync.core.model.MemoryMetadata;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.StampedLock;
import java.util.function.UnaryOperator;

/**
 * Reference storage backend holding everything in process memory.
 * Mutations of the primary map and the hash index happen under a single write lock. Access bookkeeping on reads
 * and metadata updates are applied atomically per key and do not need the lock as they never change content.
 */
@Slf4j
public class InMemoryMemoryStorage implements MemoryStorage {

    private final Map<String, MemoryEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, NavigableSet<String>> hashIndex = new HashMap<>();
    private final StampedLock lock = new StampedLock();
    private final Clock clock;

    public InMemoryMemoryStorage() {
        this(Clock.systemUTC());
    }

    public InMemoryMemoryStorage(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @Override
    public boolean save(String key, MemoryEntry entry) {
        final var toStore = entry.withUpdatedHash();
        final var stamp = lock.writeLock();
        try {
            final var previous = entries.put(key, toStore);
            if (previous != null) {
                unindex(previous.getMetadata().getContentHash(), key);
            }
            hashIndex.computeIfAbsent(toStore.getMetadata().getContentHash(), hash -> new TreeSet<>())
                    .add(key);
            return true;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public Optional<MemoryEntry> get(String key) {
        final var now = LocalDateTime.now(clock);
        return Optional.ofNullable(entries.computeIfPresent(
                key, (k, entry) -> entry.withMetadata(entry.getMetadata().recordAccess(now))));
    }

    @Override
    public Optional<MemoryEntry> peek(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public Optional<MemoryEntry> updateMetadata(String key, UnaryOperator<MemoryMetadata> change) {
        return Optional.ofNullable(entries.computeIfPresent(
                key, (k, entry) -> entry.withMetadata(change.apply(entry.getMetadata()))));
    }

    @Override
    public boolean delete(String key) {
        final var stamp = lock.writeLock();
        try {
            final var removed = entries.remove(key);
            if (removed == null) {
                return false;
            }
            unindex(removed.getMetadata().getContentHash(), key);
            return true;
        }
        finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public List<String> listKeys(String prefix) {
        return entries.keySet()
                .stream()
                .filter(key -> Strings.isNullOrEmpty(prefix) || key.startsWith(prefix))
                .sorted()
                .toList();
    }

    @Override
    public Optional<MemoryEntry> getByHash(String contentHash) {
        if (Strings.isNullOrEmpty(contentHash)) {
            return Optional.empty();
        }
        final var stamp = lock.readLock();
        try {
            final var keys = hashIndex.get(contentHash);
            if (keys == null || keys.isEmpty()) {
                return Optional.empty();
            }
            return Optional.ofNullable(entries.get(keys.first()));
        }
        finally {
            lock.unlockRead(stamp);
        }
    }

    private void unindex(String contentHash, String key) {
        final var keys = hashIndex.get(contentHash);
        if (keys == null) {
            return;
        }
        keys.remove(key);
        if (keys.isEmpty()) {
            hashIndex.remove(contentHash);
        }
    }
}
