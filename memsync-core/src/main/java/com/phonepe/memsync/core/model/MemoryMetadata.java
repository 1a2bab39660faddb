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

package com.phonepe.memsync.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bookkeeping information attached to every memory entry
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class MemoryMetadata {
    /**
     * Consumer that created the entry or last won a write to it
     */
    String sourceTool;

    /**
     * Used for expiry and conflict resolution. A null value on an incoming write means "stamp it for me".
     */
    LocalDateTime lastModified;

    int accessCount;

    LocalDateTime lastAccessed;

    /**
     * Secondary sort key during budget optimization
     */
    @Builder.Default
    double contextRelevance = 1.0;

    @Builder.Default
    long version = 1;

    /**
     * Consumer to the last version delivered to it
     */
    @Builder.Default
    Map<String, Long> syncStatus = Map.of();

    /**
     * SHA-256 of the canonical serialization of the entry content at the time it was persisted
     */
    String contentHash;

    public static MemoryMetadata empty() {
        return MemoryMetadata.builder().build();
    }

    public Map<String, Long> getSyncStatus() {
        return Objects.requireNonNullElseGet(syncStatus, Map::of);
    }

    public MemoryMetadata recordAccess(final LocalDateTime now) {
        return toBuilder()
                .accessCount(accessCount + 1)
                .lastAccessed(now)
                .build();
    }

    public MemoryMetadata withSynced(final String consumer, final long syncedVersion) {
        final var status = new HashMap<>(getSyncStatus());
        status.put(consumer, syncedVersion);
        return withSyncStatus(Map.copyOf(status));
    }
}
