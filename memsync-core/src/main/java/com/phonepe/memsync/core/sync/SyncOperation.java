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

package com.phonepe.memsync.core.sync;

import com.phonepe.memsync.core.model.MemoryEntry;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Set;

/**
 * A change to a key along with the consumers it still has to be delivered to.
 * Operations stay queued until every target acknowledges delivery or a newer operation on the same key supersedes
 * them.
 */
@Value
@Builder(toBuilder = true)
@With
public class SyncOperation {
    @NonNull
    String operationId;

    /**
     * Position in the order in which operations were recorded. Later operations on a key supersede earlier ones.
     */
    long sequence;

    @NonNull
    SyncOperationType type;

    @NonNull
    String key;

    /**
     * Entry as it was when the operation was recorded. Absent for reads of missing keys.
     */
    MemoryEntry entry;

    @NonNull
    String origin;

    Set<String> pendingTargets;

    LocalDateTime recordedAt;

    int attempts;

    public Set<String> getPendingTargets() {
        return Objects.requireNonNullElseGet(pendingTargets, Set::of);
    }

    public long version() {
        return entry == null ? 0 : entry.getMetadata().getVersion();
    }
}
