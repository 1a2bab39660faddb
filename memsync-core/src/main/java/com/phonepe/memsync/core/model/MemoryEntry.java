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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.phonepe.memsync.core.utils.ContentUtils;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * A unit of memory shared between consumers, along with its metadata.
 * Instances are immutable; every change produces a copy.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@With
public class MemoryEntry {
    public static final long DEFAULT_TTL_SECONDS = Duration.ofDays(1).toSeconds();

    @Builder.Default
    MemoryType memoryType = MemoryType.SHARED;

    @Builder.Default
    MemoryScope scope = MemoryScope.SESSION;

    /**
     * Higher values are retained preferentially when budgets are tight
     */
    int priority;

    @Builder.Default
    CompressionLevel compressionLevel = CompressionLevel.NONE;

    /**
     * Relative expiry measured from {@link MemoryMetadata#getLastModified()}. Zero or negative never expires.
     */
    @Builder.Default
    long ttlSeconds = DEFAULT_TTL_SECONDS;

    @NonNull
    MemoryContent content;

    @Builder.Default
    MemoryMetadata metadata = MemoryMetadata.empty();

    @Builder.Default
    StorageTier storageTier = StorageTier.HOT;

    public static MemoryEntry of(final String text) {
        return MemoryEntry.builder()
                .content(MemoryContent.text(text))
                .build();
    }

    public MemoryMetadata getMetadata() {
        return Objects.requireNonNullElseGet(metadata, MemoryMetadata::empty);
    }

    /**
     * An entry that has never been persisted has no modification time and cannot be expired.
     */
    public boolean isExpired(final LocalDateTime now) {
        final var lastModified = getMetadata().getLastModified();
        if (ttlSeconds <= 0 || lastModified == null) {
            return false;
        }
        return Duration.between(lastModified, now).toMillis() > ttlSeconds * 1000;
    }

    /**
     * @return A copy whose content hash matches the current content
     */
    public MemoryEntry withUpdatedHash() {
        return withMetadata(getMetadata().withContentHash(ContentUtils.contentHash(content)));
    }

    /**
     * Shared entries are visible to every consumer, tool specific ones only to the consumer that wrote them
     */
    public boolean isVisibleTo(final String consumer) {
        return memoryType == MemoryType.SHARED || Objects.equals(consumer, getMetadata().getSourceTool());
    }

    @JsonIgnore
    public boolean isCompressed() {
        return compressionLevel != CompressionLevel.NONE;
    }
}
