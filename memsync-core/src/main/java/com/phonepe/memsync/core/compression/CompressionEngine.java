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

package com.phonepe.memsync.core.compression;

import com.google.common.base.Preconditions;
import com.phonepe.memsync.core.errors.CompressionException;
import com.phonepe.memsync.core.errors.ContentSerializationException;
import com.phonepe.memsync.core.model.CompressionLevel;
import com.phonepe.memsync.core.model.MemoryContent;
import com.phonepe.memsync.core.model.MemoryEntry;
import com.phonepe.memsync.core.storage.MemoryStorage;
import com.phonepe.memsync.core.utils.ContentUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Deterministic, side effect free compression of memory entries along the {@link CompressionLevel} ladder.
 * <p>
 * The rendition for a level is the smaller of that level's own transform of the content and the rendition for the
 * level below it, so output size never grows when climbing the ladder. Transforms marked mandatory (text
 * references) are exempt. Compressed variants keep the metadata, and hence the content hash, of the source entry.
 */
@Slf4j
public class CompressionEngine {
    private final Map<CompressionLevel, ContentTransform> transforms;

    public CompressionEngine() {
        this(ContentTransforms.defaults());
    }

    public CompressionEngine(Map<CompressionLevel, ContentTransform> transforms) {
        Preconditions.checkArgument(transforms.keySet().containsAll(CompressionLevel.ladder()),
                                    "A transform is needed for every compression level");
        this.transforms = new EnumMap<>(transforms);
    }

    /**
     * Compress an entry to the given level.
     *
     * @throws CompressionException if the transform for the requested level cannot be applied to the content
     */
    public MemoryEntry compress(final MemoryEntry entry, final CompressionLevel level) {
        if (level == CompressionLevel.NONE) {
            return entry;
        }
        final var input = entry.getContent();
        final var metadata = entry.getMetadata();
        var best = input;
        var bestLength = lengthOf(input);
        for (final var current : CompressionLevel.ladder()) {
            if (!level.isAtLeast(current)) {
                break;
            }
            final var transform = transforms.get(current);
            try {
                final var candidate = transform.apply(input, metadata);
                final var candidateLength = ContentUtils.canonicalLength(candidate);
                if (transform.isMandatory(input) || candidateLength < bestLength) {
                    best = candidate;
                    bestLength = candidateLength;
                }
            }
            catch (ContentSerializationException e) {
                if (current == level) {
                    throw new CompressionException(level, e);
                }
                log.debug("Skipping level {} while compressing to {}: {}", current, level, e.getMessage());
            }
        }
        final var resultingLevel = entry.getCompressionLevel().isAtLeast(level)
                                   ? entry.getCompressionLevel()
                                   : level;
        return entry.withContent(best)
                .withCompressionLevel(resultingLevel);
    }

    /**
     * Climb the ladder from {@link CompressionLevel#LIGHT} and return the first variant accepted by the predicate.
     * Levels that fail to apply are skipped. If no level is accepted, the most compressed variant that could be
     * produced is returned, which is the entry itself when every level failed.
     */
    public CompressionOutcome compressUntil(final MemoryEntry entry, final Predicate<MemoryEntry> accept) {
        var lastValid = entry;
        for (final var level : CompressionLevel.ladder()) {
            try {
                final var variant = compress(entry, level);
                if (accept.test(variant)) {
                    return new CompressionOutcome(variant, true);
                }
                lastValid = variant;
            }
            catch (CompressionException | ContentSerializationException e) {
                log.warn("Compression to level {} failed, trying next level. Error: {}", level, e.getMessage());
            }
        }
        if (lastValid == entry) {
            log.error("No compression level could be applied to entry with hash {}",
                      entry.getMetadata().getContentHash());
        }
        return new CompressionOutcome(lastValid, false);
    }

    /**
     * Restore a {@link CompressionLevel#REFERENCE_ONLY} entry from the original content found through the storage
     * hash index. The current metadata of the entry is retained. Other levels are lossy and are returned unchanged,
     * as is a reference whose original can no longer be found.
     */
    public MemoryEntry decompress(final MemoryEntry entry, final MemoryStorage storage) {
        if (entry.getCompressionLevel() != CompressionLevel.REFERENCE_ONLY) {
            log.debug("Compression level {} is not reversible", entry.getCompressionLevel());
            return entry;
        }
        final var contentHash = entry.getMetadata().getContentHash();
        return storage.getByHash(contentHash)
                .map(original -> entry.withContent(original.getContent())
                        .withCompressionLevel(CompressionLevel.NONE))
                .orElseGet(() -> {
                    log.warn("Original content for hash {} is no longer available", contentHash);
                    return entry;
                });
    }

    private static int lengthOf(MemoryContent content) {
        try {
            return ContentUtils.canonicalLength(content);
        }
        catch (ContentSerializationException e) {
            return Integer.MAX_VALUE;
        }
    }
}
