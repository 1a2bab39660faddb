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

import com.phonepe.memsync.core.errors.CompressionException;
import com.phonepe.memsync.core.model.CompressionLevel;
import com.phonepe.memsync.core.model.MemoryEntry;
import com.phonepe.memsync.core.model.StructuredContent;
import com.phonepe.memsync.core.model.TextContent;
import com.phonepe.memsync.core.storage.InMemoryMemoryStorage;
import com.phonepe.memsync.core.utils.ContentUtils;
import com.phonepe.memsync.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CompressionEngineTest {
    private final CompressionEngine engine = new CompressionEngine();

    @Test
    void noneReturnsEntryAsIs() {
        final var entry = MemoryEntry.of("abc");
        assertSame(entry, engine.compress(entry, CompressionLevel.NONE));
    }

    @Test
    void textSizeNeverGrowsUpTheLadder() {
        final var text = TestUtils.sentences(40) + "\n\n" + TestUtils.sentences(3) + "\n\n" + "tail paragraph";
        final var entry = MemoryEntry.of(text).withUpdatedHash();
        var previous = ContentUtils.canonicalLength(entry.getContent());
        for (final var level : List.of(CompressionLevel.LIGHT,
                                       CompressionLevel.MEDIUM,
                                       CompressionLevel.HIGH,
                                       CompressionLevel.EXTREME)) {
            final var compressed = engine.compress(entry, level);
            final var length = ContentUtils.canonicalLength(compressed.getContent());
            assertTrue(length <= previous, "Level " + level + " grew the content");
            assertEquals(level, compressed.getCompressionLevel());
            previous = length;
        }
    }

    @Test
    void lightKeepsShortTextIntact() {
        final var entry = MemoryEntry.of("short text").withUpdatedHash();
        final var compressed = engine.compress(entry, CompressionLevel.LIGHT);
        assertEquals(entry.getContent(), compressed.getContent());
        assertEquals(CompressionLevel.LIGHT, compressed.getCompressionLevel());
    }

    @Test
    void referenceReplacesTextAndKeepsHash() {
        final var entry = MemoryEntry.of("some text").withUpdatedHash();
        final var hash = entry.getMetadata().getContentHash();
        final var compressed = engine.compress(entry, CompressionLevel.REFERENCE_ONLY);
        assertEquals(ContentTransforms.referenceTo(hash), ((TextContent) compressed.getContent()).getText());
        assertEquals(hash, compressed.getMetadata().getContentHash());
        assertEquals(CompressionLevel.REFERENCE_ONLY, compressed.getCompressionLevel());
    }

    @Test
    void structuredLevels() {
        final var data = new LinkedHashMap<String, Object>();
        for (int i = 0; i < 8; i++) {
            data.put("key" + i, "value number " + i + " with some padding");
        }
        final var entry = TestUtils.structuredEntry(data).withUpdatedHash();

        final var light = (StructuredContent) engine.compress(entry, CompressionLevel.LIGHT).getContent();
        assertEquals(6, light.getData().size());
        assertEquals(true, light.getData().get(ContentTransforms.COMPRESSED_FLAG));

        final var medium = (StructuredContent) engine.compress(entry, CompressionLevel.MEDIUM).getContent();
        assertEquals(4, medium.getData().size());

        final var reference = (StructuredContent) engine.compress(entry, CompressionLevel.REFERENCE_ONLY)
                .getContent();
        assertEquals(List.copyOf(data.keySet()), reference.getData().get(ContentTransforms.KEYS_FIELD));
    }

    @Test
    void neverLowersExistingLevel() {
        final var entry = MemoryEntry.of("text").withCompressionLevel(CompressionLevel.HIGH).withUpdatedHash();
        assertEquals(CompressionLevel.HIGH, engine.compress(entry, CompressionLevel.LIGHT).getCompressionLevel());
    }

    @Test
    void unserializableValueFailsAtTargetLevel() {
        final var data = new LinkedHashMap<String, Object>();
        data.put("broken", new TestUtils.Unserializable());
        data.put("fine", "ok");
        final var entry = TestUtils.structuredEntry(data);
        final var error = assertThrows(CompressionException.class,
                                       () -> engine.compress(entry, CompressionLevel.LIGHT));
        assertEquals(CompressionLevel.LIGHT, error.getLevel());

        final var high = (StructuredContent) engine.compress(entry, CompressionLevel.HIGH).getContent();
        assertEquals(List.of("broken", "fine"), high.getData().get(ContentTransforms.KEYS_FIELD));
    }

    @Test
    void compressUntilSkipsFailingLevels() {
        final var data = new LinkedHashMap<String, Object>();
        data.put("broken", new TestUtils.Unserializable());
        final var entry = TestUtils.structuredEntry(data);
        final var outcome = engine.compressUntil(entry, variant -> true);
        assertTrue(outcome.isSatisfied());
        assertEquals(CompressionLevel.HIGH, outcome.getEntry().getCompressionLevel());
    }

    @Test
    void compressUntilReturnsMostCompressedWhenNothingFits() {
        final var entry = MemoryEntry.of("a".repeat(5000)).withUpdatedHash();
        final var outcome = engine.compressUntil(entry, variant -> false);
        assertFalse(outcome.isSatisfied());
        assertEquals(CompressionLevel.REFERENCE_ONLY, outcome.getEntry().getCompressionLevel());
    }

    @Test
    void compressUntilStopsAtFirstAcceptedLevel() {
        final var entry = MemoryEntry.of("b".repeat(2000)).withUpdatedHash();
        final var outcome = engine.compressUntil(
                entry, variant -> ContentUtils.canonicalLength(variant.getContent()) < 1000);
        assertTrue(outcome.isSatisfied());
        assertEquals(CompressionLevel.LIGHT, outcome.getEntry().getCompressionLevel());
    }

    @Test
    void decompressRestoresReferencedContent() {
        final var storage = new InMemoryMemoryStorage();
        final var original = MemoryEntry.of("the original text");
        storage.save("k1", original);
        final var stored = storage.peek("k1").orElseThrow();
        final var reference = engine.compress(stored, CompressionLevel.REFERENCE_ONLY);

        final var restored = engine.decompress(reference, storage);
        assertEquals(original.getContent(), restored.getContent());
        assertEquals(CompressionLevel.NONE, restored.getCompressionLevel());
    }

    @Test
    void decompressLeavesLossyLevelsAndLostReferences() {
        final var storage = new InMemoryMemoryStorage();
        final var lossy = MemoryEntry.of("x").withCompressionLevel(CompressionLevel.HIGH);
        assertSame(lossy, engine.decompress(lossy, storage));

        final var orphan = engine.compress(MemoryEntry.of("gone").withUpdatedHash(), CompressionLevel.REFERENCE_ONLY);
        assertSame(orphan, engine.decompress(orphan, storage));
    }

    @Test
    void transformForEveryLevelRequired() {
        assertThrows(IllegalArgumentException.class, () -> new CompressionEngine(Map.of()));
    }
}
