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

import com.phonepe.memsync.core.utils.JsonUtils;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryEntryTest {
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 1, 1, 10, 0);

    @Test
    void defaultsApplied() {
        final var entry = MemoryEntry.of("hello");
        assertAll(
                () -> assertEquals(MemoryType.SHARED, entry.getMemoryType()),
                () -> assertEquals(MemoryScope.SESSION, entry.getScope()),
                () -> assertEquals(0, entry.getPriority()),
                () -> assertEquals(CompressionLevel.NONE, entry.getCompressionLevel()),
                () -> assertEquals(86400, entry.getTtlSeconds()),
                () -> assertEquals(StorageTier.HOT, entry.getStorageTier()),
                () -> assertEquals(1.0, entry.getMetadata().getContextRelevance()),
                () -> assertEquals(1, entry.getMetadata().getVersion()),
                () -> assertTrue(entry.getMetadata().getSyncStatus().isEmpty()),
                () -> assertFalse(entry.isCompressed())
                 );
    }

    @Test
    void expiresOnlyAfterTtlElapses() {
        final var entry = MemoryEntry.of("hello")
                .withTtlSeconds(100)
                .withMetadata(MemoryMetadata.builder().lastModified(NOW).build());
        assertFalse(entry.isExpired(NOW));
        assertFalse(entry.isExpired(NOW.plusSeconds(100)));
        assertTrue(entry.isExpired(NOW.plusSeconds(100).plusNanos(1_000_000)));
    }

    @Test
    void nonPositiveTtlNeverExpires() {
        final var metadata = MemoryMetadata.builder().lastModified(NOW).build();
        assertFalse(MemoryEntry.of("x").withTtlSeconds(0).withMetadata(metadata).isExpired(NOW.plusYears(10)));
        assertFalse(MemoryEntry.of("x").withTtlSeconds(-5).withMetadata(metadata).isExpired(NOW.plusYears(10)));
    }

    @Test
    void unsavedEntryNeverExpires() {
        assertFalse(MemoryEntry.of("x").withTtlSeconds(1).isExpired(NOW.plusDays(1)));
    }

    @Test
    void hashIgnoresStructuredKeyOrder() {
        final var first = new LinkedHashMap<String, Object>();
        first.put("b", 2);
        first.put("a", 1);
        final var hashOfFirst = MemoryEntry.builder()
                .content(MemoryContent.structured(first))
                .build()
                .withUpdatedHash()
                .getMetadata()
                .getContentHash();
        final var hashOfSecond = MemoryEntry.builder()
                .content(MemoryContent.structured(Map.of("a", 1, "b", 2)))
                .build()
                .withUpdatedHash()
                .getMetadata()
                .getContentHash();
        assertEquals(hashOfFirst, hashOfSecond);
        assertEquals(64, hashOfFirst.length());
        assertNotEquals(hashOfFirst, MemoryEntry.of("{\"a\":1}").withUpdatedHash().getMetadata().getContentHash());
    }

    @Test
    void recordAccessIncrementsCount() {
        final var metadata = MemoryMetadata.empty().recordAccess(NOW).recordAccess(NOW.plusSeconds(1));
        assertEquals(2, metadata.getAccessCount());
        assertEquals(NOW.plusSeconds(1), metadata.getLastAccessed());
    }

    @Test
    @SneakyThrows
    void serializesWithContentType() {
        final var mapper = JsonUtils.createMapper();
        final var entry = MemoryEntry.builder()
                .content(MemoryContent.structured(Map.of("task", "deploy")))
                .priority(3)
                .metadata(MemoryMetadata.builder()
                                  .sourceTool("A")
                                  .lastModified(NOW)
                                  .syncStatus(Map.of("B", 2L))
                                  .build())
                .build();
        final var json = mapper.writeValueAsString(entry);
        assertTrue(json.contains("\"type\":\"STRUCTURED\""));
        final var parsed = mapper.readValue(json, MemoryEntry.class);
        assertEquals(entry, parsed);
        assertInstanceOf(StructuredContent.class, parsed.getContent());
    }
}
