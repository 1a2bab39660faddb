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

import com.phonepe.memsync.core.model.MemoryContent;
import com.phonepe.memsync.core.model.StructuredContent;
import com.phonepe.memsync.core.model.TextContent;
import com.phonepe.memsync.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentTransformsTest {

    @Test
    void lightTruncatesLongText() {
        final var text = "x".repeat(1500);
        final var result = (TextContent) ContentTransforms.light(new TextContent(text));
        assertEquals("x".repeat(900) + ContentTransforms.LIGHT_MARKER, result.getText());
        final var shortText = new TextContent("x".repeat(1000));
        assertSame(shortText, ContentTransforms.light(shortText));
    }

    @Test
    void mediumKeepsOuterSentences() {
        final var text = TestUtils.sentences(10);
        assertTrue(text.length() > 500);
        final var result = ((TextContent) ContentTransforms.medium(new TextContent(text))).getText();
        final var parts = result.split("\\. ");
        assertEquals(5, parts.length);
        assertTrue(parts[0].startsWith("Sentence number 1 "));
        assertTrue(parts[1].startsWith("Sentence number 2 "));
        assertEquals(ContentTransforms.MEDIUM_MARKER, parts[2]);
        assertTrue(parts[3].startsWith("Sentence number 9 "));
        assertTrue(parts[4].startsWith("Sentence number 10 "));
    }

    @Test
    void mediumLeavesFewSentencesAlone() {
        final var content = new TextContent("y".repeat(600) + ". two. three");
        assertSame(content, ContentTransforms.medium(content));
    }

    @Test
    void highKeepsFirstAndLastParagraph() {
        final var text = "first " + "a".repeat(150) + "\n\nmiddle " + "b".repeat(150) + "\n\nlast";
        final var result = ((TextContent) ContentTransforms.high(new TextContent(text))).getText();
        assertEquals("first " + "a".repeat(150) + ContentTransforms.HIGH_MARKER + "last", result);
    }

    @Test
    void extremeKeepsFirstParagraph() {
        final var text = "opening paragraph\n\n" + "z".repeat(200);
        final var result = ((TextContent) ContentTransforms.extreme(new TextContent(text))).getText();
        assertEquals("opening paragraph" + ContentTransforms.EXTREME_MARKER, result);
    }

    @Test
    void firstKeysFlagsTruncation() {
        final var data = new LinkedHashMap<String, Object>();
        for (int i = 0; i < 7; i++) {
            data.put("k" + i, i);
        }
        final var light = ((StructuredContent) ContentTransforms.firstKeys(
                new StructuredContent(data), ContentTransforms.LIGHT_KEEP_KEYS, false)).getData();
        assertEquals(List.of("k0", "k1", "k2", "k3", "k4", ContentTransforms.COMPRESSED_FLAG),
                     List.copyOf(light.keySet()));

        final var small = new StructuredContent(new LinkedHashMap<>(Map.of("only", 1)));
        final var untouched = ((StructuredContent) ContentTransforms.firstKeys(
                small, ContentTransforms.LIGHT_KEEP_KEYS, false)).getData();
        assertFalse(untouched.containsKey(ContentTransforms.COMPRESSED_FLAG));
    }

    @Test
    void keyNamesSummarizesStructure() {
        final var data = new LinkedHashMap<String, Object>();
        data.put("alpha", 1);
        data.put("beta", List.of(1, 2, 3));
        final var summary = ((StructuredContent) ContentTransforms.keyNames(new StructuredContent(data))).getData();
        assertEquals(true, summary.get(ContentTransforms.COMPRESSED_FLAG));
        assertEquals(List.of("alpha", "beta"), summary.get(ContentTransforms.KEYS_FIELD));
    }

    @Test
    void referenceUsesHash() {
        assertEquals("[Reference: memory with hash abc]", ContentTransforms.referenceTo("abc"));
        assertInstanceOf(TextContent.class, MemoryContent.text(ContentTransforms.referenceTo("abc")));
    }
}
