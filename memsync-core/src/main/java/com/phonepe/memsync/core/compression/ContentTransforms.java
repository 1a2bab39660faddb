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

import com.phonepe.memsync.core.model.CompressionLevel;
import com.phonepe.memsync.core.model.MemoryContent;
import com.phonepe.memsync.core.model.MemoryContentType;
import com.phonepe.memsync.core.model.MemoryMetadata;
import com.phonepe.memsync.core.model.StructuredContent;
import com.phonepe.memsync.core.model.TextContent;
import com.phonepe.memsync.core.utils.ContentUtils;
import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The default compression ladder.
 * <p>
 * Text:
 * <ul>
 *     <li>LIGHT: first {@value LIGHT_KEEP_CHARS} chars if longer than {@value LIGHT_MIN_CHARS}</li>
 *     <li>MEDIUM: first two and last two sentences if longer than {@value MEDIUM_MIN_CHARS} chars and has more
 *     than {@value MEDIUM_MIN_SENTENCES} sentences</li>
 *     <li>HIGH: first and last paragraph if longer than {@value HIGH_MIN_CHARS} chars</li>
 *     <li>EXTREME: first paragraph if longer than {@value EXTREME_MIN_CHARS} chars</li>
 *     <li>REFERENCE_ONLY: a pointer to the content hash</li>
 * </ul>
 * Structured content keeps the first five keys at LIGHT, three at MEDIUM and only the key names above that.
 */
@UtilityClass
public class ContentTransforms {
    public static final String COMPRESSED_FLAG = "_compressed";
    public static final String KEYS_FIELD = "_keys";

    public static final String LIGHT_MARKER = "... [compressed]";
    public static final String MEDIUM_MARKER = "...";
    public static final String HIGH_MARKER = "\n\n... [highly compressed] ...\n\n";
    public static final String EXTREME_MARKER = " ... [extremely compressed]";
    public static final String REFERENCE_FORMAT = "[Reference: memory with hash %s]";

    static final int LIGHT_MIN_CHARS = 1000;
    static final int LIGHT_KEEP_CHARS = 900;
    static final int MEDIUM_MIN_CHARS = 500;
    static final int MEDIUM_MIN_SENTENCES = 5;
    static final int HIGH_MIN_CHARS = 300;
    static final int EXTREME_MIN_CHARS = 100;

    static final int LIGHT_KEEP_KEYS = 5;
    static final int MEDIUM_KEEP_KEYS = 3;

    private static final String SENTENCE_SEPARATOR = ". ";
    private static final Pattern SENTENCE_SPLITTER = Pattern.compile(Pattern.quote(SENTENCE_SEPARATOR));
    private static final Pattern PARAGRAPH_SPLITTER = Pattern.compile("\n\n");

    public static Map<CompressionLevel, ContentTransform> defaults() {
        final var transforms = new EnumMap<CompressionLevel, ContentTransform>(CompressionLevel.class);
        transforms.put(CompressionLevel.LIGHT,
                       ContentTransform.of((text, metadata) -> light(text),
                                           (data, metadata) -> firstKeys(data, LIGHT_KEEP_KEYS, false)));
        transforms.put(CompressionLevel.MEDIUM,
                       ContentTransform.of((text, metadata) -> medium(text),
                                           (data, metadata) -> firstKeys(data, MEDIUM_KEEP_KEYS, true)));
        transforms.put(CompressionLevel.HIGH,
                       ContentTransform.of((text, metadata) -> high(text),
                                           (data, metadata) -> keyNames(data)));
        transforms.put(CompressionLevel.EXTREME,
                       ContentTransform.of((text, metadata) -> extreme(text),
                                           (data, metadata) -> keyNames(data)));
        transforms.put(CompressionLevel.REFERENCE_ONLY, new ReferenceTransform());
        return transforms;
    }

    static MemoryContent light(TextContent content) {
        final var text = content.getText();
        if (text.length() <= LIGHT_MIN_CHARS) {
            return content;
        }
        return MemoryContent.text(text.substring(0, LIGHT_KEEP_CHARS) + LIGHT_MARKER);
    }

    static MemoryContent medium(TextContent content) {
        final var text = content.getText();
        if (text.length() <= MEDIUM_MIN_CHARS) {
            return content;
        }
        final var sentences = SENTENCE_SPLITTER.split(text, -1);
        if (sentences.length <= MEDIUM_MIN_SENTENCES) {
            return content;
        }
        final var kept = new ArrayList<String>(5);
        kept.addAll(Arrays.asList(sentences).subList(0, 2));
        kept.add(MEDIUM_MARKER);
        kept.addAll(Arrays.asList(sentences).subList(sentences.length - 2, sentences.length));
        return MemoryContent.text(String.join(SENTENCE_SEPARATOR, kept));
    }

    static MemoryContent high(TextContent content) {
        final var text = content.getText();
        if (text.length() <= HIGH_MIN_CHARS) {
            return content;
        }
        final var paragraphs = PARAGRAPH_SPLITTER.split(text, -1);
        if (paragraphs.length <= 2) {
            return content;
        }
        return MemoryContent.text(paragraphs[0] + HIGH_MARKER + paragraphs[paragraphs.length - 1]);
    }

    static MemoryContent extreme(TextContent content) {
        final var text = content.getText();
        if (text.length() <= EXTREME_MIN_CHARS) {
            return content;
        }
        return MemoryContent.text(PARAGRAPH_SPLITTER.split(text, -1)[0] + EXTREME_MARKER);
    }

    static MemoryContent firstKeys(StructuredContent content, int count, boolean alwaysFlag) {
        final var data = content.getData();
        final var kept = new LinkedHashMap<String, Object>();
        data.entrySet()
                .stream()
                .limit(count)
                .forEach(entry -> kept.put(entry.getKey(), entry.getValue()));
        if (alwaysFlag || kept.size() < data.size()) {
            kept.put(COMPRESSED_FLAG, true);
        }
        return MemoryContent.structured(kept);
    }

    static MemoryContent keyNames(StructuredContent content) {
        final var summary = new LinkedHashMap<String, Object>();
        summary.put(COMPRESSED_FLAG, true);
        summary.put(KEYS_FIELD, List.copyOf(content.getData().keySet()));
        return MemoryContent.structured(summary);
    }

    public static String referenceTo(String contentHash) {
        return REFERENCE_FORMAT.formatted(contentHash);
    }

    /**
     * Text is replaced by a pointer to the original. Structured content degrades to key names like the levels below.
     */
    private static final class ReferenceTransform implements ContentTransform {
        @Override
        public MemoryContent apply(MemoryContent content, MemoryMetadata metadata) {
            if (content instanceof StructuredContent structured) {
                return keyNames(structured);
            }
            final var hash = Objects.requireNonNullElseGet(metadata.getContentHash(),
                                                           () -> ContentUtils.contentHash(content));
            return MemoryContent.text(referenceTo(hash));
        }

        @Override
        public boolean isMandatory(MemoryContent content) {
            return content.getType() == MemoryContentType.TEXT;
        }
    }
}
