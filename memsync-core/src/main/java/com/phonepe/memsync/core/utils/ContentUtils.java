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

package com.phonepe.memsync.core.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.hash.Hashing;
import com.phonepe.memsync.core.errors.ContentSerializationException;
import com.phonepe.memsync.core.model.MemoryContent;
import com.phonepe.memsync.core.model.MemoryContentVisitor;
import com.phonepe.memsync.core.model.StructuredContent;
import com.phonepe.memsync.core.model.TextContent;
import lombok.experimental.UtilityClass;

import java.nio.charset.StandardCharsets;

/**
 * Canonical serialization and hashing of memory content
 */
@UtilityClass
public class ContentUtils {
    private static final ObjectMapper CANONICAL_MAPPER = JsonUtils.createCanonicalMapper();

    /**
     * Text is used verbatim. Structured content is serialized to JSON with keys sorted.
     *
     * @throws ContentSerializationException if a structured value cannot be serialized
     */
    public static String canonicalForm(final MemoryContent content) {
        return content.accept(new MemoryContentVisitor<String>() {
            @Override
            public String visit(TextContent text) {
                return text.getText();
            }

            @Override
            public String visit(StructuredContent structured) {
                try {
                    return CANONICAL_MAPPER.writeValueAsString(structured.getData());
                }
                catch (JsonProcessingException e) {
                    throw new ContentSerializationException(
                            "Could not serialize structured content: " + e.getOriginalMessage(), e);
                }
            }
        });
    }

    public static int canonicalLength(final MemoryContent content) {
        return canonicalForm(content).length();
    }

    public static String contentHash(final MemoryContent content) {
        return Hashing.sha256()
                .hashString(canonicalForm(content), StandardCharsets.UTF_8)
                .toString();
    }
}
