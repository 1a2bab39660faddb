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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.AccessLevel;
import lombok.Data;
import lombok.RequiredArgsConstructor;

import java.util.Map;

/**
 * Payload of a memory entry. Either free text or a string keyed mapping.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(name = MemoryContentType.Values.TEXT, value = TextContent.class),
        @JsonSubTypes.Type(name = MemoryContentType.Values.STRUCTURED, value = StructuredContent.class),
})
@Data
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class MemoryContent {
    private final MemoryContentType type;

    public abstract <T> T accept(final MemoryContentVisitor<T> visitor);

    public static MemoryContent text(final String text) {
        return new TextContent(text);
    }

    public static MemoryContent structured(final Map<String, Object> data) {
        return new StructuredContent(data);
    }
}
