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
import com.phonepe.memsync.core.model.MemoryContentVisitor;
import com.phonepe.memsync.core.model.MemoryMetadata;
import com.phonepe.memsync.core.model.StructuredContent;
import com.phonepe.memsync.core.model.TextContent;

import java.util.function.BiFunction;

/**
 * Transformation applied to content for one level of the compression ladder
 */
public interface ContentTransform {

    /**
     * @return The transformed content, or the input itself if the level does not apply to it
     */
    MemoryContent apply(MemoryContent content, MemoryMetadata metadata);

    /**
     * A mandatory rendition is used even if a lower level produced something smaller.
     */
    default boolean isMandatory(MemoryContent content) {
        return false;
    }

    static ContentTransform of(BiFunction<TextContent, MemoryMetadata, MemoryContent> textTransform,
                               BiFunction<StructuredContent, MemoryMetadata, MemoryContent> structuredTransform) {
        return (content, metadata) -> content.accept(new MemoryContentVisitor<>() {
            @Override
            public MemoryContent visit(TextContent text) {
                return textTransform.apply(text, metadata);
            }

            @Override
            public MemoryContent visit(StructuredContent structured) {
                return structuredTransform.apply(structured, metadata);
            }
        });
    }
}
