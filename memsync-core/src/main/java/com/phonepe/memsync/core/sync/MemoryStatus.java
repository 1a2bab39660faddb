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

import com.phonepe.memsync.core.model.CompressionLevel;
import com.phonepe.memsync.core.model.MemoryScope;
import com.phonepe.memsync.core.model.MemoryType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Read only snapshot of the memory system for dashboards. A growing {@link #pendingOperations} count is the primary
 * signal of synchronization lag.
 */
@Value
@Builder
public class MemoryStatus {
    boolean healthy;
    Map<String, Map<String, Object>> toolStatus;
    int entryCount;
    Map<String, Integer> toolCounts;
    Map<MemoryScope, Integer> scopeCounts;
    Map<MemoryType, Integer> typeCounts;
    Map<CompressionLevel, Integer> compressionCounts;
    Map<String, Integer> tokenUsage;
    int pendingOperations;
    Map<String, Integer> pendingByConsumer;
}
