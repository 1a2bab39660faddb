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

import com.phonepe.memsync.core.model.MemoryEntry;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Delivers synchronized entries to one consumer. Entries handed to an adapter are already compressed to fit the
 * consumer budget. Deliveries are at least once, so implementations must treat repeated calls as overwrites.
 * A false return or an exception marks the delivery as failed and it will be retried later.
 */
public interface ToolAdapter {

    /**
     * @return Name of the consumer served by this adapter
     */
    String consumer();

    /**
     * Token ceiling of the consumer context window. Used as the consumer budget unless one is configured explicitly.
     */
    default OptionalInt contextWindowSize() {
        return OptionalInt.empty();
    }

    /**
     * Health and state details reported in the engine status
     */
    default Map<String, Object> status() {
        return Map.of("consumer", consumer());
    }

    default boolean initialize() {
        return true;
    }

    boolean syncCreate(String key, MemoryEntry entry);

    boolean syncUpdate(String key, MemoryEntry entry);

    boolean syncDelete(String key);
}
