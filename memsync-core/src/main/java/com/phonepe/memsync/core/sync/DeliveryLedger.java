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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tokens charged to each consumer for the copy of each key it currently holds.
 * Lets a redelivery replace the earlier charge instead of adding to it.
 */
class DeliveryLedger {
    private final Map<String, Map<String, Integer>> allocations = new ConcurrentHashMap<>();

    int allocation(final String consumer, final String key) {
        final var perKey = allocations.get(consumer);
        return perKey == null ? 0 : perKey.getOrDefault(key, 0);
    }

    void record(final String consumer, final String key, final int tokens) {
        allocations.computeIfAbsent(consumer, c -> new ConcurrentHashMap<>()).put(key, tokens);
    }

    int remove(final String consumer, final String key) {
        final var perKey = allocations.get(consumer);
        if (perKey == null) {
            return 0;
        }
        final var removed = perKey.remove(key);
        return removed == null ? 0 : removed;
    }
}
