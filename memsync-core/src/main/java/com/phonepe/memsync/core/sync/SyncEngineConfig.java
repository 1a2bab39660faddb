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

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

import java.time.Duration;

/**
 * Tunables for {@link MemorySyncEngine}
 */
@Value
@Builder
@With
public class SyncEngineConfig {

    public static final SyncEngineConfig DEFAULT = SyncEngineConfig.builder()
            .drainInterval(Duration.ofSeconds(5))
            .adapterTimeout(Duration.ofSeconds(10))
            .defaultTokenBudget(8192)
            .lockStripes(64)
            .build();

    /**
     * Delay between background runs of pending operation delivery. Zero disables the background worker.
     */
    @NonNull
    Duration drainInterval;

    /**
     * Maximum time to wait for a single adapter call
     */
    @NonNull
    Duration adapterTimeout;

    /**
     * Budget for consumers whose adapter does not declare a context window size and that have no configured budget
     */
    int defaultTokenBudget;

    /**
     * Number of lock stripes used to serialize mutations per key
     */
    int lockStripes;
}
