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

import java.util.Arrays;
import java.util.List;

/**
 * The compression ladder. Declaration order is significant: each level is at least as aggressive as the ones
 * declared before it.
 */
public enum CompressionLevel {
    NONE,
    LIGHT,
    MEDIUM,
    HIGH,
    EXTREME,
    REFERENCE_ONLY,
    ;

    private static final List<CompressionLevel> LADDER = Arrays.stream(values())
            .filter(level -> level != NONE)
            .toList();

    public boolean isAtLeast(CompressionLevel other) {
        return compareTo(other) >= 0;
    }

    /**
     * @return All levels except {@link #NONE}, least aggressive first
     */
    public static List<CompressionLevel> ladder() {
        return LADDER;
    }
}
