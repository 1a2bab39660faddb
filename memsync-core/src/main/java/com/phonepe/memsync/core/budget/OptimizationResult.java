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

package com.phonepe.memsync.core.budget;

import com.phonepe.memsync.core.model.MemoryEntry;
import lombok.Value;

import java.util.List;

/**
 * Outcome of fitting a set of entries into a consumer budget. Entries are either admitted, possibly in compressed
 * form, or dropped because no compression level made them fit.
 */
@Value
public class OptimizationResult {
    List<MemoryEntry> admitted;
    List<MemoryEntry> dropped;
    int admittedTokens;

    public int admittedCount() {
        return admitted.size();
    }
}
