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

import com.google.common.base.Preconditions;
import com.phonepe.memsync.core.model.MemoryEntry;
import com.phonepe.memsync.core.utils.ContentUtils;

/**
 * Estimates tokens as the length of the canonical serialization divided by a fixed number of characters per token,
 * rounded up.
 */
public class CharacterRatioTokenEstimator implements TokenEstimator {
    public static final int DEFAULT_CHARS_PER_TOKEN = 4;

    private final int charsPerToken;

    public CharacterRatioTokenEstimator() {
        this(DEFAULT_CHARS_PER_TOKEN);
    }

    public CharacterRatioTokenEstimator(int charsPerToken) {
        Preconditions.checkArgument(charsPerToken > 0, "Characters per token must be positive");
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int estimateTokens(MemoryEntry entry) {
        final var length = ContentUtils.canonicalLength(entry.getContent());
        return (length + charsPerToken - 1) / charsPerToken;
    }
}
