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

package com.phonepe.memsync.jtokkit;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.phonepe.memsync.core.budget.TokenEstimator;
import com.phonepe.memsync.core.model.MemoryContentType;
import com.phonepe.memsync.core.model.MemoryEntry;
import com.phonepe.memsync.core.utils.ContentUtils;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Counts tokens of the canonical serialization of an entry using a BPE encoding
 */
@Slf4j
public class JTokkitTokenEstimator implements TokenEstimator {
    private static final EncodingRegistry ENCODING_REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;
    private final TokenEstimationConfig config;

    public JTokkitTokenEstimator() {
        this(TokenEstimationConfig.DEFAULT);
    }

    public JTokkitTokenEstimator(TokenEstimationConfig config) {
        this.config = Objects.requireNonNullElse(config, TokenEstimationConfig.DEFAULT);
        this.encoding = ENCODING_REGISTRY.getEncoding(this.config.getEncoding());
        log.debug("Token estimation using encoding {}", this.config.getEncoding());
    }

    @Override
    public int estimateTokens(MemoryEntry entry) {
        final var serialized = ContentUtils.canonicalForm(entry.getContent());
        final var tokens = encoding.countTokens(serialized);
        return entry.getContent().getType() == MemoryContentType.STRUCTURED
               ? tokens + config.getStructuredOverhead()
               : tokens;
    }
}
