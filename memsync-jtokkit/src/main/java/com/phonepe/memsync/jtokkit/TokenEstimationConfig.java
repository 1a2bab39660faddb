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

import com.knuddels.jtokkit.api.EncodingType;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.With;

@Value
@Builder
@With
public class TokenEstimationConfig {

    public static final TokenEstimationConfig DEFAULT = TokenEstimationConfig.builder()
            .encoding(EncodingType.CL100K_BASE)
            .structuredOverhead(4)
            .build();

    /**
     * Encoding used for token counting
     */
    @NonNull
    EncodingType encoding;

    /**
     * Extra tokens charged for structured content, covering the framing a consumer adds around serialized data
     */
    int structuredOverhead;
}
