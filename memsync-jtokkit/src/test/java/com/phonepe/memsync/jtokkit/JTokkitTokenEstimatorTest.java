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
import com.knuddels.jtokkit.api.EncodingType;
import com.phonepe.memsync.core.budget.TokenBudgetManager;
import com.phonepe.memsync.core.model.MemoryContent;
import com.phonepe.memsync.core.model.MemoryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JTokkitTokenEstimatorTest {

    private JTokkitTokenEstimator estimator;
    private Encoding encoder;

    @BeforeEach
    void setUp() {
        estimator = new JTokkitTokenEstimator();
        encoder = Encodings.newDefaultEncodingRegistry().getEncoding(EncodingType.CL100K_BASE);
    }

    @Test
    void countsTextTokens() {
        final var text = "You are a helpful assistant.";
        assertEquals(encoder.countTokens(text), estimator.estimateTokens(MemoryEntry.of(text)));
    }

    @Test
    void structuredContentCarriesOverhead() {
        final var entry = MemoryEntry.builder()
                .content(MemoryContent.structured(Map.of("b", 2, "a", 1)))
                .build();
        assertEquals(encoder.countTokens("{\"a\":1,\"b\":2}") + TokenEstimationConfig.DEFAULT.getStructuredOverhead(),
                     estimator.estimateTokens(entry));
    }

    @Test
    void configuredEncodingIsUsed() {
        final var o200k = new JTokkitTokenEstimator(TokenEstimationConfig.DEFAULT.withEncoding(EncodingType.O200K_BASE));
        final var text = "Synchronizing memory across tools";
        final var expected = Encodings.newDefaultEncodingRegistry()
                .getEncoding(EncodingType.O200K_BASE)
                .countTokens(text);
        assertEquals(expected, o200k.estimateTokens(MemoryEntry.of(text)));
    }

    @Test
    void drivesBudgetAdmission() {
        final var budgets = TokenBudgetManager.builder()
                .estimator(estimator)
                .ceilings(Map.of("B", 20))
                .build();
        final var small = MemoryEntry.of("a short note").withPriority(5);
        final var large = MemoryEntry.of("word ".repeat(2000)).withPriority(1);

        final var result = budgets.optimizeForTool(List.of(large, small), "B");

        assertEquals(small, result.getAdmitted().get(0));
        assertTrue(budgets.usage("B") <= 20);
    }
}
