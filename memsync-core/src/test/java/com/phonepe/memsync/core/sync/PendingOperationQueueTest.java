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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PendingOperationQueueTest {

    private static SyncOperation operation(PendingOperationQueue queue, String key, Set<String> targets) {
        return SyncOperation.builder()
                .operationId(key + "-op")
                .sequence(queue.nextSequence())
                .type(SyncOperationType.UPDATED)
                .key(key)
                .origin("A")
                .pendingTargets(targets)
                .build();
    }

    @Test
    void laterOperationSupersedesEarlier() {
        final var queue = new PendingOperationQueue();
        final var first = operation(queue, "k1", Set.of("B"));
        final var other = operation(queue, "k2", Set.of("B"));
        final var second = operation(queue, "k1", Set.of("B"));
        queue.enqueue(first);
        queue.enqueue(other);
        queue.enqueue(second);

        assertTrue(queue.isSuperseded(first));
        assertFalse(queue.isSuperseded(other));
        assertFalse(queue.isSuperseded(second));
    }

    @Test
    void drainTakesOnlyWhatWasQueued() {
        final var queue = new PendingOperationQueue();
        final var first = operation(queue, "k1", Set.of("B", "C"));
        queue.enqueue(first);

        final var batch = queue.drain();
        assertEquals(List.of(first), batch);
        assertEquals(0, queue.size());

        queue.requeue(first.withPendingTargets(Set.of("C")));
        assertEquals(Map.of("C", 1), queue.pendingByConsumer());
        assertFalse(queue.isSuperseded(first));
    }

    @Test
    void completionForgetsLatestSequence() {
        final var queue = new PendingOperationQueue();
        final var first = operation(queue, "k1", Set.of("B"));
        queue.enqueue(first);
        final var second = operation(queue, "k1", Set.of("B"));
        queue.enqueue(second);

        queue.complete(first);
        assertTrue(queue.isSuperseded(first));
        queue.complete(second);
        assertFalse(queue.isSuperseded(first));
    }
}
