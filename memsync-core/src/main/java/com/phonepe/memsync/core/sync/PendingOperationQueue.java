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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FIFO of operations awaiting delivery.
 * Tracks the latest queued sequence per key so that operations overtaken by a newer change to the same key can be
 * dropped instead of delivered.
 */
class PendingOperationQueue {
    private final Queue<SyncOperation> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong sequenceGenerator = new AtomicLong();
    private final Map<String, Long> latestSequence = new ConcurrentHashMap<>();

    long nextSequence() {
        return sequenceGenerator.incrementAndGet();
    }

    /**
     * Must be called with the key lock held so that sequence order per key matches enqueue order
     */
    void enqueue(final SyncOperation operation) {
        latestSequence.merge(operation.getKey(), operation.getSequence(), Math::max);
        queue.add(operation);
    }

    void requeue(final SyncOperation operation) {
        queue.add(operation);
    }

    /**
     * Remove the operations queued at the time of the call. Operations added while draining stay for the next run.
     */
    List<SyncOperation> drain() {
        final var limit = queue.size();
        final var batch = new ArrayList<SyncOperation>(limit);
        for (int i = 0; i < limit; i++) {
            final var operation = queue.poll();
            if (operation == null) {
                break;
            }
            batch.add(operation);
        }
        return batch;
    }

    boolean isSuperseded(final SyncOperation operation) {
        final var latest = latestSequence.get(operation.getKey());
        return latest != null && latest > operation.getSequence();
    }

    void complete(final SyncOperation operation) {
        latestSequence.remove(operation.getKey(), operation.getSequence());
    }

    int size() {
        return queue.size();
    }

    Map<String, Integer> pendingByConsumer() {
        final var counts = new TreeMap<String, Integer>();
        queue.forEach(operation -> operation.getPendingTargets()
                .forEach(target -> counts.merge(target, 1, Integer::sum)));
        return counts;
    }
}
