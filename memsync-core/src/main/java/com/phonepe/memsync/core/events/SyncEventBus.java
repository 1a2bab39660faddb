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

package com.phonepe.memsync.core.events;

import com.google.common.annotations.VisibleForTesting;
import com.phonepe.memsync.core.sync.SyncOperation;
import com.phonepe.memsync.core.sync.SyncOperationType;
import io.appform.signals.signals.ConsumingFireForgetSignal;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Audit channel for every operation the sync engine records, reads included.
 * Handlers are invoked asynchronously and can never hold up a write.
 */
public class SyncEventBus {
    private final ConsumingFireForgetSignal<SyncOperation> operationSignal;

    public SyncEventBus() {
        this(Executors.newCachedThreadPool());
    }

    public SyncEventBus(final ExecutorService executorService) {
        this(ConsumingFireForgetSignal.<SyncOperation>builder()
                     .executorService(executorService)
                     .build());
    }

    @VisibleForTesting
    SyncEventBus(ConsumingFireForgetSignal<SyncOperation> operationSignal) {
        this.operationSignal = operationSignal;
    }

    /**
     * @return Signal to connect operation handlers to
     */
    public ConsumingFireForgetSignal<SyncOperation> onOperation() {
        return operationSignal;
    }

    /**
     * Publish an operation to all handlers. Reads of entries the reader cannot see are published without the
     * entry snapshot.
     */
    public void publish(final SyncOperation operation) {
        final var entry = operation.getEntry();
        if (operation.getType() == SyncOperationType.ACCESSED
                && null != entry
                && !entry.isVisibleTo(operation.getOrigin())) {
            operationSignal.dispatch(operation.withEntry(null));
            return;
        }
        operationSignal.dispatch(operation);
    }
}
