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

/**
 * Result of a create or update
 */
public enum WriteOutcome {
    CREATED,
    UPDATED,
    /**
     * The write lost conflict resolution against a newer stored entry. The stored entry was kept and its version
     * bumped to record the conflict.
     */
    SUPERSEDED,
    /**
     * Storage refused the write
     */
    FAILED,
    ;

    public boolean isApplied() {
        return this == CREATED || this == UPDATED;
    }
}
