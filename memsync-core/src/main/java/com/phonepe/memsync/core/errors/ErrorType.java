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

package com.phonepe.memsync.core.errors;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Classification of failures encountered while synchronizing memory
 */
@Getter
@AllArgsConstructor
public enum ErrorType {
    SUCCESS("Success"),
    COMPRESSION_FAILURE("Could not compress content to level %s: %s"),
    NO_ADAPTER("No adapter registered for consumer: %s"),
    ADAPTER_REJECTED("Adapter for consumer %s rejected the operation"),
    ADAPTER_FAILURE("Adapter call for consumer %s failed with error: %s"),
    ADAPTER_TIMEOUT("Adapter call for consumer %s timed out after %s"),
    BUDGET_EXHAUSTED("Entry does not fit budget of consumer %s at any compression level"),
    MISSING_SNAPSHOT("Operation for key %s has no entry snapshot"),
    ;

    private final String message;
}
