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

import lombok.Value;

/**
 * Error from a synchronization step
 */
@Value
public class SyncError {
    ErrorType errorType;
    String message;

    public static SyncError success() {
        return new SyncError(ErrorType.SUCCESS, ErrorType.SUCCESS.getMessage());
    }

    public static SyncError error(ErrorType errorType, Object... args) {
        return new SyncError(errorType, String.format(errorType.getMessage(), args));
    }

    public boolean isSuccess() {
        return errorType == ErrorType.SUCCESS;
    }
}
