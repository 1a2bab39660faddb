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

package com.phonepe.memsync.core.storage;

import com.phonepe.memsync.core.model.MemoryEntry;
import com.phonepe.memsync.core.model.MemoryMetadata;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Key to entry persistence with a secondary index on content hash.
 * Implementations must be safe for concurrent use. A save or delete must update the hash index in the same logical
 * operation as the primary entry, so that readers never see an index entry pointing to a missing or stale entry.
 * Backend I/O failures should be raised as {@link com.phonepe.memsync.core.errors.StorageException}.
 */
public interface MemoryStorage {

    /**
     * Prepare the backend for use. Called once when the sync engine starts.
     *
     * @return true if the backend is usable
     */
    default boolean initialize() {
        return true;
    }

    /**
     * Persist the entry under the key, replacing anything stored there. The stored copy carries a content hash
     * computed from its content.
     *
     * @return true if the entry was persisted
     */
    boolean save(String key, MemoryEntry entry);

    /**
     * Read an entry, recording the access in its metadata.
     */
    Optional<MemoryEntry> get(String key);

    /**
     * Read an entry without touching its access metadata
     */
    Optional<MemoryEntry> peek(String key);

    /**
     * Apply a metadata change to the entry currently stored under the key, atomically with respect to
     * {@link #get(String)} and other metadata changes. Content and content hash stay as they are.
     *
     * @return The updated entry, empty if nothing was stored under the key
     */
    Optional<MemoryEntry> updateMetadata(String key, UnaryOperator<MemoryMetadata> change);

    /**
     * @return false if nothing was stored under the key
     */
    boolean delete(String key);

    /**
     * @param prefix Key prefix to filter on. Empty or null matches all keys.
     * @return Matching keys in ascending order
     */
    List<String> listKeys(String prefix);

    default List<String> listKeys() {
        return listKeys("");
    }

    /**
     * Look up an entry through the content hash index. Does not record an access.
     */
    Optional<MemoryEntry> getByHash(String contentHash);

    default boolean isHealthy() {
        return true;
    }
}
