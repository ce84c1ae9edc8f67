/*
 * Copyright (c) 2014-2022 Dell Inc. or its subsidiaries. All Rights Reserved.
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
package com.emc.ecs.bulkimport.service;

/**
 * The persistent file index: maps file IDs to their on-disk location and import metadata.
 * <p>
 * Every method may throw {@link IndexUnavailableException} when the underlying store cannot be used.
 */
public interface IndexService extends AutoCloseable {
    /**
     * Opens the store and creates the index table if necessary. Optional; the other methods open lazily.
     */
    void init();

    /**
     * Exclusive in-process lock on a key. File IDs and absolute source paths never overlap, so both can be locked
     * through the same service.
     */
    void lock(String key);

    void unlock(String key);

    boolean exists(String fileId);

    /**
     * Atomic check-then-insert keyed by file ID.
     *
     * @return false if the file ID is already registered (nothing is written)
     */
    boolean insertIfAbsent(IndexRecord record);

    /**
     * @return the record or null if the file ID is not registered
     */
    IndexRecord getByFileId(String fileId);

    /**
     * @return the most recent import of the given source path, or null if it was never imported
     */
    IndexRecord getBySourcePath(String sourcePath);

    Iterable<IndexRecord> getAllRecords();

    String getTableName();

    void setTableName(String tableName);

    /**
     * Removes all index data. Intended for tests and scratch indexes only.
     */
    void deleteDatabase();

    @Override
    void close();
}
