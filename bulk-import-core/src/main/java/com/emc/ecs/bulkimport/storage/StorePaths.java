/*
 * Copyright (c) 2022 Dell Inc. or its subsidiaries. All Rights Reserved.
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
package com.emc.ecs.bulkimport.storage;

import com.emc.ecs.bulkimport.config.ConfigurationException;
import com.emc.ecs.bulkimport.config.StorageConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The store roots of the local storage node, in configuration order. Maps file IDs to on-disk locations without
 * touching the filesystem.
 */
public class StorePaths {
    public static final String DATA_DIR = "data";

    private final List<Path> roots;
    private final int subdirCount;

    public StorePaths(StorageConfig config) {
        this(toPaths(config.getStorePaths()), config.getSubdirCount());
    }

    public StorePaths(List<Path> roots, int subdirCount) {
        if (roots == null || roots.isEmpty()) throw new ConfigurationException("at least one store path is required");
        if (roots.size() > StorageConfig.MAX_STORE_PATHS)
            throw new ConfigurationException("at most " + StorageConfig.MAX_STORE_PATHS + " store paths are supported");
        if (subdirCount < 1 || subdirCount > 256)
            throw new ConfigurationException("subdir count must be between 1 and 256");
        this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
        this.subdirCount = subdirCount;
    }

    private static List<Path> toPaths(String[] storePaths) {
        if (storePaths == null) return null;
        List<Path> paths = new ArrayList<>();
        for (String storePath : storePaths) {
            paths.add(Paths.get(storePath));
        }
        return paths;
    }

    public int getCount() {
        return roots.size();
    }

    public boolean isValidIndex(int storePathIndex) {
        return storePathIndex >= 0 && storePathIndex < roots.size();
    }

    public int getSubdirCount() {
        return subdirCount;
    }

    public Path getStorePath(int storePathIndex) {
        if (!isValidIndex(storePathIndex))
            throw new IllegalArgumentException("store path index " + storePathIndex + " is out of range (0-" + (roots.size() - 1) + ")");
        return roots.get(storePathIndex);
    }

    public Path getDataDirectory(int storePathIndex) {
        return getStorePath(storePathIndex).resolve(DATA_DIR);
    }

    /**
     * Derives the full on-disk path for a file ID: <code>&lt;store path&gt;/data/HH/LL/name</code>.
     *
     * @throws IllegalArgumentException if the ID is malformed or addresses a different store path
     */
    public Path resolveStoragePath(int storePathIndex, String identifier) {
        FileIdentifier fileId = FileIdentifier.parse(identifier);
        if (fileId.getStorePathIndex() != storePathIndex)
            throw new IllegalArgumentException(identifier + " does not belong to store path index " + storePathIndex);
        return resolveStoragePath(fileId);
    }

    public Path resolveStoragePath(FileIdentifier fileId) {
        return getDataDirectory(fileId.getStorePathIndex())
                .resolve(String.format("%02X", fileId.getSubdirHigh()))
                .resolve(String.format("%02X", fileId.getSubdirLow()))
                .resolve(fileId.getFileName());
    }
}
