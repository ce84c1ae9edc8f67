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
package com.emc.ecs.bulkimport.stage;

import com.emc.ecs.bulkimport.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Free space query for a store path. Nothing is reserved; a file that no longer fits by the time it is written fails
 * in the transfer with NO_SPACE.
 */
public class SpaceChecker {
    private static final Logger log = LoggerFactory.getLogger(SpaceChecker.class);

    private final StorePaths storePaths;
    private final long safetyMargin;

    public SpaceChecker(StorePaths storePaths, long safetyMargin) {
        if (safetyMargin < 0) throw new IllegalArgumentException("safety margin must not be negative");
        this.storePaths = storePaths;
        this.safetyMargin = safetyMargin;
    }

    /**
     * @return true if the store path has at least <code>requiredBytes</code> plus the safety margin available. An
     * unknown index or a store path whose free space cannot be read has no space.
     */
    public boolean hasSpace(int storePathIndex, long requiredBytes) {
        if (!storePaths.isValidIndex(storePathIndex)) return false;
        Path storePath = storePaths.getStorePath(storePathIndex);
        try {
            long usable = getUsableSpace(storePath);
            boolean enough = usable - safetyMargin >= requiredBytes;
            if (!enough)
                log.warn("store path {} has {} bytes free; {} + {} required", storePath, usable, requiredBytes, safetyMargin);
            return enough;
        } catch (IOException e) {
            log.warn("could not read free space of {}", storePath, e);
            return false;
        }
    }

    protected long getUsableSpace(Path storePath) throws IOException {
        return Files.getFileStore(storePath).getUsableSpace();
    }

    public long getSafetyMargin() {
        return safetyMargin;
    }
}
