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
package com.emc.ecs.bulkimport.tracker;

import com.emc.ecs.bulkimport.BatchFatalException;
import com.emc.ecs.bulkimport.config.StorageConfig;
import com.emc.ecs.bulkimport.storage.FileIdentifier;
import com.emc.ecs.bulkimport.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers from the local storage configuration, for imports run directly on a storage node.
 */
public class StaticTrackerClient implements TrackerClient {
    private static final Logger log = LoggerFactory.getLogger(StaticTrackerClient.class);

    private final StorePaths storePaths;

    public StaticTrackerClient(StorePaths storePaths) {
        this.storePaths = storePaths;
    }

    @Override
    public TrackerAssignment resolve(StorageConfig storageConfig) {
        String groupName = storageConfig.getGroupName();
        if (!FileIdentifier.isValidGroupName(groupName))
            throw new BatchFatalException("invalid target group: " + groupName);
        if (!storePaths.isValidIndex(storageConfig.getStorePathIndex()))
            throw new BatchFatalException("store path index " + storageConfig.getStorePathIndex()
                    + " is not configured for group " + groupName + " (" + storePaths.getCount() + " store paths)");
        TrackerAssignment assignment = new TrackerAssignment(groupName, storageConfig.getStorePathIndex());
        log.info("batch assigned to {}", assignment);
        return assignment;
    }
}
