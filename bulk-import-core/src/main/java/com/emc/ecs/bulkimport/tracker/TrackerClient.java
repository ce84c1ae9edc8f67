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

/**
 * Supplies the target group and store path for a batch. Called once per batch, never per file.
 */
public interface TrackerClient {
    /**
     * @throws BatchFatalException if the group cannot be resolved or no usable store path is available
     */
    TrackerAssignment resolve(StorageConfig storageConfig);
}
