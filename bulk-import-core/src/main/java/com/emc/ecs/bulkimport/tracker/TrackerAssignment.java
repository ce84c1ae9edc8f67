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

/**
 * Group and store path chosen for a batch.
 */
public class TrackerAssignment {
    private final String groupName;
    private final int storePathIndex;

    public TrackerAssignment(String groupName, int storePathIndex) {
        this.groupName = groupName;
        this.storePathIndex = storePathIndex;
    }

    public String getGroupName() {
        return groupName;
    }

    public int getStorePathIndex() {
        return storePathIndex;
    }

    @Override
    public String toString() {
        return String.format("%s/M%02X", groupName, storePathIndex);
    }
}
