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
package com.emc.ecs.bulkimport.config;

import com.emc.ecs.bulkimport.config.annotation.Documentation;
import com.emc.ecs.bulkimport.config.annotation.Label;
import com.emc.ecs.bulkimport.config.annotation.Option;

import javax.xml.bind.annotation.XmlRootElement;

@XmlRootElement
@Label("Storage Node")
@Documentation("Describes the local storage node that receives the imported files: the group it belongs to, its " +
        "store paths (in the same order as the storage server configuration) and how file names are sharded")
public class StorageConfig {
    public static final int MAX_GROUP_NAME_LENGTH = 16;
    public static final int MAX_STORE_PATHS = 256;
    public static final int DEFAULT_SUBDIR_COUNT = 256;

    private String groupName;
    private String[] storePaths;
    private int storePathIndex;
    private int subdirCount = DEFAULT_SUBDIR_COUNT;
    private int serverId;

    @Option(orderIndex = 10, required = true, valueHint = "group-name", description = "The storage group that will own the imported files (i.e. group1)")
    public String getGroupName() {
        return groupName;
    }

    public void setGroupName(String groupName) {
        this.groupName = groupName;
    }

    @Option(orderIndex = 20, required = true, valueHint = "path", description = "The store paths of this storage node, in configuration order. The first path is store path index 0 (M00)")
    public String[] getStorePaths() {
        return storePaths;
    }

    public void setStorePaths(String[] storePaths) {
        this.storePaths = storePaths;
    }

    @Option(orderIndex = 30, cliName = "path-index", valueHint = "index", description = "Index of the store path that receives the files. Defaults to 0")
    public int getStorePathIndex() {
        return storePathIndex;
    }

    public void setStorePathIndex(int storePathIndex) {
        this.storePathIndex = storePathIndex;
    }

    @Option(orderIndex = 40, advanced = true, valueHint = "count", description = "Number of shard sub-directories per level under each store path (1-256). Must match the storage server. Defaults to " + DEFAULT_SUBDIR_COUNT)
    public int getSubdirCount() {
        return subdirCount;
    }

    public void setSubdirCount(int subdirCount) {
        this.subdirCount = subdirCount;
    }

    @Option(orderIndex = 50, advanced = true, valueHint = "id", description = "Server ID embedded in generated file names. Defaults to 0")
    public int getServerId() {
        return serverId;
    }

    public void setServerId(int serverId) {
        this.serverId = serverId;
    }

    public StorageConfig withGroupName(String groupName) {
        setGroupName(groupName);
        return this;
    }

    public StorageConfig withStorePaths(String... storePaths) {
        setStorePaths(storePaths);
        return this;
    }

    public StorageConfig withStorePathIndex(int storePathIndex) {
        setStorePathIndex(storePathIndex);
        return this;
    }

    public StorageConfig withSubdirCount(int subdirCount) {
        setSubdirCount(subdirCount);
        return this;
    }

    public StorageConfig withServerId(int serverId) {
        setServerId(serverId);
        return this;
    }
}
