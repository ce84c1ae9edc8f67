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

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cluster file ID in the same shape the storage server assigns to uploads:
 * <code>&lt;group&gt;/M&lt;XX&gt;/&lt;HH&gt;/&lt;LL&gt;/&lt;file name&gt;</code>, where XX is the store path index and
 * HH/LL are the two shard directories (upper-case hex).
 */
public final class FileIdentifier {
    public static final int MAX_LENGTH = 128;
    public static final String STORE_PATH_PREFIX = "M";

    private static final Pattern GROUP_PATTERN = Pattern.compile("[A-Za-z0-9_\\-]{1,16}");
    private static final Pattern ID_PATTERN = Pattern.compile(
            "^([A-Za-z0-9_\\-]{1,16})/M([0-9A-F]{2})/([0-9A-F]{2})/([0-9A-F]{2})/([A-Za-z0-9_\\-.]+)$");

    public static boolean isValidGroupName(String groupName) {
        return groupName != null && GROUP_PATTERN.matcher(groupName).matches();
    }

    /**
     * @throws IllegalArgumentException if the string is not a well-formed file ID
     */
    public static FileIdentifier parse(String fileId) {
        if (fileId == null || fileId.length() > MAX_LENGTH)
            throw new IllegalArgumentException("invalid file ID: " + fileId);
        Matcher matcher = ID_PATTERN.matcher(fileId);
        if (!matcher.matches()) throw new IllegalArgumentException("invalid file ID: " + fileId);
        return new FileIdentifier(matcher.group(1),
                Integer.parseInt(matcher.group(2), 16),
                Integer.parseInt(matcher.group(3), 16),
                Integer.parseInt(matcher.group(4), 16),
                matcher.group(5));
    }

    private final String groupName;
    private final int storePathIndex;
    private final int subdirHigh;
    private final int subdirLow;
    private final String fileName;

    public FileIdentifier(String groupName, int storePathIndex, int subdirHigh, int subdirLow, String fileName) {
        if (!isValidGroupName(groupName)) throw new IllegalArgumentException("invalid group name: " + groupName);
        checkByte("store path index", storePathIndex);
        checkByte("subdir", subdirHigh);
        checkByte("subdir", subdirLow);
        if (fileName == null || fileName.isEmpty() || fileName.contains("/"))
            throw new IllegalArgumentException("invalid file name: " + fileName);
        this.groupName = groupName;
        this.storePathIndex = storePathIndex;
        this.subdirHigh = subdirHigh;
        this.subdirLow = subdirLow;
        this.fileName = fileName;
    }

    private static void checkByte(String name, int value) {
        if (value < 0 || value > 0xFF) throw new IllegalArgumentException(name + " out of range: " + value);
    }

    public String getGroupName() {
        return groupName;
    }

    public int getStorePathIndex() {
        return storePathIndex;
    }

    public int getSubdirHigh() {
        return subdirHigh;
    }

    public int getSubdirLow() {
        return subdirLow;
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * The part below the store path's data directory: <code>HH/LL/name</code>
     */
    public String getRelativePath() {
        return String.format("%02X/%02X/%s", subdirHigh, subdirLow, fileName);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FileIdentifier that = (FileIdentifier) o;
        return storePathIndex == that.storePathIndex && subdirHigh == that.subdirHigh
                && subdirLow == that.subdirLow && groupName.equals(that.groupName) && fileName.equals(that.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(groupName, storePathIndex, subdirHigh, subdirLow, fileName);
    }

    @Override
    public String toString() {
        return String.format("%s/%s%02X/%s", groupName, STORE_PATH_PREFIX, storePathIndex, getRelativePath());
    }
}
