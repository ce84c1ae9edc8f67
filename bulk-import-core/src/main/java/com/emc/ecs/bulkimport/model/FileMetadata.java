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
package com.emc.ecs.bulkimport.model;

/**
 * Filesystem facts captured for one source file before it is moved or copied.
 */
public class FileMetadata {
    private final long size;
    private final long modifyTime;
    private final long changeTime;
    private final Long checksum;
    private final String extension;

    public FileMetadata(long size, long modifyTime, long changeTime, Long checksum, String extension) {
        this.size = size;
        this.modifyTime = modifyTime;
        this.changeTime = changeTime;
        this.checksum = checksum;
        this.extension = extension;
    }

    public long getSize() {
        return size;
    }

    /**
     * epoch millis
     */
    public long getModifyTime() {
        return modifyTime;
    }

    /**
     * epoch millis of the last status change (or creation time where the filesystem has no ctime)
     */
    public long getChangeTime() {
        return changeTime;
    }

    /**
     * CRC32 of the file contents, or null if it was not computed
     */
    public Long getChecksum() {
        return checksum;
    }

    /**
     * file name extension without the dot, empty if there is none
     */
    public String getExtension() {
        return extension;
    }

    @Override
    public String toString() {
        return "FileMetadata{size=" + size + ", mtime=" + modifyTime + ", crc32=" + Checksums.toHex(checksum)
                + ", ext='" + extension + "'}";
    }
}
