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
package com.emc.ecs.bulkimport.model;

/**
 * Flat error code space for record outcomes. Codes 0-10 are the storage server's bulk import codes.
 */
public enum ImportError {
    NONE(0, "OK"),
    FILE_NOT_FOUND(1, "File not found"),
    FILE_TOO_LARGE(2, "File too large"),
    INVALID_PATH(3, "Invalid path"),
    METADATA_FAILED(4, "Could not read file metadata"),
    COPY_FAILED(5, "Copy failed"),
    MOVE_FAILED(6, "Move failed"),
    INDEX_UPDATE(7, "Index update failed"),
    CRC32_FAILED(8, "CRC32 calculation failed"),
    NO_SPACE(9, "Insufficient disk space"),
    PERMISSION(10, "Permission denied"),
    ID_COLLISION(11, "Could not generate a unique file ID"),
    ALREADY_IMPORTED(12, "Already imported"),
    BATCH_ABORTED(13, "Batch aborted"),
    CANCELLED(14, "Batch cancelled");

    public static ImportError fromCode(int code) {
        for (ImportError e : values()) {
            if (e.getCode() == code) return e;
        }
        throw new IllegalArgumentException("unknown import error code " + code);
    }

    private final int code;
    private final String description;

    ImportError(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
