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
 * Per-record import state. INIT and PROCESSING are transient, the rest are terminal.
 */
public enum RecordStatus {
    INIT(0, "Init", false, false),
    PROCESSING(1, "Processing", false, false),
    SUCCESS(2, "Success", true, true),
    FAILED(3, "Failed", true, false),
    SKIPPED(4, "Skipped", true, false);

    public static RecordStatus fromValue(String value) {
        for (RecordStatus e : values()) {
            if (e.getValue().equals(value)) return e;
        }
        return null;
    }

    private final int code;
    private final String value;
    private final boolean terminal;
    private final boolean success;

    RecordStatus(int code, String value, boolean terminal, boolean success) {
        this.code = code;
        this.value = value;
        this.terminal = terminal;
        this.success = success;
    }

    public int getCode() {
        return code;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isSuccess() {
        return success;
    }
}
