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
package com.emc.ecs.bulkimport.config;

import javax.xml.bind.annotation.XmlEnum;

/**
 * Decides when a move falls back to copy-then-delete.
 */
@XmlEnum
public enum MoveFallbackTrigger {
    /**
     * Attempt an atomic rename first and fall back only if the filesystem refuses it
     */
    renameFailure,
    /**
     * Compare the file stores of source and destination up front and skip the rename when they differ
     */
    fileStoreCheck
}
