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

import java.util.Objects;

public class FailedObject implements Comparable<FailedObject> {
    private final long listRowNum;
    private final String sourcePath;
    private final ImportError error;

    public FailedObject(long listRowNum, String sourcePath, ImportError error) {
        this.listRowNum = listRowNum;
        this.sourcePath = sourcePath;
        this.error = error;
    }

    /**
     * Orders by input position first, then by path.
     */
    @Override
    public int compareTo(FailedObject failedObject) {
        if (this.listRowNum == failedObject.getListRowNum()) {
            return this.sourcePath.compareTo(failedObject.sourcePath);
        } else {
            return (this.listRowNum > failedObject.getListRowNum() ? 1 : -1);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FailedObject that = (FailedObject) o;
        return listRowNum == that.listRowNum && sourcePath.equals(that.sourcePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(listRowNum, sourcePath);
    }

    @Override
    public String toString() {
        return String.format("[#%d] %s (%s)", this.listRowNum, this.sourcePath, this.error);
    }

    public long getListRowNum() {
        return listRowNum;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public ImportError getError() {
        return error;
    }
}
