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

import java.util.Objects;

/**
 * Outcome of a single pipeline stage: either a value, or an {@link ImportError} with a message. The value of a
 * failed result cannot be read, so a failure cannot be mistaken for a success.
 */
public final class StageResult<T> {
    public static <T> StageResult<T> ok(T value) {
        return new StageResult<>(value, ImportError.NONE, null);
    }

    public static StageResult<Void> ok() {
        return new StageResult<>(null, ImportError.NONE, null);
    }

    public static <T> StageResult<T> error(ImportError error, String message) {
        Objects.requireNonNull(error, "error is required");
        if (error == ImportError.NONE) throw new IllegalArgumentException("a failed result needs an error code");
        return new StageResult<>(null, error, message);
    }

    private final T value;
    private final ImportError error;
    private final String message;

    private StageResult(T value, ImportError error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public boolean isOk() {
        return error == ImportError.NONE;
    }

    /**
     * @throws IllegalStateException if this result is a failure
     */
    public T getValue() {
        if (!isOk()) throw new IllegalStateException("stage failed with " + error + ": " + message);
        return value;
    }

    public ImportError getError() {
        return error;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Re-types a failure so it can be returned from a stage with a different value type.
     */
    public <U> StageResult<U> propagate() {
        if (isOk()) throw new IllegalStateException("only a failed result can be propagated");
        return new StageResult<>(null, error, message);
    }

    @Override
    public String toString() {
        return isOk() ? "OK(" + value + ")" : error + "(" + message + ")";
    }
}
