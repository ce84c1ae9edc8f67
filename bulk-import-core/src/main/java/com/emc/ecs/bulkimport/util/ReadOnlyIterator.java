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
package com.emc.ecs.bulkimport.util;

import java.util.Iterator;
import java.util.NoSuchElementException;

public abstract class ReadOnlyIterator<T> implements Iterator<T> {
    private T next;

    /**
     * Returns the next element, or null when there are no more
     */
    protected abstract T getNextObject();

    @Override
    public final synchronized boolean hasNext() {
        if (next != null) return true;
        next = getNextObject();
        return next != null;
    }

    @Override
    public final synchronized T next() {
        if (hasNext()) {
            T theNext = next;
            next = null;
            return theNext;
        } else
            throw new NoSuchElementException("No more objects");
    }

    @Override
    public final void remove() {
        throw new UnsupportedOperationException("This is a read-only iterator");
    }
}
