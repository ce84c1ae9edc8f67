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
package com.emc.ecs.bulkimport.stage;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic tokens: a fixed timestamp and a sequence that advances by <code>step</code> (0 repeats the same
 * token forever).
 */
public class FixedUniquenessSource implements UniquenessSource {
    private final int timestamp;
    private final AtomicLong sequence;
    private final long step;

    public FixedUniquenessSource(int timestamp, long firstSequence, long step) {
        this.timestamp = timestamp;
        this.sequence = new AtomicLong(firstSequence);
        this.step = step;
    }

    @Override
    public Token next() {
        return new Token(timestamp, sequence.getAndAdd(step));
    }
}
