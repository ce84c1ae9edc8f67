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

/**
 * Supplies the distinct inputs that identifier generation is derived from. Every call must return a token that was
 * never returned before by this source.
 */
public interface UniquenessSource {
    Token next();

    class Token {
        private final int timestamp;
        private final long sequence;

        public Token(int timestamp, long sequence) {
            this.timestamp = timestamp;
            this.sequence = sequence;
        }

        /**
         * epoch seconds
         */
        public int getTimestamp() {
            return timestamp;
        }

        public long getSequence() {
            return sequence;
        }

        @Override
        public String toString() {
            return timestamp + "#" + sequence;
        }
    }
}
