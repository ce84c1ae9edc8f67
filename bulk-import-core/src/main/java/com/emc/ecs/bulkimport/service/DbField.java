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
package com.emc.ecs.bulkimport.service;

public final class DbField {
    public static DbField create(String name, Type type, int dimension, boolean nullable) {
        return new DbField(name, type, dimension, nullable);
    }

    private final String name;
    private final Type type;
    private final int dimension;
    private final boolean nullable;

    private DbField(String name, Type type, int dimension, boolean nullable) {
        this.name = name;
        this.type = type;
        this.dimension = dimension;
        this.nullable = nullable;
    }

    public String name() {
        return name;
    }

    public Type type() {
        return type;
    }

    public int dimension() {
        return dimension;
    }

    public boolean nullable() {
        return nullable;
    }

    @Override
    public String toString() {
        return name;
    }

    public enum Type {
        string, intNumber, bigIntNumber, datetime
    }
}
