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

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * In-memory SQLite index with its JDBC template exposed for assertions.
 */
public class InMemoryIndexService extends SqliteIndexService {
    public static final String IN_MEMORY_JDBC_URL = "jdbc:sqlite::memory:";

    public InMemoryIndexService() {
        super(IN_MEMORY_JDBC_URL);
    }

    @Override
    public JdbcTemplate getJdbcTemplate() {
        return super.getJdbcTemplate();
    }
}
