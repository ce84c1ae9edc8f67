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

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Date;

/**
 * Each index engine stores dates its own way (epoch millis in SQLite, DATETIME in MySQL).
 */
public interface SqlDateMapper {
    Date getResultDate(ResultSet rs, String name) throws SQLException;

    Object getDateParam(Date date);
}
