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

import com.emc.ecs.bulkimport.test.TestConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.support.rowset.SqlRowSet;

import java.sql.Timestamp;

public class MySQLIndexServiceTest extends SqliteIndexServiceTest {
    @BeforeEach
    public void setup() throws Exception {
        String mysqlConnectString = TestConfig.getProperties().getProperty(TestConfig.PROP_MYSQL_CONNECT_STRING);
        String mysqlEncPassword = TestConfig.getProperties().getProperty(TestConfig.PROP_MYSQL_ENC_PASSWORD);
        Assumptions.assumeTrue(mysqlConnectString != null);
        indexService = new MySQLIndexService(mysqlConnectString, null, null, mysqlEncPassword);
    }

    @AfterEach
    public void teardown() throws Exception {
        if (indexService != null) {
            indexService.deleteDatabase();
            indexService.close();
        }
    }

    @Test
    @Override
    public void testDbFile() throws Exception {
        Assumptions.assumeTrue(false, "no database file for MySQL");
    }

    @Test
    public void testPasswordEncryption() throws Exception {
        String encrypted = MySQLIndexService.encryptPassword("s3cret!");
        Assertions.assertNotEquals("s3cret!", encrypted);
        Assertions.assertEquals("s3cret!", MySQLIndexService.decryptPassword(encrypted));
    }

    @Override
    protected long getUnixTime(SqlRowSet rowSet, String field) {
        Timestamp timestamp = rowSet.getTimestamp(field);
        if (timestamp == null) return 0;
        else return timestamp.getTime();
    }
}
