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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.io.File;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Date;

public class SqliteIndexService extends AbstractIndexService {
    private static final Logger log = LoggerFactory.getLogger(SqliteIndexService.class);

    public static final String JDBC_URL_BASE = "jdbc:sqlite:";

    private File dbFile;
    private final String jdbcUrl;

    public SqliteIndexService(File dbFile) {
        this(JDBC_URL_BASE + dbFile.toString());
        this.dbFile = dbFile;
        if ((!dbFile.exists() && dbFile.getAbsoluteFile().getParentFile() != null
                && !dbFile.getAbsoluteFile().getParentFile().canWrite())
                || (dbFile.exists() && !dbFile.canWrite()))
            throw new IllegalArgumentException("Cannot write to " + dbFile);
    }

    protected SqliteIndexService(String jdbcUrl) {
        this.jdbcUrl = jdbcUrl;
    }

    @Override
    public void deleteDatabase() {
        if (isInitialized()) getJdbcTemplate().update("DROP TABLE IF EXISTS " + getTableName());
        if (dbFile != null && dbFile.exists() && !dbFile.delete())
            log.warn("could not delete database file {}", dbFile);
    }

    @Override
    public synchronized void close() {
        try {
            if (isInitialized()) ((SingleConnectionDataSource) getJdbcTemplate().getDataSource()).destroy();
        } catch (RuntimeException e) {
            log.warn("could not close data source", e);
        }
        super.close();
    }

    @Override
    protected JdbcTemplate createJdbcTemplate() {
        SingleConnectionDataSource ds = new SingleConnectionDataSource();
        ds.setUrl(jdbcUrl);
        ds.setSuppressClose(true);
        return new JdbcTemplate(ds);
    }

    @Override
    protected void createTable() {
        try {
            getJdbcTemplate().update("CREATE TABLE IF NOT EXISTS " + getTableName() + " (" +
                    "file_id VARCHAR(128) PRIMARY KEY NOT NULL," +
                    "source_path VARCHAR(1500) NOT NULL," +
                    "group_name VARCHAR(16) NOT NULL," +
                    "store_path_index INT NOT NULL," +
                    "full_path VARCHAR(1500) NOT NULL," +
                    "size INT NOT NULL," +
                    "crc32 INT," +
                    "create_time INT," +
                    "modify_time INT," +
                    "import_time INT NOT NULL," +
                    "ext_name VARCHAR(8)," +
                    "import_mode VARCHAR(8) NOT NULL" +
                    ")");
            getJdbcTemplate().update("CREATE INDEX IF NOT EXISTS " + getTableName() + "_source_idx ON "
                    + getTableName() + " (source_path)");
        } catch (RuntimeException e) {
            log.error("could not create DB table {}. note: name may only contain alphanumeric or underscore", getTableName());
            throw e;
        }
    }

    @Override
    public Date getResultDate(ResultSet rs, String name) throws SQLException {
        return new Date(rs.getLong(name));
    }

    @Override
    public Object getDateParam(Date date) {
        if (date == null) return null;
        return date.getTime();
    }

    public File getDbFile() {
        return dbFile;
    }
}
