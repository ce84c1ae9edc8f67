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

import org.springframework.jdbc.core.RowMapper;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Builds the SQL and parameters for the file index table and maps its rows. The table has the following columns:
 * <table>
 * <tr><td><code>file_id*</code></td></tr>
 * <tr><td><code>source_path</code></td></tr>
 * <tr><td><code>group_name</code></td></tr>
 * <tr><td><code>store_path_index</code></td></tr>
 * <tr><td><code>full_path</code></td></tr>
 * <tr><td><code>size</code></td></tr>
 * <tr><td><code>crc32</code></td></tr>
 * <tr><td><code>create_time</code></td></tr>
 * <tr><td><code>modify_time</code></td></tr>
 * <tr><td><code>import_time</code></td></tr>
 * <tr><td><code>ext_name</code></td></tr>
 * <tr><td><code>import_mode</code></td></tr>
 * </table>
 * * primary key
 */
public class IndexRecordHandler {
    public static final DbField FILE_ID = DbField.create("file_id", DbField.Type.string, 128, false);
    public static final DbField SOURCE_PATH = DbField.create("source_path", DbField.Type.string, 750, false);
    public static final DbField GROUP_NAME = DbField.create("group_name", DbField.Type.string, 16, false);
    public static final DbField STORE_PATH_INDEX = DbField.create("store_path_index", DbField.Type.intNumber, -1, false);
    public static final DbField FULL_PATH = DbField.create("full_path", DbField.Type.string, 1024, false);
    public static final DbField SIZE = DbField.create("size", DbField.Type.bigIntNumber, -1, false);
    public static final DbField CRC32 = DbField.create("crc32", DbField.Type.bigIntNumber, -1, true);
    public static final DbField CREATE_TIME = DbField.create("create_time", DbField.Type.datetime, -1, true);
    public static final DbField MODIFY_TIME = DbField.create("modify_time", DbField.Type.datetime, -1, true);
    public static final DbField IMPORT_TIME = DbField.create("import_time", DbField.Type.datetime, -1, false);
    public static final DbField EXT_NAME = DbField.create("ext_name", DbField.Type.string, 8, true);
    public static final DbField IMPORT_MODE = DbField.create("import_mode", DbField.Type.string, 8, false);

    public static final List<DbField> ALL_FIELDS = Collections.unmodifiableList(Arrays.asList(
            FILE_ID, SOURCE_PATH, GROUP_NAME, STORE_PATH_INDEX, FULL_PATH, SIZE, CRC32, CREATE_TIME, MODIFY_TIME,
            IMPORT_TIME, EXT_NAME, IMPORT_MODE
    ));

    protected final SqlDateMapper dateMapper;

    public IndexRecordHandler(SqlDateMapper dateMapper) {
        this.dateMapper = dateMapper;
    }

    public RowMapper<IndexRecord> mapper() {
        return new Mapper();
    }

    public String selectByFileId(String tableName) {
        return "select " + StringUtils.collectionToCommaDelimitedString(ALL_FIELDS)
                + " from " + tableName + " where " + FILE_ID + " = ?";
    }

    public String countByFileId(String tableName) {
        return "select count(*) from " + tableName + " where " + FILE_ID + " = ?";
    }

    /**
     * most recent import first
     */
    public String selectBySourcePath(String tableName) {
        return "select " + StringUtils.collectionToCommaDelimitedString(ALL_FIELDS)
                + " from " + tableName + " where " + SOURCE_PATH + " = ? order by " + IMPORT_TIME + " desc";
    }

    public String selectAll(String tableName) {
        return "select " + StringUtils.collectionToCommaDelimitedString(ALL_FIELDS)
                + " from " + tableName + " order by " + IMPORT_TIME;
    }

    public DbParams insertParams(IndexRecord record) {
        DbParams params = DbParams.create();
        params.addDataParam(FILE_ID, record.getFileId());
        params.addDataParam(SOURCE_PATH, record.getSourcePath());
        params.addDataParam(GROUP_NAME, record.getGroupName());
        params.addDataParam(STORE_PATH_INDEX, record.getStorePathIndex());
        params.addDataParam(FULL_PATH, record.getFullPath());
        params.addDataParam(SIZE, record.getSize());
        params.addDataParam(CRC32, record.getCrc32());
        params.addDataParam(CREATE_TIME, dateMapper.getDateParam(record.getCreateTime()));
        params.addDataParam(MODIFY_TIME, dateMapper.getDateParam(record.getModifyTime()));
        params.addDataParam(IMPORT_TIME, dateMapper.getDateParam(record.getImportTime()));
        params.addDataParam(EXT_NAME, record.getExtName());
        params.addDataParam(IMPORT_MODE, record.getImportMode());
        return params;
    }

    public static String insert(String tableName, DbParams params) {
        List<DbField> insertFields = params.toDataFieldList();
        StringBuilder insert = new StringBuilder("insert into " + tableName + " (");
        insert.append(StringUtils.collectionToCommaDelimitedString(insertFields));
        insert.append(") values (");
        for (int i = 0; i < insertFields.size(); i++) {
            insert.append("?");
            if (i < insertFields.size() - 1) insert.append(", ");
        }
        insert.append(")");
        return insert.toString();
    }

    protected boolean hasColumn(ResultSet rs, String name) {
        try {
            rs.findColumn(name);
            return true;
        } catch (SQLException e) {
            return false;
        }
    }

    protected boolean hasLongColumn(ResultSet rs, String name) throws SQLException {
        if (hasColumn(rs, name)) {
            rs.getLong(name);
            return !rs.wasNull();
        }
        return false;
    }

    protected boolean hasDateColumn(ResultSet rs, String name) throws SQLException {
        if (hasColumn(rs, name)) {
            rs.getObject(name);
            return !rs.wasNull();
        }
        return false;
    }

    private class Mapper implements RowMapper<IndexRecord> {
        @Override
        public IndexRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            IndexRecord record = new IndexRecord();
            record.setFileId(rs.getString(FILE_ID.name()));
            record.setSourcePath(rs.getString(SOURCE_PATH.name()));
            record.setGroupName(rs.getString(GROUP_NAME.name()));
            record.setStorePathIndex(rs.getInt(STORE_PATH_INDEX.name()));
            record.setFullPath(rs.getString(FULL_PATH.name()));
            record.setSize(rs.getLong(SIZE.name()));
            if (hasLongColumn(rs, CRC32.name())) record.setCrc32(rs.getLong(CRC32.name()));
            if (hasDateColumn(rs, CREATE_TIME.name()))
                record.setCreateTime(dateMapper.getResultDate(rs, CREATE_TIME.name()));
            if (hasDateColumn(rs, MODIFY_TIME.name()))
                record.setModifyTime(dateMapper.getResultDate(rs, MODIFY_TIME.name()));
            if (hasDateColumn(rs, IMPORT_TIME.name()))
                record.setImportTime(dateMapper.getResultDate(rs, IMPORT_TIME.name()));
            record.setExtName(rs.getString(EXT_NAME.name()));
            record.setImportMode(rs.getString(IMPORT_MODE.name()));
            return record;
        }
    }
}
