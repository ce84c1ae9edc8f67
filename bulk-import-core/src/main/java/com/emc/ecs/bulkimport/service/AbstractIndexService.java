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
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Note: Each index service instance holds a connection (or a pool of them), so it's vital to close every instance to
 *       free up these connections. This class will log a warning if >50 instances are created, which probably
 *       indicates a resource leak.
 */
public abstract class AbstractIndexService implements IndexService, SqlDateMapper {
    private static final Logger log = LoggerFactory.getLogger(AbstractIndexService.class);
    private static final AtomicInteger instanceCount = new AtomicInteger();
    private static final int INSTANCE_COUNT_WARNING_LIMIT = 50;

    public static final String DEFAULT_TABLE_NAME = "file_index";

    protected String tableName = DEFAULT_TABLE_NAME;
    private JdbcTemplate jdbcTemplate;
    private volatile boolean initialized = false;
    private volatile boolean closed = false;
    private final Set<String> locks = new HashSet<>();
    private final IndexRecordHandler recordHandler = new IndexRecordHandler(this);

    protected abstract JdbcTemplate createJdbcTemplate();

    protected abstract void createTable();

    public AbstractIndexService() {
        int currentInstanceCount = instanceCount.incrementAndGet();
        if (currentInstanceCount > INSTANCE_COUNT_WARNING_LIMIT) {
            log.warn("{} index service instances detected - there may be a resource leak!", currentInstanceCount);
        } else {
            log.debug("new index service instance created - {} total instances active", currentInstanceCount);
        }
    }

    @Override
    public void init() {
        initCheck();
    }

    @Override
    public void lock(String key) {
        synchronized (locks) {
            while (locks.contains(key)) {
                try {
                    locks.wait();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("interrupted while waiting for lock", e);
                }
            }
            locks.add(key);
        }
    }

    @Override
    public void unlock(String key) {
        synchronized (locks) {
            locks.remove(key);
            locks.notifyAll();
        }
    }

    @Override
    public boolean exists(String fileId) {
        initCheck();
        try {
            Long count = getJdbcTemplate().queryForObject(recordHandler.countByFileId(tableName), Long.class, fileId);
            return count != null && count > 0;
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("could not query file ID " + fileId, e);
        }
    }

    @Override
    public boolean insertIfAbsent(IndexRecord record) {
        initCheck();
        lock(record.getFileId());
        try {
            if (exists(record.getFileId())) {
                log.debug("file ID {} is already registered", record.getFileId());
                return false;
            }
            DbParams params = recordHandler.insertParams(record);
            getJdbcTemplate().update(IndexRecordHandler.insert(tableName, params), params.toParamValueArray());
            return true;
        } catch (DuplicateKeyException e) {
            // another process registered the same ID between our check and insert
            log.info("file ID {} was registered concurrently", record.getFileId());
            return false;
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("could not register file ID " + record.getFileId(), e);
        } finally {
            unlock(record.getFileId());
        }
    }

    @Override
    public IndexRecord getByFileId(String fileId) {
        initCheck();
        try {
            List<IndexRecord> records = getJdbcTemplate().query(recordHandler.selectByFileId(tableName),
                    recordHandler.mapper(), fileId);
            return records.isEmpty() ? null : records.get(0);
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("could not query file ID " + fileId, e);
        }
    }

    @Override
    public IndexRecord getBySourcePath(String sourcePath) {
        initCheck();
        try {
            List<IndexRecord> records = getJdbcTemplate().query(recordHandler.selectBySourcePath(tableName),
                    recordHandler.mapper(), sourcePath);
            return records.isEmpty() ? null : records.get(0);
        } catch (DataAccessException e) {
            throw new IndexUnavailableException("could not query source path " + sourcePath, e);
        }
    }

    @Override
    public Iterable<IndexRecord> getAllRecords() {
        initCheck();
        return () -> new RowIterator<>(
                getJdbcTemplate().getDataSource(),
                recordHandler.mapper(),
                recordHandler.selectAll(tableName));
    }

    protected void initCheck() {
        if (!initialized) {
            synchronized (this) {
                if (closed) throw new UnsupportedOperationException("this service has been closed");
                if (!initialized) {
                    try {
                        jdbcTemplate = createJdbcTemplate();
                        createTable();
                    } catch (DataAccessException e) {
                        throw new IndexUnavailableException("could not open the file index", e);
                    }
                    initialized = true;
                }
            }
        }
    }

    /**
     * Be sure to override in implementations to close the datasource completely, then call super.close(). This method
     * should be idempotent! (it might get called twice)
     */
    @Override
    public synchronized void close() {
        if (!closed) instanceCount.decrementAndGet();
        closed = true;
        jdbcTemplate = null;
        initialized = false;
    }

    protected JdbcTemplate getJdbcTemplate() {
        if (jdbcTemplate == null)
            throw new UnsupportedOperationException("this service is not initialized or has been closed");
        return jdbcTemplate;
    }

    protected boolean isInitialized() {
        return initialized;
    }

    public Date getResultDate(ResultSet rs, String name) throws SQLException {
        return rs.getTimestamp(name);
    }

    public Object getDateParam(Date date) {
        return date;
    }

    @Override
    public String getTableName() {
        return tableName;
    }

    @Override
    public void setTableName(String tableName) {
        this.tableName = tableName;
    }
}
