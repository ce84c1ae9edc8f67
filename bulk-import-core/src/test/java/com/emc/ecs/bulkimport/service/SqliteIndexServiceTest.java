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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.support.rowset.SqlRowSet;

import java.io.File;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class SqliteIndexServiceTest {
    protected AbstractIndexService indexService;

    @BeforeEach
    public void setup() throws Exception {
        indexService = new InMemoryIndexService();
    }

    @AfterEach
    public void teardown() throws Exception {
        if (indexService != null) indexService.close();
    }

    @Test
    public void testRowInsert() throws Exception {
        Calendar cal = Calendar.getInstance();
        cal.set(Calendar.MILLISECOND, 0); // truncate ms since MySQL doesn't store it
        Date now = cal.getTime();

        String id = "group1/M00/0A/1F/wKgBAFmJ1K2AAAAAAAAQAAAACAA1234567.txt";
        IndexRecord record = createRecord(id, "/data/in/a.txt", now);
        Assertions.assertTrue(indexService.insertIfAbsent(record));

        SqlRowSet rowSet = getRowSet(id);
        Assertions.assertEquals(id, rowSet.getString("file_id"));
        Assertions.assertEquals("/data/in/a.txt", rowSet.getString("source_path"));
        Assertions.assertEquals("group1", rowSet.getString("group_name"));
        Assertions.assertEquals(0, rowSet.getInt("store_path_index"));
        Assertions.assertEquals("/store0/data/0A/1F/wKgBAFmJ1K2AAAAAAAAQAAAACAA1234567.txt", rowSet.getString("full_path"));
        Assertions.assertEquals(12, rowSet.getLong("size"));
        Assertions.assertEquals(0x1c291ca3L, rowSet.getLong("crc32"));
        Assertions.assertEquals(now.getTime(), getUnixTime(rowSet, "modify_time"));
        Assertions.assertNotEquals(0, getUnixTime(rowSet, "import_time"));
        Assertions.assertEquals("txt", rowSet.getString("ext_name"));
        Assertions.assertEquals("copy", rowSet.getString("import_mode"));

        // nullable columns
        id = "group1/M00/0A/1F/wKgBAFmJ1K2AAAAAAAAQAAAACAA7654321";
        record = createRecord(id, "/data/in/b", null);
        record.setCrc32(null);
        record.setExtName(null);
        Assertions.assertTrue(indexService.insertIfAbsent(record));
        rowSet = getRowSet(id);
        Assertions.assertEquals(0, rowSet.getLong("crc32"));
        Assertions.assertTrue(rowSet.wasNull());
        Assertions.assertNull(rowSet.getString("ext_name"));
        Assertions.assertEquals(0, getUnixTime(rowSet, "modify_time"));
    }

    @Test
    public void testInsertIfAbsent() throws Exception {
        String id = "group1/M00/00/01/wKgBAFmJ1K2AAAAAAAAQAAAACAA0000000";
        Assertions.assertFalse(indexService.exists(id));
        Assertions.assertNull(indexService.getByFileId(id));

        Assertions.assertTrue(indexService.insertIfAbsent(createRecord(id, "/data/in/a", new Date())));
        Assertions.assertTrue(indexService.exists(id));

        // second insert with the same file ID must not overwrite the first
        Assertions.assertFalse(indexService.insertIfAbsent(createRecord(id, "/data/in/other", new Date())));
        Assertions.assertEquals("/data/in/a", indexService.getByFileId(id).getSourcePath());
        Assertions.assertEquals(1, count());
    }

    @Test
    public void testGetRecord() throws Exception {
        Calendar cal = Calendar.getInstance();
        cal.set(Calendar.MILLISECOND, 0);
        Date mtime = cal.getTime();
        String id = "group2/M01/FF/00/wKgBAFmJ1K2AAAAAAAAQAAAACAA9999.jpeg";
        IndexRecord record = createRecord(id, "/data/in/photo.jpeg", mtime);
        record.setGroupName("group2");
        record.setStorePathIndex(1);
        record.setExtName("jpeg");
        record.setImportMode("move");
        indexService.insertIfAbsent(record);

        IndexRecord read = indexService.getByFileId(id);
        Assertions.assertNotNull(read);
        Assertions.assertEquals(id, read.getFileId());
        Assertions.assertEquals("/data/in/photo.jpeg", read.getSourcePath());
        Assertions.assertEquals("group2", read.getGroupName());
        Assertions.assertEquals(1, read.getStorePathIndex());
        Assertions.assertEquals(12, read.getSize());
        Assertions.assertEquals(Long.valueOf(0x1c291ca3L), read.getCrc32());
        Assertions.assertEquals(mtime, read.getModifyTime());
        Assertions.assertEquals("jpeg", read.getExtName());
        Assertions.assertEquals("move", read.getImportMode());
    }

    @Test
    public void testGetBySourcePath() throws Exception {
        Assertions.assertNull(indexService.getBySourcePath("/data/in/a"));

        Calendar cal = Calendar.getInstance();
        cal.set(Calendar.MILLISECOND, 0);
        IndexRecord first = createRecord("group1/M00/00/01/first", "/data/in/a", cal.getTime());
        first.setImportTime(new Date(cal.getTimeInMillis() - 60000));
        IndexRecord second = createRecord("group1/M00/00/02/second", "/data/in/a", cal.getTime());
        second.setImportTime(cal.getTime());
        indexService.insertIfAbsent(first);
        indexService.insertIfAbsent(second);
        indexService.insertIfAbsent(createRecord("group1/M00/00/03/third", "/data/in/b", cal.getTime()));

        // most recent import wins
        Assertions.assertEquals("group1/M00/00/02/second", indexService.getBySourcePath("/data/in/a").getFileId());
        Assertions.assertEquals("group1/M00/00/03/third", indexService.getBySourcePath("/data/in/b").getFileId());
    }

    @Test
    public void testGetAllRecords() throws Exception {
        int total = 50;
        for (int i = 0; i < total; i++) {
            indexService.insertIfAbsent(createRecord("group1/M00/00/00/file" + i, "/data/in/" + i, new Date()));
        }
        int found = 0;
        for (IndexRecord record : indexService.getAllRecords()) {
            Assertions.assertTrue(record.getFileId().startsWith("group1/M00/00/00/file"));
            found++;
        }
        Assertions.assertEquals(total, found);
    }

    @Test
    public void testConcurrentInsert() throws Exception {
        String id = "group1/M00/00/01/contended";
        AtomicInteger inserted = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                final int n = i;
                futures.add(executor.submit(() -> {
                    if (indexService.insertIfAbsent(createRecord(id, "/data/in/" + n, new Date())))
                        inserted.incrementAndGet();
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        Assertions.assertEquals(1, inserted.get());
        Assertions.assertEquals(1, count());
    }

    @Test
    public void testCustomTableName() throws Exception {
        indexService.setTableName("import_test_index");
        indexService.insertIfAbsent(createRecord("group1/M00/00/01/custom", "/data/in/a", new Date()));
        Assertions.assertEquals(1, count());
        Assertions.assertEquals("import_test_index", indexService.getTableName());
    }

    @Test
    public void testLock() throws Exception {
        String key = "/data/in/a";
        indexService.lock(key);
        AtomicInteger acquired = new AtomicInteger();
        Thread thread = new Thread(() -> {
            indexService.lock(key);
            acquired.incrementAndGet();
            indexService.unlock(key);
        });
        thread.start();
        Thread.sleep(200);
        Assertions.assertEquals(0, acquired.get());
        indexService.unlock(key);
        thread.join(5000);
        Assertions.assertEquals(1, acquired.get());
    }

    @Test
    public void testClosed() throws Exception {
        indexService.close();
        Assertions.assertThrows(UnsupportedOperationException.class, () -> indexService.exists("group1/M00/00/01/x"));
    }

    @Test
    public void testDbFile() throws Exception {
        File dbFile = Files.createTempFile("bulk-import-index", ".db").toFile();
        SqliteIndexService fileIndex = new SqliteIndexService(dbFile);
        try {
            fileIndex.insertIfAbsent(createRecord("group1/M00/00/01/persisted", "/data/in/a", new Date()));
        } finally {
            fileIndex.close();
        }

        // the index survives a new instance
        fileIndex = new SqliteIndexService(dbFile);
        try {
            Assertions.assertTrue(fileIndex.exists("group1/M00/00/01/persisted"));
            fileIndex.deleteDatabase();
            Assertions.assertFalse(dbFile.exists());
        } finally {
            fileIndex.close();
            Files.deleteIfExists(dbFile.toPath());
        }
    }

    IndexRecord createRecord(String fileId, String sourcePath, Date mtime) {
        IndexRecord record = new IndexRecord();
        record.setFileId(fileId);
        record.setSourcePath(sourcePath);
        record.setGroupName("group1");
        record.setStorePathIndex(0);
        record.setFullPath("/store0/data/0A/1F/wKgBAFmJ1K2AAAAAAAAQAAAACAA1234567.txt");
        record.setSize(12);
        record.setCrc32(0x1c291ca3L);
        record.setCreateTime(mtime);
        record.setModifyTime(mtime);
        record.setImportTime(new Date());
        record.setExtName("txt");
        record.setImportMode("copy");
        return record;
    }

    long count() {
        Long count = getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM " + indexService.getTableName(), Long.class);
        return count == null ? 0 : count;
    }

    protected long getUnixTime(SqlRowSet rowSet, String field) {
        return rowSet.getLong(field);
    }

    JdbcTemplate getJdbcTemplate() {
        return indexService.getJdbcTemplate();
    }

    SqlRowSet getRowSet(String id) {
        SqlRowSet rowSet = getJdbcTemplate().queryForRowSet("SELECT * FROM " + indexService.getTableName() + " WHERE file_id=?", id);
        rowSet.next();
        return rowSet;
    }
}
