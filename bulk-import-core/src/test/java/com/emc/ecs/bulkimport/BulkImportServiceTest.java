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
package com.emc.ecs.bulkimport;

import com.emc.ecs.bulkimport.config.ConfigurationException;
import com.emc.ecs.bulkimport.config.ImportMode;
import com.emc.ecs.bulkimport.config.ImportOptions;
import com.emc.ecs.bulkimport.config.StorageConfig;
import com.emc.ecs.bulkimport.model.FileMetadata;
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import com.emc.ecs.bulkimport.service.InMemoryIndexService;
import com.emc.ecs.bulkimport.service.IndexRecord;
import com.emc.ecs.bulkimport.stage.SpaceChecker;
import com.emc.ecs.bulkimport.storage.StorePaths;
import com.emc.ecs.bulkimport.test.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class BulkImportServiceTest {
    private Path storeDir;
    private StorageConfig storage;
    private BulkImportService service;

    @BeforeEach
    public void setup() throws Exception {
        storeDir = Files.createTempDirectory("bulk-import-service-test");
        storage = new StorageConfig().withGroupName("group1")
                .withStorePaths(storeDir.resolve("store0").toString(), storeDir.resolve("store1").toString());
        service = new BulkImportService(new ImportOptions().withSpaceSafetyMargin(0), storage);
        service.setIndexService(new InMemoryIndexService());
    }

    @AfterEach
    public void teardown() throws Exception {
        if (service.isInitialized()) service.destroy();
        TestFiles.recursiveDelete(storeDir);
    }

    @Test
    public void testLifecycle() {
        Assertions.assertFalse(service.isInitialized());
        Assertions.assertThrows(IllegalStateException.class, () -> service.validatePath("/x"));

        service.init();
        Assertions.assertTrue(service.isInitialized());
        Assertions.assertThrows(IllegalStateException.class, service::init);
        // collaborators are fixed once initialized
        Assertions.assertThrows(IllegalStateException.class, () -> service.setIndexService(new InMemoryIndexService()));

        service.destroy();
        Assertions.assertFalse(service.isInitialized());
        Assertions.assertThrows(IllegalStateException.class, service::destroy);
        Assertions.assertThrows(IllegalStateException.class, service::init);
        Assertions.assertThrows(IllegalStateException.class, () -> service.resolveStoragePath(0, "group1/M00/00/00/x"));
    }

    @Test
    public void testInvalidOptions() {
        BulkImportService badThreads = new BulkImportService(new ImportOptions().withThreadCount(0), storage);
        badThreads.setIndexService(new InMemoryIndexService());
        Assertions.assertThrows(ConfigurationException.class, badThreads::init);

        BulkImportService tooManyThreads = new BulkImportService(
                new ImportOptions().withThreadCount(ImportOptions.MAX_THREAD_COUNT + 1), storage);
        tooManyThreads.setIndexService(new InMemoryIndexService());
        Assertions.assertThrows(ConfigurationException.class, tooManyThreads::init);

        // no index configured
        Assertions.assertThrows(ConfigurationException.class,
                () -> new BulkImportService(new ImportOptions(), storage).init());
    }

    @Test
    public void testResolveStoragePath() {
        service.init();
        Assertions.assertEquals(storeDir.resolve("store1/data/0A/1F/abc.txt"),
                service.resolveStoragePath(1, "group1/M01/0A/1F/abc.txt"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> service.resolveStoragePath(0, "group1/M01/0A/1F/abc.txt"));
        // pure derivation, nothing is created
        Assertions.assertFalse(Files.exists(storeDir.resolve("store1")));
    }

    @Test
    public void testStageOperations() throws Exception {
        service.setSpaceChecker(new SpaceChecker(new StorePaths(storage), 0) {
            @Override
            protected long getUsableSpace(Path storePath) {
                return 1000;
            }
        });
        service.init();

        Path source = TestFiles.createFile(storeDir.resolve("in/a.txt"), 64);
        StageResult<Path> validated = service.validatePath(source.toString());
        Assertions.assertTrue(validated.isOk());
        StageResult<FileMetadata> extracted = service.extractMetadata(validated.getValue(), true);
        Assertions.assertEquals(64, extracted.getValue().getSize());
        StageResult<String> generated = service.generateIdentifier(extracted.getValue(), "group1", 1);
        Assertions.assertTrue(generated.getValue().startsWith("group1/M01/"));

        Assertions.assertTrue(service.checkSpace(1, 1000));
        Assertions.assertFalse(service.checkSpace(1, 1001));
        Assertions.assertFalse(service.checkSpace(2, 1));
    }

    @Test
    public void testRegisterFile() throws Exception {
        service.init();
        try (ImportContext context = new ImportContext("group1", 0, ImportMode.copy, true, false, 1, true)) {
            FileRecord record = new FileRecord(1, "/external/a.jpg");
            Assertions.assertThrows(IllegalStateException.class, () -> service.registerFile(context, record));

            record.startProcessing();
            record.applyMetadata(new FileMetadata(2048, 1500000000000L, 1500000000000L, 99L, "jpg"));
            StageResult<String> result = service.registerFile(context, record);
            Assertions.assertTrue(result.isOk(), result.toString());
            Assertions.assertEquals(result.getValue(), record.getIdentifier());
            Assertions.assertEquals(service.resolveStoragePath(0, result.getValue()).toString(), record.getFinalPath());

            IndexRecord indexRecord = service.getIndexService().getByFileId(result.getValue());
            Assertions.assertNotNull(indexRecord);
            Assertions.assertEquals("/external/a.jpg", indexRecord.getSourcePath());
            Assertions.assertEquals(2048, indexRecord.getSize());
        }
    }

    @Test
    public void testRegisterFileDryRun() throws Exception {
        service.init();
        try (ImportContext context = new ImportContext("group1", 0, ImportMode.copy, true, true, 1, true)) {
            FileRecord record = new FileRecord(1, "/external/a.jpg");
            record.startProcessing();
            record.applyMetadata(new FileMetadata(2048, 0, 0, null, "jpg"));
            StageResult<String> result = service.registerFile(context, record);
            Assertions.assertTrue(result.isOk());
            Assertions.assertNull(service.getIndexService().getByFileId(result.getValue()));
        }
    }

    @Test
    public void testRegisterFileInvalidTarget() throws Exception {
        service.init();
        try (ImportContext context = new ImportContext("group1", 5, ImportMode.copy, true, false, 1, true)) {
            FileRecord record = new FileRecord(1, "/external/a.jpg");
            record.startProcessing();
            record.applyMetadata(new FileMetadata(2048, 0, 0, null, "jpg"));
            StageResult<String> result = service.registerFile(context, record);
            Assertions.assertEquals(ImportError.INVALID_PATH, result.getError());
            Assertions.assertNull(record.getIdentifier());
        }
    }

    @Test
    public void testIndexTable() {
        BulkImportService custom = new BulkImportService(new ImportOptions().withIndexTable("custom_index"), storage);
        custom.setIndexService(new InMemoryIndexService());
        custom.init();
        try {
            Assertions.assertEquals("custom_index", custom.getIndexService().getTableName());
        } finally {
            custom.destroy();
        }
        Assertions.assertEquals(Paths.get(storage.getStorePaths()[0]), new StorePaths(storage).getStorePath(0));
    }
}
