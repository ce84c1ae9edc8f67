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

import com.emc.ecs.bulkimport.model.FileMetadata;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import com.emc.ecs.bulkimport.service.InMemoryIndexService;
import com.emc.ecs.bulkimport.service.IndexRecord;
import com.emc.ecs.bulkimport.service.IndexUnavailableException;
import com.emc.ecs.bulkimport.storage.FileIdentifier;
import com.emc.ecs.bulkimport.storage.StorePaths;
import com.emc.ecs.bulkimport.test.TestFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Date;
import java.util.HashSet;
import java.util.Set;

public class IdentifierGeneratorTest {
    private static final int TIMESTAMP = 1500000000;

    private Path storeDir;
    private StorePaths storePaths;
    private InMemoryIndexService indexService;

    @BeforeEach
    public void setup() throws Exception {
        storeDir = Files.createTempDirectory("bulk-import-generator-test");
        storePaths = new StorePaths(Arrays.asList(storeDir.resolve("store0"), storeDir.resolve("store1")), 256);
        indexService = new InMemoryIndexService();
    }

    @AfterEach
    public void teardown() throws Exception {
        if (indexService != null) indexService.close();
        TestFiles.recursiveDelete(storeDir);
    }

    @Test
    public void testDerive() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService, 0);
        FileMetadata metadata = new FileMetadata(12, 0, 0, 0x1c291ca3L, "txt");

        FileIdentifier fileId = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 1));
        Assertions.assertEquals("group1/M00/D4/8D/AAAAAFloLwCAAAABAAAADBwpHKM969.txt", fileId.toString());

        // no extension: 7 padding digits
        metadata = new FileMetadata(12, 0, 0, 0x1c291ca3L, "");
        fileId = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 1));
        Assertions.assertEquals("group1/M00/D4/8D/AAAAAFloLwCAAAABAAAADBwpHKM9691286", fileId.toString());

        // sizes of 4GiB and up keep the marker bit clear and carry the sequence above bit 40
        generator = new IdentifierGenerator(storePaths, indexService, 7);
        metadata = new FileMetadata(5L * 1024 * 1024 * 1024, 0, 0, null, "jpeg");
        fileId = generator.derive(metadata, "group2", 1, new UniquenessSource.Token(TIMESTAMP, 42));
        Assertions.assertEquals("group2/M01/1D/F1/AAAAB1loLwAAACoBQAAAAAAAAAA41.jpeg", fileId.toString());
    }

    @Test
    public void testDeriveLargeFile() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService, 0);
        // 6-char extension leaves no padding digits, so only the size field can tell these apart
        FileMetadata metadata = new FileMetadata(5L * 1024 * 1024 * 1024, 0, 0, null, "backup");

        FileIdentifier first = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 1));
        FileIdentifier second = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 2));
        Assertions.assertEquals("group1/M00/CD/21/AAAAAFloLwAAAAEBQAAAAAAAAAA.backup", first.toString());
        Assertions.assertEquals("group1/M00/CD/21/AAAAAFloLwAAAAIBQAAAAAAAAAA.backup", second.toString());

        Assertions.assertThrows(IllegalArgumentException.class, () -> generator.derive(
                new FileMetadata(IdentifierGenerator.MAX_ENCODABLE_SIZE + 1, 0, 0, null, "backup"),
                "group1", 0, new UniquenessSource.Token(TIMESTAMP, 1)));
    }

    @Test
    public void testGenerateLargeFilesSameSecond() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService,
                new FixedUniquenessSource(TIMESTAMP, 1, 1), 0, 0);
        FileMetadata metadata = new FileMetadata(5L * 1024 * 1024 * 1024, 0, 0, null, "backup");
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            StageResult<String> result = generator.generate(metadata, "group1", 0);
            Assertions.assertTrue(result.isOk(), result.toString());
            Assertions.assertTrue(ids.add(result.getValue()), "duplicate ID " + result.getValue());
        }
    }

    @Test
    public void testGenerateTooLarge() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService, 0);
        FileMetadata metadata = new FileMetadata(IdentifierGenerator.MAX_ENCODABLE_SIZE + 1, 0, 0, null, "bin");
        StageResult<String> result = generator.generate(metadata, "group1", 0);
        Assertions.assertFalse(result.isOk());
        Assertions.assertEquals(ImportError.FILE_TOO_LARGE, result.getError());

        metadata = new FileMetadata(IdentifierGenerator.MAX_ENCODABLE_SIZE, 0, 0, null, "bin");
        Assertions.assertTrue(generator.generate(metadata, "group1", 0).isOk());
    }

    @Test
    public void testDeriveSubdirCount() {
        StorePaths smallShards = new StorePaths(Arrays.asList(storeDir.resolve("store0")), 16);
        IdentifierGenerator generator = new IdentifierGenerator(smallShards, indexService, 0);
        FileMetadata metadata = new FileMetadata(12, 0, 0, 0x1c291ca3L, "txt");
        FileIdentifier fileId = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 1));
        Assertions.assertEquals("group1/M00/04/0D/AAAAAFloLwCAAAABAAAADBwpHKM969.txt", fileId.toString());
    }

    @Test
    public void testNameShape() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService, 0);
        String[] extensions = {"", "a", "jpg", "jpeg", "abcdef"};
        for (String ext : extensions) {
            FileMetadata metadata = new FileMetadata(100, 0, 0, 1L, ext);
            String name = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 5)).getFileName();
            Assertions.assertEquals(IdentifierGenerator.ENCODED_LENGTH + IdentifierGenerator.NAME_SUFFIX_LENGTH,
                    name.length(), name);
            if (ext.isEmpty()) Assertions.assertFalse(name.contains("."));
            else Assertions.assertTrue(name.endsWith("." + ext));
        }
    }

    @Test
    public void testGenerateUnique() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService, 0);
        // identical facts for every file; only the token differs
        FileMetadata metadata = new FileMetadata(1024, 1000, 1000, 12345L, "dat");
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 2000; i++) {
            StageResult<String> result = generator.generate(metadata, "group1", 0);
            Assertions.assertTrue(result.isOk(), result.toString());
            Assertions.assertTrue(ids.add(result.getValue()), "duplicate ID " + result.getValue());
            FileIdentifier.parse(result.getValue());
        }
    }

    @Test
    public void testIndexCollisionRetry() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService,
                new FixedUniquenessSource(TIMESTAMP, 1, 1), 0, 3);
        FileMetadata metadata = new FileMetadata(12, 0, 0, 0x1c291ca3L, "txt");
        String taken = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 1)).toString();
        register(taken);

        StageResult<String> result = generator.generate(metadata, "group1", 0);
        Assertions.assertTrue(result.isOk(), result.toString());
        Assertions.assertNotEquals(taken, result.getValue());
        Assertions.assertEquals(generator.derive(metadata, "group1", 0,
                new UniquenessSource.Token(TIMESTAMP, 2)).toString(), result.getValue());
    }

    @Test
    public void testDiskCollisionRetry() throws Exception {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService,
                new FixedUniquenessSource(TIMESTAMP, 1, 1), 0, 3);
        FileMetadata metadata = new FileMetadata(12, 0, 0, 0x1c291ca3L, "txt");
        FileIdentifier taken = generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 1));
        // a file that exists on disk but is not indexed still blocks the ID
        TestFiles.createFile(storePaths.resolveStoragePath(taken), 1);

        StageResult<String> result = generator.generate(metadata, "group1", 0);
        Assertions.assertTrue(result.isOk(), result.toString());
        Assertions.assertNotEquals(taken.toString(), result.getValue());
    }

    @Test
    public void testCollisionExhausted() {
        int retries = 4;
        // the same token every time
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService,
                new FixedUniquenessSource(TIMESTAMP, 9, 0), 0, retries);
        FileMetadata metadata = new FileMetadata(12, 0, 0, 0x1c291ca3L, "txt");
        register(generator.derive(metadata, "group1", 0, new UniquenessSource.Token(TIMESTAMP, 9)).toString());

        StageResult<String> result = generator.generate(metadata, "group1", 0);
        Assertions.assertFalse(result.isOk());
        Assertions.assertEquals(ImportError.ID_COLLISION, result.getError());
        Assertions.assertTrue(result.getMessage().contains(String.valueOf(retries + 1)), result.getMessage());
    }

    @Test
    public void testInvalidTarget() {
        IdentifierGenerator generator = new IdentifierGenerator(storePaths, indexService, 0);
        FileMetadata metadata = new FileMetadata(12, 0, 0, null, "");
        Assertions.assertEquals(ImportError.INVALID_PATH, generator.generate(metadata, "bad group", 0).getError());
        Assertions.assertEquals(ImportError.INVALID_PATH, generator.generate(metadata, "group1", 2).getError());
    }

    @Test
    public void testIndexUnavailable() {
        InMemoryIndexService brokenIndex = new InMemoryIndexService() {
            @Override
            public boolean exists(String fileId) {
                throw new IndexUnavailableException("connection refused", new RuntimeException());
            }
        };
        try {
            IdentifierGenerator generator = new IdentifierGenerator(storePaths, brokenIndex, 0);
            StageResult<String> result = generator.generate(new FileMetadata(12, 0, 0, null, ""), "group1", 0);
            Assertions.assertEquals(ImportError.INDEX_UPDATE, result.getError());
        } finally {
            brokenIndex.close();
        }
    }

    @Test
    public void testPjwHash() {
        Assertions.assertEquals(0, IdentifierGenerator.pjwHash(new byte[0]));
        Assertions.assertEquals('a', IdentifierGenerator.pjwHash(new byte[]{'a'}));
        Assertions.assertEquals(('a' << 4) + 'b', IdentifierGenerator.pjwHash(new byte[]{'a', 'b'}));
    }

    private void register(String fileId) {
        IndexRecord record = new IndexRecord();
        record.setFileId(fileId);
        record.setSourcePath("/data/in/other");
        record.setGroupName("group1");
        record.setFullPath("/somewhere");
        record.setImportTime(new Date());
        record.setImportMode("copy");
        Assertions.assertTrue(indexService.insertIfAbsent(record));
    }
}
