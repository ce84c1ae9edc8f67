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
package com.emc.ecs.bulkimport.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class FileRecordTest {
    @Test
    public void testSuccessLifecycle() {
        FileRecord record = new FileRecord(1, "/data/in/a.txt");
        Assertions.assertEquals(RecordStatus.INIT, record.getStatus());
        Assertions.assertEquals(ImportError.NONE, record.getErrorCode());

        record.startProcessing();
        record.applyMetadata(new FileMetadata(12, 1000, 900, 0x1c291ca3L, "txt"));
        record.assignIdentifier("group1", 0, "group1/M00/00/01/abc.txt");
        record.succeed();

        Assertions.assertEquals(RecordStatus.SUCCESS, record.getStatus());
        Assertions.assertTrue(record.getStatus().isTerminal());
        Assertions.assertEquals(ImportError.NONE, record.getErrorCode());
        Assertions.assertNull(record.getErrorMessage());
        Assertions.assertEquals(12, record.getSize());
        Assertions.assertEquals(1000, record.getModifyTime());
        Assertions.assertEquals(900, record.getCreateTime());
        Assertions.assertEquals(Long.valueOf(0x1c291ca3L), record.getChecksum());
        Assertions.assertEquals("txt", record.getExtension());
        Assertions.assertEquals("group1/M00/00/01/abc.txt", record.getIdentifier());
    }

    @Test
    public void testFailure() {
        FileRecord record = new FileRecord(2, "/data/in/b");
        record.startProcessing();
        record.fail(StageResult.error(ImportError.FILE_NOT_FOUND, "gone"));
        Assertions.assertEquals(RecordStatus.FAILED, record.getStatus());
        Assertions.assertEquals(ImportError.FILE_NOT_FOUND, record.getErrorCode());
        Assertions.assertEquals("gone", record.getErrorMessage());

        // terminal states are final
        Assertions.assertThrows(IllegalStateException.class, record::succeed);
        Assertions.assertThrows(IllegalStateException.class, () -> record.skip(ImportError.CANCELLED, "late"));
        Assertions.assertThrows(IllegalStateException.class, record::startProcessing);
    }

    @Test
    public void testFailRequiresErrorCode() {
        FileRecord record = new FileRecord(1, "/data/in/a");
        record.startProcessing();
        Assertions.assertThrows(IllegalArgumentException.class, () -> record.fail(ImportError.NONE, "no code"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> record.fail(null, "no code"));
        Assertions.assertEquals(RecordStatus.PROCESSING, record.getStatus());
    }

    @Test
    public void testSkipBeforeStart() {
        FileRecord record = new FileRecord(1, "/data/in/a");
        record.skip(ImportError.BATCH_ABORTED, "no store path");
        Assertions.assertEquals(RecordStatus.SKIPPED, record.getStatus());
        Assertions.assertEquals(ImportError.BATCH_ABORTED, record.getErrorCode());
    }

    @Test
    public void testInvalidTransitions() {
        FileRecord record = new FileRecord(1, "/data/in/a");
        Assertions.assertThrows(IllegalStateException.class, record::succeed);
        Assertions.assertThrows(IllegalStateException.class, () -> record.fail(ImportError.COPY_FAILED, "x"));
        Assertions.assertThrows(IllegalStateException.class,
                () -> record.applyMetadata(new FileMetadata(1, 1, 1, null, "")));

        record.startProcessing();
        record.assignIdentifier("group1", 0, "group1/M00/00/01/abc");
        Assertions.assertThrows(IllegalStateException.class,
                () -> record.assignIdentifier("group1", 0, "group1/M00/00/01/def"));
    }

    @Test
    public void testErrorCodes() {
        for (ImportError error : ImportError.values()) {
            Assertions.assertEquals(error, ImportError.fromCode(error.getCode()));
        }
        Assertions.assertEquals(0, ImportError.NONE.getCode());
        Assertions.assertEquals(7, ImportError.INDEX_UPDATE.getCode());
        Assertions.assertEquals(10, ImportError.PERMISSION.getCode());
        Assertions.assertThrows(IllegalArgumentException.class, () -> ImportError.fromCode(99));
    }
}
