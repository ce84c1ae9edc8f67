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
package com.emc.ecs.bulkimport.cli;

import com.emc.ecs.bulkimport.model.FileMetadata;
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.ImportError;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

public class MappingFileWriterTest {
    private Path tempDir;

    @BeforeEach
    public void setup() throws Exception {
        tempDir = Files.createTempDirectory("bulk-import-mapping-test");
    }

    @AfterEach
    public void teardown() throws Exception {
        Files.deleteIfExists(tempDir.resolve("mapping.tsv"));
        Files.deleteIfExists(tempDir);
    }

    @Test
    public void testWrite() throws Exception {
        FileRecord imported = new FileRecord(1, "/data/in/hello.txt");
        imported.startProcessing();
        imported.applyMetadata(new FileMetadata(12, 1500000000000L, 1500000000000L, 0x1c291ca3L, "txt"));
        imported.assignIdentifier("group1", 0, "group1/M00/D4/8D/AAAAAFloLwCAAAABAAAADBwpHKM969.txt");
        imported.succeed();

        FileRecord missing = new FileRecord(2, "/data/in/missing.txt");
        missing.startProcessing();
        missing.fail(ImportError.FILE_NOT_FOUND, "/data/in/missing.txt does not exist");

        FileRecord pending = new FileRecord(3, "/data/in/pending.txt");

        Path file = tempDir.resolve("mapping.tsv");
        MappingFileWriter writer = new MappingFileWriter(file);
        writer.write(Arrays.asList(imported, missing, pending));
        Assertions.assertEquals(file, writer.getFile());

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        Assertions.assertEquals(4, lines.size());
        Assertions.assertEquals("# " + String.join("\t", MappingFileWriter.COLUMNS), lines.get(0));

        List<CSVRecord> rows;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
             CSVParser parser = new CSVParser(reader, MappingFileWriter.FORMAT)) {
            rows = parser.getRecords();
        }
        Assertions.assertEquals(3, rows.size());

        CSVRecord row = rows.get(0);
        Assertions.assertEquals("/data/in/hello.txt", row.get(0));
        Assertions.assertEquals("group1/M00/D4/8D/AAAAAFloLwCAAAABAAAADBwpHKM969.txt", row.get(1));
        Assertions.assertEquals("12", row.get(2));
        Assertions.assertEquals("1c291ca3", row.get(3));
        Assertions.assertEquals(imported.getStatus().toString(), row.get(4));
        Assertions.assertEquals("", row.get(5));

        row = rows.get(1);
        Assertions.assertEquals("/data/in/missing.txt", row.get(0));
        Assertions.assertEquals("", row.get(1));
        Assertions.assertEquals("", row.get(3));
        Assertions.assertEquals(missing.getStatus().toString(), row.get(4));
        Assertions.assertEquals("FILE_NOT_FOUND: /data/in/missing.txt does not exist", row.get(5));

        row = rows.get(2);
        Assertions.assertEquals("/data/in/pending.txt", row.get(0));
        Assertions.assertEquals(pending.getStatus().toString(), row.get(4));
    }
}
