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

import com.emc.ecs.bulkimport.model.Checksums;
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.ImportError;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the source-to-file-ID mapping of a batch as tab-separated values, one row per record in input order.
 */
public class MappingFileWriter {
    private static final Logger log = LoggerFactory.getLogger(MappingFileWriter.class);

    public static final String[] COLUMNS = {"Source", "FileID", "Size", "CRC32", "Status", "Error"};

    static final CSVFormat FORMAT = CSVFormat.TDF.builder()
            .setCommentMarker('#')
            .setRecordSeparator('\n')
            .build();

    private final Path file;

    public MappingFileWriter(Path file) {
        this.file = file;
    }

    public void write(Iterable<FileRecord> records) throws IOException {
        long rows = 0;
        try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, FORMAT)) {
            printer.printComment(String.join("\t", COLUMNS));
            for (FileRecord record : records) {
                printer.printRecord(getColumns(record));
                rows++;
            }
        }
        log.info("wrote {} mapping rows to {}", rows, file);
    }

    static Object[] getColumns(FileRecord record) {
        String error = "";
        if (record.getErrorCode() != ImportError.NONE) {
            error = record.getErrorCode().name();
            if (record.getErrorMessage() != null) error += ": " + record.getErrorMessage();
        }
        return new Object[]{
                record.getSourcePath(),
                record.getIdentifier() == null ? "" : record.getIdentifier(),
                record.getSize(),
                record.getChecksum() == null ? "" : Checksums.toHex(record.getChecksum()),
                record.getStatus(),
                error
        };
    }

    public Path getFile() {
        return file;
    }
}
