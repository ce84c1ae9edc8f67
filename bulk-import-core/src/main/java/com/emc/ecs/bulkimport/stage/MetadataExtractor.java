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

import com.emc.ecs.bulkimport.config.ImportOptions;
import com.emc.ecs.bulkimport.model.FileMetadata;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.util.regex.Pattern;
import java.util.zip.CRC32;

/**
 * Captures size, timestamps and (optionally) the CRC32 of a source file. The checksum pass only reads the file.
 */
public class MetadataExtractor {
    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    public static final int MAX_EXTENSION_LENGTH = 6;

    private static final Pattern EXTENSION_PATTERN = Pattern.compile("[A-Za-z0-9]{1," + MAX_EXTENSION_LENGTH + "}");

    /**
     * The text after the last dot of the file name, if it is 1-6 alphanumeric characters; otherwise empty.
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) return "";
        String ext = fileName.substring(dot + 1);
        return EXTENSION_PATTERN.matcher(ext).matches() ? ext : "";
    }

    private final int bufferSize;

    public MetadataExtractor() {
        this(ImportOptions.DEFAULT_BUFFER_SIZE);
    }

    public MetadataExtractor(int bufferSize) {
        if (bufferSize <= 0) throw new IllegalArgumentException("buffer size must be positive");
        this.bufferSize = bufferSize;
    }

    public StageResult<FileMetadata> extract(Path path, boolean computeChecksum) {
        BasicFileAttributes attributes;
        long changeTime;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
            changeTime = getChangeTime(path, attributes);
        } catch (NoSuchFileException e) {
            return StageResult.error(ImportError.FILE_NOT_FOUND, path + " disappeared before it could be read");
        } catch (IOException e) {
            log.debug("stat failed for {}", path, e);
            return StageResult.error(ImportError.METADATA_FAILED, "cannot stat " + path + ": " + e);
        }

        Long checksum = null;
        if (computeChecksum) {
            try {
                checksum = crc32(path);
            } catch (NoSuchFileException e) {
                return StageResult.error(ImportError.FILE_NOT_FOUND, path + " disappeared before it could be read");
            } catch (IOException e) {
                log.debug("read failed for {}", path, e);
                return StageResult.error(ImportError.CRC32_FAILED, "cannot read " + path + ": " + e);
            }
        }

        Path fileName = path.getFileName();
        FileMetadata metadata = new FileMetadata(attributes.size(), attributes.lastModifiedTime().toMillis(),
                changeTime, checksum, extensionOf(fileName == null ? null : fileName.toString()));
        log.debug("file metadata for {}: {}", path, metadata);
        return StageResult.ok(metadata);
    }

    /**
     * Streams the whole file through a CRC32.
     */
    public long crc32(Path path) throws IOException {
        CRC32 crc = new CRC32();
        byte[] buffer = new byte[bufferSize];
        try (InputStream in = Files.newInputStream(path)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                crc.update(buffer, 0, read);
            }
        }
        return crc.getValue();
    }

    // status change time where the platform exposes it (unix), creation time otherwise
    private long getChangeTime(Path path, BasicFileAttributes attributes) throws IOException {
        try {
            Object ctime = Files.getAttribute(path, "unix:ctime");
            if (ctime instanceof FileTime) return ((FileTime) ctime).toMillis();
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            log.trace("unix:ctime is not available for {}", path);
        }
        return attributes.creationTime().toMillis();
    }

    public int getBufferSize() {
        return bufferSize;
    }
}
