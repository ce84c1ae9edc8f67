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

import com.emc.ecs.bulkimport.config.ImportMode;
import com.emc.ecs.bulkimport.config.MoveFallbackTrigger;
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import com.emc.ecs.bulkimport.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Places a record's bytes at the location its file ID resolves to.
 * <p>
 * Copy mode writes a temp file next to the destination, verifies it and renames it into place, so a partially
 * written file is never visible under the file ID. Move mode renames when it can and otherwise copies then deletes
 * the source. If the source cannot be deleted the copy is removed again, so exactly one of source and destination
 * survives. Size (and CRC32, when captured) of the destination must match what was captured from the source.
 */
public class Transferer {
    private static final Logger log = LoggerFactory.getLogger(Transferer.class);

    static final String TEMP_PREFIX = ".";
    static final String TEMP_SUFFIX = ".tmp";

    private final StorePaths storePaths;
    private final MoveFallbackTrigger fallbackTrigger;
    private final int bufferSize;

    public Transferer(StorePaths storePaths, MoveFallbackTrigger fallbackTrigger, int bufferSize) {
        if (bufferSize <= 0) throw new IllegalArgumentException("buffer size must be positive");
        this.storePaths = storePaths;
        this.fallbackTrigger = fallbackTrigger == null ? MoveFallbackTrigger.renameFailure : fallbackTrigger;
        this.bufferSize = bufferSize;
    }

    /**
     * @return the final on-disk path of the file
     */
    public StageResult<Path> transfer(FileRecord record, ImportMode mode) {
        if (record.getIdentifier() == null)
            throw new IllegalStateException("no file ID assigned to " + record.getSourcePath());
        ImportError modeError = mode == ImportMode.move ? ImportError.MOVE_FAILED : ImportError.COPY_FAILED;

        Path source = Paths.get(record.getSourcePath());
        Path destination = resolveDestination(record);

        try {
            // concurrent workers may create the same shard directory; createDirectories tolerates that
            Files.createDirectories(destination.getParent());
        } catch (IOException e) {
            return failure(modeError, "cannot create shard directory " + destination.getParent(), e);
        }
        if (Files.exists(destination, LinkOption.NOFOLLOW_LINKS))
            return StageResult.error(modeError, destination + " already exists");

        if (mode == ImportMode.move) return move(record, source, destination);
        return copy(record, source, destination, modeError);
    }

    public Path resolveDestination(FileRecord record) {
        return storePaths.resolveStoragePath(record.getStorePathIndex(), record.getIdentifier());
    }

    private StageResult<Path> move(FileRecord record, Path source, Path destination) {
        boolean tryRename = true;
        if (fallbackTrigger == MoveFallbackTrigger.fileStoreCheck) {
            try {
                tryRename = Objects.equals(Files.getFileStore(source), Files.getFileStore(destination.getParent()));
            } catch (IOException e) {
                return failure(ImportError.MOVE_FAILED, "cannot determine file store of " + source, e);
            }
        }

        if (tryRename) {
            try {
                rename(source, destination);
                log.debug("renamed {} to {}", source, destination);
                StageResult<Void> verified;
                try {
                    verified = verify(record, destination, ImportError.MOVE_FAILED);
                } catch (IOException e) {
                    restore(destination, source);
                    return failure(ImportError.MOVE_FAILED, "cannot verify " + destination, e);
                }
                if (!verified.isOk()) {
                    restore(destination, source);
                    return verified.propagate();
                }
                return StageResult.ok(destination);
            } catch (AtomicMoveNotSupportedException e) {
                if (fallbackTrigger == MoveFallbackTrigger.fileStoreCheck)
                    return failure(ImportError.MOVE_FAILED, "rename of " + source + " failed", e);
                log.debug("{} and {} are on different file systems; falling back to copy + delete", source, destination);
            } catch (IOException e) {
                return failure(ImportError.MOVE_FAILED, "rename of " + source + " failed", e);
            }
        }

        StageResult<Path> copied = copy(record, source, destination, ImportError.MOVE_FAILED);
        if (!copied.isOk()) return copied;
        try {
            deleteSource(source);
        } catch (IOException e) {
            log.warn("could not delete source {} after copy; rolling back {}", source, destination, e);
            try {
                Files.deleteIfExists(destination);
            } catch (IOException e2) {
                log.error("rollback failed: {} and {} both exist", source, destination, e2);
                return failure(ImportError.MOVE_FAILED, "source " + source + " could not be deleted and copy "
                        + destination + " could not be rolled back", e);
            }
            return failure(ImportError.MOVE_FAILED, "source " + source + " could not be deleted", e);
        }
        return copied;
    }

    private StageResult<Path> copy(FileRecord record, Path source, Path destination, ImportError modeError) {
        Path temp = destination.resolveSibling(TEMP_PREFIX + destination.getFileName() + TEMP_SUFFIX);
        try {
            CRC32 crc = new CRC32();
            long written = 0;
            byte[] buffer = new byte[bufferSize];
            try (InputStream in = Files.newInputStream(source);
                 OutputStream out = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                int read;
                while ((read = in.read(buffer)) != -1) {
                    out.write(buffer, 0, read);
                    crc.update(buffer, 0, read);
                    written += read;
                }
            }
            if (written != record.getSize()) {
                deleteTemp(temp);
                return StageResult.error(modeError, "size mismatch for " + source + ": expected " + record.getSize()
                        + " bytes, copied " + written);
            }
            if (record.getChecksum() != null && record.getChecksum() != crc.getValue()) {
                deleteTemp(temp);
                return StageResult.error(modeError, String.format("CRC32 mismatch for %s: expected %08x, copied %08x",
                        source, record.getChecksum(), crc.getValue()));
            }
            Files.setLastModifiedTime(temp, FileTime.fromMillis(record.getModifyTime()));
            Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE);
            log.debug("copied {} to {} ({} bytes)", source, destination, written);
            return StageResult.ok(destination);
        } catch (IOException e) {
            deleteTemp(temp);
            if (isNoSpace(e)) return failure(ImportError.NO_SPACE, "no space left writing " + destination, e);
            return failure(modeError, "copy of " + source + " to " + destination + " failed", e);
        }
    }

    private StageResult<Void> verify(FileRecord record, Path destination, ImportError modeError) throws IOException {
        long size = Files.size(destination);
        if (size != record.getSize())
            return StageResult.error(modeError, "size mismatch after transfer: expected " + record.getSize()
                    + " bytes, found " + size);
        if (record.getChecksum() != null) {
            long crc = new MetadataExtractor(bufferSize).crc32(destination);
            if (crc != record.getChecksum())
                return StageResult.error(modeError, String.format("CRC32 mismatch after transfer: expected %08x, found %08x",
                        record.getChecksum(), crc));
        }
        return StageResult.ok();
    }

    private void restore(Path destination, Path source) {
        try {
            rename(destination, source);
        } catch (IOException e) {
            log.error("could not move {} back to {}", destination, source, e);
        }
    }

    private void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("could not delete temp file {}", temp, e);
        }
    }

    private StageResult<Path> failure(ImportError error, String message, IOException e) {
        log.debug(message, e);
        return StageResult.error(error, message + ": " + e);
    }

    static boolean isNoSpace(IOException e) {
        String reason = e instanceof FileSystemException ? ((FileSystemException) e).getReason() : null;
        if (reason == null) reason = e.getMessage();
        return reason != null && (reason.contains("No space left") || reason.contains("not enough space"));
    }

    /**
     * Same-file-system rename. Must throw {@link AtomicMoveNotSupportedException} when the paths are on different
     * file systems.
     */
    protected void rename(Path source, Path destination) throws IOException {
        Files.move(source, destination, StandardCopyOption.ATOMIC_MOVE);
    }

    protected void deleteSource(Path source) throws IOException {
        Files.delete(source);
    }

    public MoveFallbackTrigger getFallbackTrigger() {
        return fallbackTrigger;
    }
}
