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

import com.emc.ecs.bulkimport.config.ImportMode;
import com.emc.ecs.bulkimport.model.FileMetadata;
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import com.emc.ecs.bulkimport.service.IndexRecord;
import com.emc.ecs.bulkimport.service.IndexService;
import com.emc.ecs.bulkimport.service.IndexUnavailableException;
import com.emc.ecs.bulkimport.util.ImportUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;

/**
 * Runs the whole pipeline for one record on the current thread. Every outcome, including unexpected exceptions, ends
 * with the record in a terminal state and counted exactly once in the context.
 */
public class ImportTask implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(ImportTask.class);

    private final FileRecord record;
    private final BulkImportService service;
    private final ImportContext context;
    private final ImportControl importControl;
    private final boolean skipImported;

    public ImportTask(FileRecord record, BulkImportService service, ImportContext context, ImportControl importControl,
                      boolean skipImported) {
        this.record = record;
        this.service = service;
        this.context = context;
        this.importControl = importControl;
        this.skipImported = skipImported;
    }

    @Override
    public void run() {
        String sourcePath = record.getSourcePath();

        if (!importControl.isRunning()) {
            log.debug("O--* skipping {} because the import was cancelled", sourcePath);
            record.skip(ImportError.CANCELLED, "import was cancelled before this file started");
            context.recordSkipped(record);
            return;
        }

        record.startProcessing();
        log.debug("O--+ importing {}", sourcePath);

        IndexService indexService = service.getIndexService();
        ImportMode mode = context.getImportMode();
        // error code for unexpected exceptions; follows the pipeline
        ImportError stageError = ImportError.METADATA_FAILED;
        boolean locked = false;
        try {
            indexService.lock(sourcePath);
            locked = true;

            StageResult<Path> validated = service.validatePath(sourcePath);
            IndexRecord previous = skipImported ? indexService.getBySourcePath(sourcePath) : null;
            if (previous != null && isAlreadyImported(previous, validated)) {
                record.skip(ImportError.ALREADY_IMPORTED, "already imported as " + previous.getFileId());
                context.recordSkipped(record);
                log.info("O--* skipping {} because it was already imported as {}", sourcePath, previous.getFileId());
                return;
            }
            if (!validated.isOk()) {
                fail(validated);
                return;
            }
            Path path = validated.getValue();

            StageResult<FileMetadata> extracted = service.extractMetadata(path, context.isChecksumEnabled());
            if (!extracted.isOk()) {
                fail(extracted);
                return;
            }
            FileMetadata metadata = extracted.getValue();
            record.applyMetadata(metadata);

            StageResult<String> generated = service.generateIdentifier(metadata,
                    context.getGroupName(), context.getStorePathIndex());
            if (!generated.isOk()) {
                fail(generated);
                return;
            }
            record.assignIdentifier(context.getGroupName(), context.getStorePathIndex(), generated.getValue());

            if (!service.checkSpace(context.getStorePathIndex(), metadata.getSize())) {
                fail(ImportError.NO_SPACE, "not enough free space on store path " + context.getStorePathIndex()
                        + " for " + metadata.getSize() + " bytes");
                return;
            }

            if (!context.isDryRun()) {
                stageError = mode == ImportMode.move ? ImportError.MOVE_FAILED : ImportError.COPY_FAILED;
                StageResult<Path> transferred = service.transfer(record, mode);
                if (!transferred.isOk()) {
                    fail(transferred);
                    return;
                }
                record.setFinalPath(transferred.getValue().toString());

                stageError = ImportError.INDEX_UPDATE;
                StageResult<Void> updated = service.updateIndex(record, mode);
                if (!updated.isOk()) {
                    fail(updated);
                    return;
                }
            }

            record.succeed();
            context.recordSuccess(record);
            if (context.isDryRun())
                log.info("O--O validated {} as {} ({} bytes)", sourcePath, record.getIdentifier(), record.getSize());
            else
                log.info("O--O imported {} as {} ({} bytes)", sourcePath, record.getIdentifier(), record.getSize());

        } catch (Throwable t) {
            if (record.getStatus().isTerminal()) {
                log.error("unexpected error after {} finished", sourcePath, t);
            } else {
                ImportError error = t instanceof IndexUnavailableException ? ImportError.INDEX_UPDATE : stageError;
                String message = ImportUtil.summarize(t);
                if (record.getFinalPath() != null) message += "; file is at " + record.getFinalPath();
                log.warn("O--! file " + sourcePath + " failed", ImportUtil.getCause(t));
                record.fail(error, message);
                context.recordFailure(record);
            }
        } finally {
            if (locked) indexService.unlock(sourcePath);
        }
    }

    private void fail(StageResult<?> result) {
        fail(result.getError(), result.getMessage());
    }

    private void fail(ImportError error, String message) {
        record.fail(error, message);
        context.recordFailure(record);
        log.warn("O--! file {} failed: {} ({})", record.getSourcePath(), error, message);
    }

    // same size and mtime as the indexed import, or gone after a previous move
    private boolean isAlreadyImported(IndexRecord previous, StageResult<Path> validated) {
        if (!validated.isOk()) {
            return validated.getError() == ImportError.FILE_NOT_FOUND
                    && ImportMode.move.name().equals(previous.getImportMode());
        }
        try {
            BasicFileAttributes attributes = Files.readAttributes(validated.getValue(), BasicFileAttributes.class);
            // MySQL DATETIME keeps whole seconds only
            return attributes.size() == previous.getSize() && previous.getModifyTime() != null
                    && attributes.lastModifiedTime().toMillis() / 1000 == previous.getModifyTime().getTime() / 1000;
        } catch (IOException e) {
            log.debug("could not stat {} for the resume check", validated.getValue(), e);
            return false;
        }
    }

    public FileRecord getRecord() {
        return record;
    }
}
