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
import com.emc.ecs.bulkimport.model.RecordStatus;
import com.emc.ecs.bulkimport.model.StageResult;
import com.emc.ecs.bulkimport.service.IndexService;
import com.emc.ecs.bulkimport.service.MySQLIndexService;
import com.emc.ecs.bulkimport.service.SqliteIndexService;
import com.emc.ecs.bulkimport.stage.CounterUniquenessSource;
import com.emc.ecs.bulkimport.stage.IdentifierGenerator;
import com.emc.ecs.bulkimport.stage.IndexUpdater;
import com.emc.ecs.bulkimport.stage.MetadataExtractor;
import com.emc.ecs.bulkimport.stage.PathValidator;
import com.emc.ecs.bulkimport.stage.SpaceChecker;
import com.emc.ecs.bulkimport.stage.Transferer;
import com.emc.ecs.bulkimport.stage.UniquenessSource;
import com.emc.ecs.bulkimport.storage.StorePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;

/**
 * Handle for the bulk import subsystem of one storage node. Construct once, call {@link #init()} once before any
 * operation and {@link #destroy()} once when done; both throw {@link IllegalStateException} if called again.
 * <p>
 * Collaborators (index service, uniqueness source, space checker, transferer) may be replaced through the setters
 * before init.
 */
public class BulkImportService {
    private static final Logger log = LoggerFactory.getLogger(BulkImportService.class);

    private enum State {NEW, INITIALIZED, DESTROYED}

    private final ImportOptions options;
    private final StorageConfig storageConfig;
    private State state = State.NEW;

    private StorePaths storePaths;
    private IndexService indexService;
    private UniquenessSource uniquenessSource;
    private SpaceChecker spaceChecker;
    private Transferer transferer;

    private PathValidator pathValidator;
    private MetadataExtractor metadataExtractor;
    private IdentifierGenerator identifierGenerator;
    private IndexUpdater indexUpdater;

    public BulkImportService(ImportOptions options, StorageConfig storageConfig) {
        this.options = options;
        this.storageConfig = storageConfig;
    }

    public synchronized void init() {
        if (state != State.NEW) throw new IllegalStateException("bulk import service is already " + state.name().toLowerCase());
        if (options.getThreadCount() < 1 || options.getThreadCount() > ImportOptions.MAX_THREAD_COUNT)
            throw new ConfigurationException("thread count must be between 1 and " + ImportOptions.MAX_THREAD_COUNT);
        if (options.getMaxFileSize() <= 0) throw new ConfigurationException("max file size must be positive");
        if (options.getBufferSize() <= 0) throw new ConfigurationException("buffer size must be positive");

        storePaths = new StorePaths(storageConfig);
        if (indexService == null) indexService = createIndexService();
        if (options.getIndexTable() != null) indexService.setTableName(options.getIndexTable());
        indexService.init();
        if (uniquenessSource == null) uniquenessSource = new CounterUniquenessSource();
        if (spaceChecker == null) spaceChecker = new SpaceChecker(storePaths, options.getSpaceSafetyMargin());
        if (transferer == null)
            transferer = new Transferer(storePaths, options.getMoveFallbackTrigger(), options.getBufferSize());

        pathValidator = new PathValidator(options);
        metadataExtractor = new MetadataExtractor(options.getBufferSize());
        identifierGenerator = new IdentifierGenerator(storePaths, indexService, uniquenessSource,
                storageConfig.getServerId(), options.getCollisionRetries());
        indexUpdater = new IndexUpdater(indexService);

        state = State.INITIALIZED;
        log.info("bulk import service initialized ({} store paths, index table {})",
                storePaths.getCount(), indexService.getTableName());
    }

    private IndexService createIndexService() {
        if (options.getIndexDbFile() != null) {
            return new SqliteIndexService(new File(options.getIndexDbFile()));
        } else if (options.getIndexDbConnectString() != null) {
            return new MySQLIndexService(options.getIndexDbConnectString(), null, null, options.getIndexDbEncPassword());
        }
        throw new ConfigurationException("an index database is required (index-db-file or index-db-connect-string)");
    }

    public synchronized void destroy() {
        if (state != State.INITIALIZED)
            throw new IllegalStateException("bulk import service is " + state.name().toLowerCase());
        state = State.DESTROYED;
        try {
            indexService.close();
        } catch (RuntimeException e) {
            log.warn("could not close index service", e);
        }
        log.info("bulk import service destroyed");
    }

    public synchronized boolean isInitialized() {
        return state == State.INITIALIZED;
    }

    private synchronized void checkInitialized() {
        if (state != State.INITIALIZED)
            throw new IllegalStateException("bulk import service is not initialized (" + state.name().toLowerCase() + ")");
    }

    public StageResult<Path> validatePath(String sourcePath) {
        checkInitialized();
        return pathValidator.validate(sourcePath);
    }

    public StageResult<FileMetadata> extractMetadata(Path sourcePath, boolean computeChecksum) {
        checkInitialized();
        return metadataExtractor.extract(sourcePath, computeChecksum);
    }

    public StageResult<String> generateIdentifier(FileMetadata metadata, String groupName, int storePathIndex) {
        checkInitialized();
        return identifierGenerator.generate(metadata, groupName, storePathIndex);
    }

    public boolean checkSpace(int storePathIndex, long requiredBytes) {
        checkInitialized();
        return spaceChecker.hasSpace(storePathIndex, requiredBytes);
    }

    public StageResult<Path> transfer(FileRecord record, ImportMode mode) {
        checkInitialized();
        return transferer.transfer(record, mode);
    }

    public StageResult<Void> updateIndex(FileRecord record) {
        return updateIndex(record, options.getImportMode());
    }

    public StageResult<Void> updateIndex(FileRecord record, ImportMode mode) {
        checkInitialized();
        return indexUpdater.update(record, mode);
    }

    /**
     * Generates a file ID for a processing record whose metadata is already captured and, unless the context is a
     * dry run, registers it in the index. For callers that place the bytes themselves; the record's final path
     * defaults to the location the new ID resolves to.
     *
     * @return the generated file ID
     */
    public StageResult<String> registerFile(ImportContext context, FileRecord record) {
        checkInitialized();
        if (record.getStatus() != RecordStatus.PROCESSING)
            throw new IllegalStateException(record.getSourcePath() + " is not processing");

        FileMetadata metadata = new FileMetadata(record.getSize(), record.getModifyTime(), record.getCreateTime(),
                record.getChecksum(), record.getExtension());
        StageResult<String> generated = generateIdentifier(metadata, context.getGroupName(), context.getStorePathIndex());
        if (!generated.isOk()) return generated;
        record.assignIdentifier(context.getGroupName(), context.getStorePathIndex(), generated.getValue());
        if (record.getFinalPath() == null)
            record.setFinalPath(resolveStoragePath(context.getStorePathIndex(), generated.getValue()).toString());

        if (!context.isDryRun()) {
            StageResult<Void> updated = updateIndex(record, context.getImportMode());
            if (!updated.isOk()) return updated.propagate();
        }
        return generated;
    }

    /**
     * Pure derivation; touches neither the filesystem nor the index.
     */
    public Path resolveStoragePath(int storePathIndex, String identifier) {
        checkInitialized();
        return storePaths.resolveStoragePath(storePathIndex, identifier);
    }

    public ImportOptions getOptions() {
        return options;
    }

    public StorageConfig getStorageConfig() {
        return storageConfig;
    }

    public StorePaths getStorePaths() {
        checkInitialized();
        return storePaths;
    }

    public IndexService getIndexService() {
        return indexService;
    }

    public synchronized void setIndexService(IndexService indexService) {
        requireNew();
        this.indexService = indexService;
    }

    public synchronized void setUniquenessSource(UniquenessSource uniquenessSource) {
        requireNew();
        this.uniquenessSource = uniquenessSource;
    }

    public synchronized void setSpaceChecker(SpaceChecker spaceChecker) {
        requireNew();
        this.spaceChecker = spaceChecker;
    }

    public synchronized void setTransferer(Transferer transferer) {
        requireNew();
        this.transferer = transferer;
    }

    private void requireNew() {
        if (state != State.NEW) throw new IllegalStateException("collaborators can only be set before init()");
    }
}
