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

import com.emc.ecs.bulkimport.config.ConfigUtil;
import com.emc.ecs.bulkimport.config.ConfigurationException;
import com.emc.ecs.bulkimport.config.ImportConfig;
import com.emc.ecs.bulkimport.config.ImportOptions;
import com.emc.ecs.bulkimport.config.StorageConfig;
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.RecordStatus;
import com.emc.ecs.bulkimport.storage.StorePaths;
import com.emc.ecs.bulkimport.tracker.StaticTrackerClient;
import com.emc.ecs.bulkimport.tracker.TrackerAssignment;
import com.emc.ecs.bulkimport.tracker.TrackerClient;
import com.emc.ecs.bulkimport.util.EnhancedThreadPoolExecutor;
import com.emc.ecs.bulkimport.util.LineIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs one import batch: expands the sources into records (in input order), resolves the target once, then feeds
 * every record through an {@link ImportTask} on a bounded worker pool.
 * <p>
 * A batch-fatal setup problem skips every record with {@link ImportError#BATCH_ABORTED} before any record starts.
 * {@link #terminate()} lets running records finish; records that have not started are skipped with
 * {@link ImportError#CANCELLED}. Either way, when {@link #run()} returns every record is terminal and the context is
 * complete.
 */
public class BulkImport implements Runnable, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BulkImport.class);

    private static final int TASK_QUEUE_SIZE = 1000;
    private static final long WAIT_INTERVAL_MS = 500;

    private ImportConfig importConfig;
    private BulkImportService service;
    private boolean ownService;
    private TrackerClient trackerClient;
    private final ImportControl importControl = new ImportControl();
    private volatile ImportContext context;
    private List<FileRecord> records = Collections.emptyList();
    private volatile EnhancedThreadPoolExecutor importExecutor;
    private volatile boolean terminated;
    private volatile boolean closed;
    private BatchFatalException batchError;
    private Throwable runError;

    private int perfReportSeconds;
    private ScheduledExecutorService perfScheduler;

    public synchronized void run() {
        try {
            if (closed) throw new IllegalStateException("this instance has been closed");
            if (importConfig == null) throw new ConfigurationException("import config is required");
            if (importConfig.getOptions() == null) importConfig.setOptions(new ImportOptions());
            if (importConfig.getStorage() == null) throw new ConfigurationException("storage config is required");
            final ImportOptions options = importConfig.getOptions();
            final StorageConfig storage = importConfig.getStorage();
            ConfigUtil.validate(options);
            ConfigUtil.validate(storage);
            boolean hasSources = importConfig.getSources() != null && importConfig.getSources().length > 0;
            if (!hasSources && options.getSourceListFile() == null)
                throw new ConfigurationException("at least one source or a source list file is required");
            if (options.getSourceListFile() != null && !"-".equals(options.getSourceListFile())
                    && !Files.isReadable(Paths.get(options.getSourceListFile())))
                throw new ConfigurationException("source list file " + options.getSourceListFile() + " is not readable");

            // Summarize config for reference
            if (log.isInfoEnabled()) log.info(summarizeConfig());

            if (service == null) {
                service = new BulkImportService(options, storage);
                ownService = true;
            }
            if (!service.isInitialized()) service.init();
            if (trackerClient == null) trackerClient = new StaticTrackerClient(service.getStorePaths());

            records = collectRecords(options);
            log.info("{} files to import", records.size());

            TrackerAssignment assignment;
            try {
                assignment = trackerClient.resolve(storage);
                checkStorePath(assignment);
            } catch (BatchFatalException e) {
                batchError = e;
                assignment = new TrackerAssignment(storage.getGroupName(), storage.getStorePathIndex());
            }

            context = new ImportContext(assignment.getGroupName(), assignment.getStorePathIndex(),
                    options.getImportMode(), options.isChecksumEnabled(), options.isDryRun(), records.size(),
                    options.isRememberFailed());
            log.info("Import started at " + new Date());
            context.start();

            if (batchError != null) {
                log.error("batch aborted: {}", batchError.getMessage());
                for (FileRecord record : records) {
                    record.skip(ImportError.BATCH_ABORTED, batchError.getMessage());
                    context.recordSkipped(record);
                }
                return;
            }

            importExecutor = new EnhancedThreadPoolExecutor(options.getThreadCount(),
                    new LinkedBlockingDeque<>(TASK_QUEUE_SIZE), "import-pool");
            importControl.setRunning(!terminated);
            startPerformanceReporting();

            for (FileRecord record : records) {
                if (!importControl.isRunning()) break;
                importExecutor.blockingSubmit(new ImportTask(record, service, context, importControl,
                        options.isSkipImported()));
            }

            // now we must wait until all submitted tasks are complete
            while (importControl.isRunning()) {
                if (importExecutor.getUnfinishedTasks() <= 0) {
                    log.info("all tasks complete");
                    break;
                } else {
                    try {
                        Thread.sleep(WAIT_INTERVAL_MS);
                    } catch (InterruptedException e) {
                        log.warn("interrupted while waiting for import tasks", e);
                        Thread.currentThread().interrupt();
                        terminate();
                    }
                }
            }
        } catch (Throwable t) {
            log.error("unexpected exception", t);
            runError = t;
            throw t;
        } finally {
            if (terminated) log.warn("terminated early!");
            importControl.setRunning(false);
            if (importExecutor != null) {
                importExecutor.shutdown();
                // if we were terminated early, wait for any in-progress tasks to finish
                try {
                    importExecutor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    log.warn("interrupted after termination while waiting for import threads to finish", e);
                    Thread.currentThread().interrupt();
                }
            }
            if (context != null) skipUnstarted();
            if (context != null && log.isInfoEnabled()) log.info("Import summary:\n{}", context.getStatsString());

            close();
        }
    }

    // anything still in INIT never reached a worker
    private void skipUnstarted() {
        for (FileRecord record : records) {
            if (record.getStatus() == RecordStatus.INIT) {
                record.skip(ImportError.CANCELLED, "import was cancelled before this file started");
                context.recordSkipped(record);
            }
        }
    }

    private void checkStorePath(TrackerAssignment assignment) {
        StorePaths storePaths = service.getStorePaths();
        if (!storePaths.isValidIndex(assignment.getStorePathIndex()))
            throw new BatchFatalException("tracker assigned store path index " + assignment.getStorePathIndex()
                    + ", but only " + storePaths.getCount() + " store paths are configured");
        Path storePath = storePaths.getStorePath(assignment.getStorePathIndex());
        if (!Files.isDirectory(storePath))
            throw new BatchFatalException("store path " + storePath + " does not exist or is not a directory");
        if (!Files.isWritable(storePath)) throw new BatchFatalException("store path " + storePath + " is not writable");
    }

    /**
     * Expands sources (config sources first, then the source list file) into one record per file. Directories become
     * their regular files in sorted order; anything else is kept as given and left to validation.
     */
    List<FileRecord> collectRecords(ImportOptions options) {
        List<String> paths = new ArrayList<>();
        if (importConfig.getSources() != null) {
            for (String source : importConfig.getSources()) {
                expand(source, options, paths);
            }
        }
        if (options.getSourceListFile() != null) {
            try (LineIterator lineIterator = new LineIterator(options.getSourceListFile())) {
                while (lineIterator.hasNext()) {
                    expand(lineIterator.next(), options, paths);
                }
            }
        }
        List<FileRecord> list = new ArrayList<>(paths.size());
        long rowNum = 0;
        for (String path : paths) {
            list.add(new FileRecord(++rowNum, path));
        }
        return Collections.unmodifiableList(list);
    }

    private void expand(String source, ImportOptions options, List<String> paths) {
        String normalized = normalizeSourcePath(source);
        Path path = toPath(normalized);
        if (path == null || !Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            paths.add(normalized);
            return;
        }
        LinkOption[] linkOptions = options.isFollowSymlinks() ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        try (Stream<Path> children = options.isRecursive() ? Files.walk(path) : Files.list(path)) {
            List<String> files = children.filter(p -> Files.isRegularFile(p, linkOptions))
                    .map(Path::toString)
                    .sorted()
                    .collect(Collectors.toList());
            log.debug("{} files found under {}", files.size(), path);
            paths.addAll(files);
        } catch (IOException | RuntimeException e) {
            log.warn("could not list directory {}", path, e);
            // keep the directory itself so it is reported instead of silently dropped
            paths.add(normalized);
        }
    }

    static String normalizeSourcePath(String sourcePath) {
        Path path = toPath(sourcePath);
        return path == null ? sourcePath : path.toAbsolutePath().normalize().toString();
    }

    private static Path toPath(String sourcePath) {
        if (sourcePath == null || sourcePath.trim().isEmpty()) return null;
        try {
            return Paths.get(sourcePath);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private void startPerformanceReporting() {
        if (perfReportSeconds > 0) {
            perfScheduler = Executors.newSingleThreadScheduledExecutor();
            perfScheduler.scheduleAtFixedRate(
                    () -> {
                        if (isRunning()) {
                            log.info("Files: complete: {}/s failed: {}/s ({} of {} processed)",
                                    context.getFileCompleteRate(), context.getFileErrorRate(),
                                    context.getProcessed(), context.getTotal());
                        }
                    },
                    perfReportSeconds, perfReportSeconds, TimeUnit.SECONDS);
        }
    }

    /**
     * Stops feeding records to the workers. Records already processing finish normally.
     */
    public void terminate() {
        importControl.setRunning(false);
        terminated = true;
        if (importExecutor != null) importExecutor.stop();
    }

    public String summarizeConfig() {
        StringBuilder summary = new StringBuilder("Configuration Summary:\n");
        if (importConfig.getJobName() != null) summary.append("Job: ").append(importConfig.getJobName()).append("\n");
        summary.append(ConfigUtil.summarize(importConfig.getOptions()));
        summary.append("Storage: ").append(ConfigUtil.summarize(importConfig.getStorage()));
        return summary.toString();
    }

    @Override
    public void close() {
        // make sure this instance cannot be run again
        closed = true;
        safeClose(context);
        if (perfScheduler != null) try {
            perfScheduler.shutdownNow();
        } catch (Throwable t) {
            log.warn("could not shut down perf reporting", t);
        }
        if (ownService && service != null && service.isInitialized()) {
            try {
                service.destroy();
            } catch (RuntimeException e) {
                log.warn("could not destroy bulk import service", e);
            }
        }
    }

    private void safeClose(AutoCloseable closeable) {
        try {
            if (closeable != null) closeable.close();
        } catch (Throwable t) {
            log.warn("could not close " + closeable.getClass().getSimpleName(), t);
        }
    }

    public boolean isRunning() {
        return importControl.isRunning();
    }

    public boolean isTerminated() {
        return terminated;
    }

    /**
     * @return true if the batch was aborted during setup (every record is skipped)
     */
    public boolean isBatchAborted() {
        return batchError != null;
    }

    public BatchFatalException getBatchError() {
        return batchError;
    }

    public Throwable getRunError() {
        return runError;
    }

    public ImportContext getContext() {
        return context;
    }

    /**
     * @return all records of the batch in input order
     */
    public List<FileRecord> getRecords() {
        return records;
    }

    public ImportConfig getImportConfig() {
        return importConfig;
    }

    public void setImportConfig(ImportConfig importConfig) {
        this.importConfig = importConfig;
    }

    public BulkImport withImportConfig(ImportConfig importConfig) {
        setImportConfig(importConfig);
        return this;
    }

    public BulkImportService getService() {
        return service;
    }

    /**
     * A service set here is initialized if necessary but never destroyed by this batch.
     */
    public void setService(BulkImportService service) {
        this.service = service;
    }

    public BulkImport withService(BulkImportService service) {
        setService(service);
        return this;
    }

    public TrackerClient getTrackerClient() {
        return trackerClient;
    }

    public void setTrackerClient(TrackerClient trackerClient) {
        this.trackerClient = trackerClient;
    }

    public BulkImport withTrackerClient(TrackerClient trackerClient) {
        setTrackerClient(trackerClient);
        return this;
    }

    public int getPerfReportSeconds() {
        return perfReportSeconds;
    }

    public void setPerfReportSeconds(int perfReportSeconds) {
        this.perfReportSeconds = perfReportSeconds;
    }
}
