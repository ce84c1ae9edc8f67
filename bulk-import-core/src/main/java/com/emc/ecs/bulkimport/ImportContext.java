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
import com.emc.ecs.bulkimport.model.FailedObject;
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.RecordStatus;
import com.emc.ecs.bulkimport.util.ImportUtil;
import com.emc.ecs.bulkimport.util.PerformanceWindow;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Batch-level aggregate. Counters only move forward, and only through the record* methods, which keep
 * <code>processed == success + failed + skipped</code> and <code>processed &lt;= total</code>. The end time is set
 * exactly once, when the last record is counted.
 */
public class ImportContext implements AutoCloseable {
    private final String groupName;
    private final int storePathIndex;
    private final ImportMode importMode;
    private final boolean checksumEnabled;
    private final boolean dryRun;
    private final long total;
    private final boolean rememberFailed;

    private long processed, success, failed, skipped;
    private long totalBytes;
    private long startTime, endTime;
    private final Set<FailedObject> failedObjects = new TreeSet<>();
    private final PerformanceWindow fileCompleteRate = new PerformanceWindow(500, 20);
    private final PerformanceWindow fileErrorRate = new PerformanceWindow(500, 20);

    public ImportContext(String groupName, int storePathIndex, ImportMode importMode, boolean checksumEnabled,
                         boolean dryRun, long total, boolean rememberFailed) {
        if (total < 0) throw new IllegalArgumentException("total must not be negative");
        this.groupName = groupName;
        this.storePathIndex = storePathIndex;
        this.importMode = importMode;
        this.checksumEnabled = checksumEnabled;
        this.dryRun = dryRun;
        this.total = total;
        this.rememberFailed = rememberFailed;
    }

    @Override
    public void close() {
        fileCompleteRate.close();
        fileErrorRate.close();
    }

    public synchronized void start() {
        if (startTime == 0) startTime = System.currentTimeMillis();
        if (total == 0) endTime = startTime;
    }

    /**
     * Counts a record that just reached {@link RecordStatus#SUCCESS}; its size is added to the byte total.
     */
    public void recordSuccess(FileRecord record) {
        requireStatus(record, RecordStatus.SUCCESS);
        synchronized (this) {
            advance();
            success++;
            totalBytes += record.getSize();
        }
        fileCompleteRate.increment(1);
    }

    public void recordFailure(FileRecord record) {
        requireStatus(record, RecordStatus.FAILED);
        synchronized (this) {
            advance();
            failed++;
            if (rememberFailed)
                failedObjects.add(new FailedObject(record.getListRowNum(), record.getSourcePath(), record.getErrorCode()));
        }
        fileErrorRate.increment(1);
    }

    public synchronized void recordSkipped(FileRecord record) {
        requireStatus(record, RecordStatus.SKIPPED);
        advance();
        skipped++;
    }

    private void requireStatus(FileRecord record, RecordStatus status) {
        if (record.getStatus() != status)
            throw new IllegalStateException("cannot count " + record + " as " + status);
    }

    private void advance() {
        if (processed >= total) throw new IllegalStateException("all " + total + " records are already counted");
        processed++;
        if (processed == total) endTime = System.currentTimeMillis();
    }

    public synchronized boolean isComplete() {
        return processed == total;
    }

    public long getFileCompleteRate() {
        return fileCompleteRate.getWindowRate();
    }

    public long getFileErrorRate() {
        return fileErrorRate.getWindowRate();
    }

    public synchronized long getDuration() {
        if (startTime == 0) return 0;
        long last = endTime > 0 ? endTime : System.currentTimeMillis();
        return last - startTime;
    }

    public synchronized String getStatsString() {
        double secs = getDuration() / 1000.0;
        double mbRate = secs > 0 ? totalBytes / 1048576.0 / secs : 0;
        StringBuilder summary = new StringBuilder();
        summary.append(MessageFormat.format("Import mode: {0}{1}\n", importMode, dryRun ? " (dry run)" : ""));
        summary.append(MessageFormat.format("Target: {0}/M{1}\n", groupName, String.format("%02X", storePathIndex)));
        summary.append(MessageFormat.format("Total files: {0,number,#}  Processed: {1,number,#}\n", total, processed));
        summary.append(MessageFormat.format("Success: {0,number,#}  Failed: {1,number,#}  Skipped: {2,number,#}\n",
                success, failed, skipped));
        summary.append(MessageFormat.format("Total bytes: {0,number,#} ({1})\n", totalBytes, ImportUtil.formatBytes(totalBytes)));
        summary.append(MessageFormat.format("Duration: {0,number,#.###} seconds ({1,number,#.##} MB/s)\n", secs, mbRate));
        if (!failedObjects.isEmpty()) summary.append(MessageFormat.format("Failed files: {0}\n", failedObjects));
        return summary.toString();
    }

    public String getGroupName() {
        return groupName;
    }

    public int getStorePathIndex() {
        return storePathIndex;
    }

    public ImportMode getImportMode() {
        return importMode;
    }

    public boolean isChecksumEnabled() {
        return checksumEnabled;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public long getTotal() {
        return total;
    }

    public synchronized long getProcessed() {
        return processed;
    }

    public synchronized long getSuccess() {
        return success;
    }

    public synchronized long getFailed() {
        return failed;
    }

    public synchronized long getSkipped() {
        return skipped;
    }

    public synchronized long getTotalBytes() {
        return totalBytes;
    }

    public synchronized long getStartTime() {
        return startTime;
    }

    /**
     * @return 0 until every record has been counted
     */
    public synchronized long getEndTime() {
        return endTime;
    }

    public synchronized List<FailedObject> getFailedObjects() {
        return new ArrayList<>(failedObjects);
    }
}
