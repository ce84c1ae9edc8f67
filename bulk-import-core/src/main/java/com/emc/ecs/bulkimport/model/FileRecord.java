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

/**
 * One source file moving through the import pipeline. A record is owned by a single worker at a time; the state
 * transition methods enforce INIT -> PROCESSING -> {SUCCESS | FAILED | SKIPPED} (INIT may also go straight to
 * SKIPPED when a batch is aborted or cancelled before the record starts).
 * <p>
 * The error code is {@link ImportError#NONE} exactly when the record succeeded or has not finished yet.
 */
public class FileRecord {
    private final long listRowNum;
    private final String sourcePath;
    private String groupName;
    private int storePathIndex;
    private String identifier;
    private long size;
    private Long checksum;
    private long createTime;
    private long modifyTime;
    private String extension;
    private String finalPath;
    private RecordStatus status = RecordStatus.INIT;
    private ImportError errorCode = ImportError.NONE;
    private String errorMessage;

    /**
     * @param listRowNum 1-based position of this record in the batch input
     */
    public FileRecord(long listRowNum, String sourcePath) {
        this.listRowNum = listRowNum;
        this.sourcePath = sourcePath;
    }

    public synchronized void startProcessing() {
        if (status != RecordStatus.INIT)
            throw new IllegalStateException(sourcePath + " cannot start processing from status " + status);
        status = RecordStatus.PROCESSING;
    }

    public synchronized void succeed() {
        requireProcessing(RecordStatus.SUCCESS);
        status = RecordStatus.SUCCESS;
        errorCode = ImportError.NONE;
        errorMessage = null;
    }

    public synchronized void fail(ImportError error, String message) {
        requireProcessing(RecordStatus.FAILED);
        requireError(error);
        status = RecordStatus.FAILED;
        errorCode = error;
        errorMessage = message;
    }

    public void fail(StageResult<?> result) {
        fail(result.getError(), result.getMessage());
    }

    public synchronized void skip(ImportError reason, String message) {
        if (status.isTerminal())
            throw new IllegalStateException(sourcePath + " is already " + status);
        requireError(reason);
        status = RecordStatus.SKIPPED;
        errorCode = reason;
        errorMessage = message;
    }

    /**
     * Copies the captured metadata into the record. Only valid while processing.
     */
    public synchronized void applyMetadata(FileMetadata metadata) {
        requireProcessing(status);
        this.size = metadata.getSize();
        this.modifyTime = metadata.getModifyTime();
        this.createTime = metadata.getChangeTime();
        this.checksum = metadata.getChecksum();
        this.extension = metadata.getExtension();
    }

    public synchronized void assignIdentifier(String groupName, int storePathIndex, String identifier) {
        requireProcessing(status);
        if (this.identifier != null) throw new IllegalStateException(sourcePath + " already has file ID " + this.identifier);
        this.groupName = groupName;
        this.storePathIndex = storePathIndex;
        this.identifier = identifier;
    }

    private void requireProcessing(RecordStatus target) {
        if (status != RecordStatus.PROCESSING)
            throw new IllegalStateException(sourcePath + " cannot move to " + target + " from status " + status);
    }

    private void requireError(ImportError error) {
        if (error == null || error == ImportError.NONE)
            throw new IllegalArgumentException("an error code is required");
    }

    public long getListRowNum() {
        return listRowNum;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public synchronized String getGroupName() {
        return groupName;
    }

    public synchronized int getStorePathIndex() {
        return storePathIndex;
    }

    public synchronized String getIdentifier() {
        return identifier;
    }

    public synchronized long getSize() {
        return size;
    }

    public synchronized Long getChecksum() {
        return checksum;
    }

    public synchronized long getCreateTime() {
        return createTime;
    }

    public synchronized long getModifyTime() {
        return modifyTime;
    }

    public synchronized String getExtension() {
        return extension;
    }

    public synchronized String getFinalPath() {
        return finalPath;
    }

    public synchronized void setFinalPath(String finalPath) {
        this.finalPath = finalPath;
    }

    public synchronized RecordStatus getStatus() {
        return status;
    }

    public synchronized ImportError getErrorCode() {
        return errorCode;
    }

    public synchronized String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public synchronized String toString() {
        return "FileRecord{#" + listRowNum + " " + sourcePath + " -> " + identifier + ", status=" + status
                + (errorCode == ImportError.NONE ? "" : ", error=" + errorCode + ": " + errorMessage) + "}";
    }
}
