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
package com.emc.ecs.bulkimport.config;

import com.emc.ecs.bulkimport.config.annotation.Label;
import com.emc.ecs.bulkimport.config.annotation.Option;

import javax.xml.bind.annotation.XmlRootElement;

@XmlRootElement
@Label("Import Options")
public class ImportOptions {
    public static final String DB_DESC = "You must specify a DB connection string to use mySQL";

    public static final int DEFAULT_BUFFER_SIZE = 256 * 1024; // 256k
    public static final int DEFAULT_THREAD_COUNT = 4;
    public static final int MAX_THREAD_COUNT = 32;
    public static final long DEFAULT_MAX_FILE_SIZE = 1024L * 1024 * 1024; // 1GB
    public static final long DEFAULT_SPACE_SAFETY_MARGIN = 100L * 1024 * 1024; // 100MB
    public static final int DEFAULT_COLLISION_RETRIES = 10;
    public static final String DEFAULT_INDEX_TABLE = "file_index";

    private ImportMode importMode = ImportMode.copy;
    private boolean checksumEnabled = true;
    private boolean dryRun;
    private int threadCount = DEFAULT_THREAD_COUNT;
    private long maxFileSize = DEFAULT_MAX_FILE_SIZE;
    private long spaceSafetyMargin = DEFAULT_SPACE_SAFETY_MARGIN;
    private String[] importRoots;
    private boolean followSymlinks;
    private boolean recursive;
    private String sourceListFile;
    private boolean skipImported = true;
    private int collisionRetries = DEFAULT_COLLISION_RETRIES;
    private MoveFallbackTrigger moveFallbackTrigger = MoveFallbackTrigger.renameFailure;
    private int bufferSize = DEFAULT_BUFFER_SIZE;
    private boolean rememberFailed = true;

    private String indexDbFile;
    private String indexDbConnectString;
    private String indexDbEncPassword;
    private String indexTable = DEFAULT_INDEX_TABLE;

    @Option(orderIndex = 10, valueList = {"copy", "move"}, description = "Import mode. copy leaves the source file in place, move relocates it into the store path (rename when possible, otherwise copy and delete). Defaults to copy")
    public ImportMode getImportMode() {
        return importMode;
    }

    public void setImportMode(ImportMode importMode) {
        this.importMode = importMode;
    }

    @Option(orderIndex = 20, cliName = "no-crc32", cliInverted = true, description = "By default, a CRC32 checksum is computed for every file and verified after transfer. Use this option to skip the checksum (faster but less safe)")
    public boolean isChecksumEnabled() {
        return checksumEnabled;
    }

    public void setChecksumEnabled(boolean checksumEnabled) {
        this.checksumEnabled = checksumEnabled;
    }

    @Option(orderIndex = 30, description = "Validate only. Every file is validated, examined and assigned a file ID, but nothing is transferred and the index is not modified")
    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    @Option(orderIndex = 40, valueHint = "thread-count", description = "Number of worker threads that import files in parallel (1-" + MAX_THREAD_COUNT + "). Defaults to " + DEFAULT_THREAD_COUNT)
    public int getThreadCount() {
        return threadCount;
    }

    public void setThreadCount(int threadCount) {
        this.threadCount = threadCount;
    }

    @Option(orderIndex = 50, description = "Recursively import sub-directories of any directory source. Otherwise only the files directly inside a directory are imported")
    public boolean isRecursive() {
        return recursive;
    }

    public void setRecursive(boolean recursive) {
        this.recursive = recursive;
    }

    @Option(orderIndex = 60, valueHint = "path-to-file", description = "Path to a file that supplies the list of source files to import (one per line). Use - to read the list from STDIN. Comments (#) and blank lines are ignored")
    public String getSourceListFile() {
        return sourceListFile;
    }

    public void setSourceListFile(String sourceListFile) {
        this.sourceListFile = sourceListFile;
    }

    @Option(orderIndex = 70, valueHint = "bytes", description = "Files larger than this are rejected during validation. Defaults to 1GB")
    public long getMaxFileSize() {
        return maxFileSize;
    }

    public void setMaxFileSize(long maxFileSize) {
        this.maxFileSize = maxFileSize;
    }

    @Option(orderIndex = 80, valueHint = "path", description = "Restricts sources to these directories. Any source outside of the import roots is rejected as an invalid path. By default any path is allowed")
    public String[] getImportRoots() {
        return importRoots;
    }

    public void setImportRoots(String[] importRoots) {
        this.importRoots = importRoots;
    }

    @Option(orderIndex = 90, advanced = true, description = "Allow symbolic links as sources (the link target is imported). By default symbolic links are rejected")
    public boolean isFollowSymlinks() {
        return followSymlinks;
    }

    public void setFollowSymlinks(boolean followSymlinks) {
        this.followSymlinks = followSymlinks;
    }

    @Option(orderIndex = 100, cliName = "no-skip-imported", cliInverted = true, advanced = true, description = "By default, a source file that is already registered in the index with the same size and modification time is skipped. Use this option to import it again under a new file ID")
    public boolean isSkipImported() {
        return skipImported;
    }

    public void setSkipImported(boolean skipImported) {
        this.skipImported = skipImported;
    }

    @Option(orderIndex = 110, advanced = true, valueHint = "bytes", description = "Free space that must remain on the store path after a file is placed. Defaults to 100MB")
    public long getSpaceSafetyMargin() {
        return spaceSafetyMargin;
    }

    public void setSpaceSafetyMargin(long spaceSafetyMargin) {
        this.spaceSafetyMargin = spaceSafetyMargin;
    }

    @Option(orderIndex = 120, advanced = true, description = "How many times to generate a new file ID when a generated ID is already taken. Defaults to " + DEFAULT_COLLISION_RETRIES)
    public int getCollisionRetries() {
        return collisionRetries;
    }

    public void setCollisionRetries(int collisionRetries) {
        this.collisionRetries = collisionRetries;
    }

    @Option(orderIndex = 130, advanced = true, valueList = {"renameFailure", "fileStoreCheck"}, description = "When a move falls back to copy and delete. renameFailure tries a rename first, fileStoreCheck compares the source and destination file stores up front. Defaults to renameFailure")
    public MoveFallbackTrigger getMoveFallbackTrigger() {
        return moveFallbackTrigger;
    }

    public void setMoveFallbackTrigger(MoveFallbackTrigger moveFallbackTrigger) {
        this.moveFallbackTrigger = moveFallbackTrigger;
    }

    @Option(orderIndex = 140, advanced = true, valueHint = "buffer-size", description = "Sets the buffer size (in bytes) used to read and copy file data. Defaults to 256K")
    public int getBufferSize() {
        return bufferSize;
    }

    public void setBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
    }

    @Option(orderIndex = 150, cliName = "no-remember-failed", cliInverted = true, advanced = true, description = "By default, failed source paths are listed in the end-of-batch summary. Use this option to omit the list for very large batches")
    public boolean isRememberFailed() {
        return rememberFailed;
    }

    public void setRememberFailed(boolean rememberFailed) {
        this.rememberFailed = rememberFailed;
    }

    @Option(orderIndex = 160, valueHint = "path-to-db-file", description = "Path to the SQLite file index. The index is created if it does not exist. Ignored when --index-db-connect-string is set")
    public String getIndexDbFile() {
        return indexDbFile;
    }

    public void setIndexDbFile(String indexDbFile) {
        this.indexDbFile = indexDbFile;
    }

    @Option(orderIndex = 170, valueHint = "jdbc-connect-string", description = "Uses a MySQL file index with the given JDBC connect string (i.e. \"jdbc:mysql://localhost:3306/fdfs?user=foo&password=bar\")")
    public String getIndexDbConnectString() {
        return indexDbConnectString;
    }

    public void setIndexDbConnectString(String indexDbConnectString) {
        this.indexDbConnectString = indexDbConnectString;
    }

    @Option(orderIndex = 180, sensitive = true, valueHint = "encrypted-password", description = "Specifies the encrypted password for the MySQL file index")
    public String getIndexDbEncPassword() {
        return indexDbEncPassword;
    }

    public void setIndexDbEncPassword(String indexDbEncPassword) {
        this.indexDbEncPassword = indexDbEncPassword;
    }

    @Option(orderIndex = 190, advanced = true, valueHint = "table-name", description = "Name of the file index table. Defaults to " + DEFAULT_INDEX_TABLE)
    public String getIndexTable() {
        return indexTable;
    }

    public void setIndexTable(String indexTable) {
        this.indexTable = indexTable;
    }

    public ImportOptions withImportMode(ImportMode importMode) {
        setImportMode(importMode);
        return this;
    }

    public ImportOptions withChecksumEnabled(boolean checksumEnabled) {
        setChecksumEnabled(checksumEnabled);
        return this;
    }

    public ImportOptions withDryRun(boolean dryRun) {
        setDryRun(dryRun);
        return this;
    }

    public ImportOptions withThreadCount(int threadCount) {
        setThreadCount(threadCount);
        return this;
    }

    public ImportOptions withRecursive(boolean recursive) {
        setRecursive(recursive);
        return this;
    }

    public ImportOptions withSourceListFile(String sourceListFile) {
        setSourceListFile(sourceListFile);
        return this;
    }

    public ImportOptions withMaxFileSize(long maxFileSize) {
        setMaxFileSize(maxFileSize);
        return this;
    }

    public ImportOptions withImportRoots(String... importRoots) {
        setImportRoots(importRoots);
        return this;
    }

    public ImportOptions withFollowSymlinks(boolean followSymlinks) {
        setFollowSymlinks(followSymlinks);
        return this;
    }

    public ImportOptions withSkipImported(boolean skipImported) {
        setSkipImported(skipImported);
        return this;
    }

    public ImportOptions withRememberFailed(boolean rememberFailed) {
        setRememberFailed(rememberFailed);
        return this;
    }

    public ImportOptions withSpaceSafetyMargin(long spaceSafetyMargin) {
        setSpaceSafetyMargin(spaceSafetyMargin);
        return this;
    }

    public ImportOptions withCollisionRetries(int collisionRetries) {
        setCollisionRetries(collisionRetries);
        return this;
    }

    public ImportOptions withMoveFallbackTrigger(MoveFallbackTrigger moveFallbackTrigger) {
        setMoveFallbackTrigger(moveFallbackTrigger);
        return this;
    }

    public ImportOptions withBufferSize(int bufferSize) {
        setBufferSize(bufferSize);
        return this;
    }

    public ImportOptions withIndexDbFile(String indexDbFile) {
        setIndexDbFile(indexDbFile);
        return this;
    }

    public ImportOptions withIndexTable(String indexTable) {
        setIndexTable(indexTable);
        return this;
    }
}
