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
import com.emc.ecs.bulkimport.model.FileRecord;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import com.emc.ecs.bulkimport.service.IndexRecord;
import com.emc.ecs.bulkimport.service.IndexService;
import com.emc.ecs.bulkimport.service.IndexUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Date;

/**
 * Registers a placed file in the index. A failure here means the bytes are on disk but unreachable, so the message
 * always names the final path for reconciliation.
 */
public class IndexUpdater {
    private static final Logger log = LoggerFactory.getLogger(IndexUpdater.class);

    private final IndexService indexService;

    public IndexUpdater(IndexService indexService) {
        this.indexService = indexService;
    }

    public StageResult<Void> update(FileRecord record, ImportMode importMode) {
        if (record.getIdentifier() == null)
            throw new IllegalStateException("no file ID assigned to " + record.getSourcePath());

        IndexRecord indexRecord = toIndexRecord(record, importMode);
        try {
            if (!indexService.insertIfAbsent(indexRecord)) {
                return StageResult.error(ImportError.INDEX_UPDATE, "file ID " + record.getIdentifier()
                        + " is already registered; orphaned file at " + record.getFinalPath());
            }
        } catch (IndexUnavailableException e) {
            log.error("could not register {} (file is at {})", record.getIdentifier(), record.getFinalPath(), e);
            return StageResult.error(ImportError.INDEX_UPDATE, "index unavailable (" + e.getMessage()
                    + "); orphaned file at " + record.getFinalPath());
        }
        log.debug("index updated for file ID {}, size: {}, crc32: {}",
                record.getIdentifier(), record.getSize(), record.getChecksum());
        return StageResult.ok();
    }

    static IndexRecord toIndexRecord(FileRecord record, ImportMode importMode) {
        IndexRecord indexRecord = new IndexRecord();
        indexRecord.setFileId(record.getIdentifier());
        indexRecord.setSourcePath(record.getSourcePath());
        indexRecord.setGroupName(record.getGroupName());
        indexRecord.setStorePathIndex(record.getStorePathIndex());
        indexRecord.setFullPath(record.getFinalPath());
        indexRecord.setSize(record.getSize());
        indexRecord.setCrc32(record.getChecksum());
        indexRecord.setCreateTime(new Date(record.getCreateTime()));
        indexRecord.setModifyTime(new Date(record.getModifyTime()));
        indexRecord.setImportTime(new Date());
        indexRecord.setExtName(record.getExtension());
        indexRecord.setImportMode(importMode.name());
        return indexRecord;
    }
}
