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

import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlRootElement;
import javax.xml.bind.annotation.XmlType;

/**
 * Root of an import job. Can be built in code, parsed from the command line or unmarshalled from an XML job file.
 */
@XmlRootElement
@XmlType(propOrder = {"jobName", "options", "storage", "sources"})
public class ImportConfig {
    private String jobName;
    private ImportOptions options = new ImportOptions();
    private StorageConfig storage = new StorageConfig();
    private String[] sources;

    public String getJobName() {
        return jobName;
    }

    public void setJobName(String jobName) {
        this.jobName = jobName;
    }

    public ImportOptions getOptions() {
        return options;
    }

    public void setOptions(ImportOptions options) {
        this.options = options;
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage;
    }

    /**
     * Files and/or directories to import, in addition to any source list file
     */
    @XmlElement(name = "source")
    public String[] getSources() {
        return sources;
    }

    public void setSources(String[] sources) {
        this.sources = sources;
    }

    public ImportConfig withJobName(String jobName) {
        setJobName(jobName);
        return this;
    }

    public ImportConfig withOptions(ImportOptions options) {
        setOptions(options);
        return this;
    }

    public ImportConfig withStorage(StorageConfig storage) {
        setStorage(storage);
        return this;
    }

    public ImportConfig withSources(String... sources) {
        setSources(sources);
        return this;
    }
}
