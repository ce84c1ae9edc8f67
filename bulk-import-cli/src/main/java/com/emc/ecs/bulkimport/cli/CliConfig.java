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
package com.emc.ecs.bulkimport.cli;

import com.emc.ecs.bulkimport.config.LogLevel;
import com.emc.ecs.bulkimport.config.annotation.Option;

public class CliConfig {
    private boolean help;
    private boolean version;
    private String xmlConfig;
    private LogLevel logLevel;
    private int perfReportSeconds;
    private String output;

    @Option(orderIndex = 1, description = "Displays this help content")
    public boolean isHelp() {
        return help;
    }

    public void setHelp(boolean help) {
        this.help = help;
    }

    @Option(orderIndex = 2, description = "Displays package version")
    public boolean isVersion() {
        return version;
    }

    public void setVersion(boolean version) {
        this.version = version;
    }

    @Option(orderIndex = 3, valueHint = "xml-file", description = "Specifies an XML configuration file. In this mode, the XML file contains all of the configuration for the import job (options, storage node and sources). In this mode, most other CLI arguments are ignored.")
    public String getXmlConfig() {
        return xmlConfig;
    }

    public void setXmlConfig(String xmlConfig) {
        this.xmlConfig = xmlConfig;
    }

    @Option(orderIndex = 4, description = "Sets the verbosity of logging (silent|quiet|verbose|debug|trace). Default is quiet")
    public LogLevel getLogLevel() {
        return logLevel;
    }

    public void setLogLevel(LogLevel logLevel) {
        this.logLevel = logLevel;
    }

    @Option(orderIndex = 5, valueHint = "seconds", description = "Report file completion and error rates every <x> seconds to INFO logging.  Default is off (0)")
    public int getPerfReportSeconds() {
        return perfReportSeconds;
    }

    public void setPerfReportSeconds(int perfReportSeconds) {
        this.perfReportSeconds = perfReportSeconds;
    }

    @Option(orderIndex = 6, valueHint = "mapping-file", description = "Writes a tab-separated mapping of every source file to its file ID (with size, CRC32, status and error) to this file, in input order")
    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }
}
