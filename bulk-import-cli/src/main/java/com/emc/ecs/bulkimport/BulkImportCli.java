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

import com.emc.ecs.bulkimport.cli.CliConfig;
import com.emc.ecs.bulkimport.cli.CliHelper;
import com.emc.ecs.bulkimport.cli.MappingFileWriter;
import com.emc.ecs.bulkimport.config.ConfigurationException;
import com.emc.ecs.bulkimport.config.ImportConfig;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import java.io.File;
import java.nio.file.Paths;

public class BulkImportCli {
    private static final Logger log = LoggerFactory.getLogger(BulkImportCli.class);

    public static final String VERSION = BulkImport.class.getPackage().getImplementationVersion();

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONFIG_ERROR = 1;
    public static final int EXIT_UNEXPECTED_ERROR = 2;
    public static final int EXIT_FAILURES = 3;

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * @return the process exit code: 0 = completed with no failures, 1 = invalid options, 2 = unexpected error,
     * 3 = completed with some file failures or the batch was aborted
     */
    public static int run(String[] args) {
        int exitCode = EXIT_OK;

        System.out.println(versionLine());

        try {
            // first, hush up the JDK logger
            java.util.logging.LogManager.getLogManager().getLogger("").setLevel(java.util.logging.Level.WARNING);

            CliConfig cliConfig = CliHelper.parseCliConfig(args);

            if (cliConfig != null) {

                // determine import config
                ImportConfig importConfig;
                if (cliConfig.getXmlConfig() != null) {
                    importConfig = loadXmlFile(new File(cliConfig.getXmlConfig()));
                } else {
                    importConfig = CliHelper.parseImportConfig(cliConfig, args);
                }

                // configure logging
                if (cliConfig.getLogLevel() != null)
                    LoggingUtil.setRootLogLevel(cliConfig.getLogLevel());

                // create the import instance
                BulkImport bulkImport = new BulkImport();
                bulkImport.setImportConfig(importConfig);
                bulkImport.setPerfReportSeconds(cliConfig.getPerfReportSeconds());

                // start the batch (this blocks until every file is done)
                bulkImport.run();

                if (cliConfig.getOutput() != null)
                    new MappingFileWriter(Paths.get(cliConfig.getOutput())).write(bulkImport.getRecords());

                // print completion stats
                System.out.print(bulkImport.getContext().getStatsString());
                if (bulkImport.isBatchAborted()) {
                    System.err.println("Batch aborted: " + bulkImport.getBatchError().getMessage());
                    exitCode = EXIT_FAILURES;
                } else if (bulkImport.getContext().getFailed() > 0) {
                    exitCode = EXIT_FAILURES;
                }
            }
        } catch (ConfigurationException | ParseException e) {
            System.err.println(e.getMessage());
            System.out.println("    use --help for a detailed list of options");
            exitCode = EXIT_CONFIG_ERROR;
        } catch (Throwable t) {
            log.debug("unexpected error", t);
            t.printStackTrace();
            exitCode = EXIT_UNEXPECTED_ERROR;
        }

        return exitCode;
    }

    static ImportConfig loadXmlFile(File xmlFile) throws JAXBException {
        if (!xmlFile.isFile()) throw new ConfigurationException("XML config file " + xmlFile + " does not exist");
        return (ImportConfig) JAXBContext.newInstance(ImportConfig.class).createUnmarshaller().unmarshal(xmlFile);
    }

    private static String versionLine() {
        return BulkImport.class.getSimpleName() + (VERSION == null ? "" : " v" + VERSION);
    }
}
