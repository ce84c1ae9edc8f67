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

import com.emc.ecs.bulkimport.config.ConfigUtil;
import com.emc.ecs.bulkimport.config.ConfigWrapper;
import com.emc.ecs.bulkimport.config.ImportConfig;
import com.emc.ecs.bulkimport.config.ImportOptions;
import com.emc.ecs.bulkimport.config.StorageConfig;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.io.StringWriter;

public final class CliHelper {
    private static final CommandLineParser parser = new DefaultParser();

    /**
     * @return null if help or version was requested (help is printed here)
     */
    public static CliConfig parseCliConfig(String[] args) throws ParseException {
        ConfigWrapper<CliConfig> wrapper = ConfigUtil.wrapperFor(CliConfig.class);
        CommandLine commandLine = parser.parse(wrapper.getOptions(), args, true);
        CliConfig cliConfig = wrapper.parse(commandLine);

        if (cliConfig.isHelp() || cliConfig.isVersion()) {
            if (cliConfig.isHelp()) System.out.print(longHelp());
            return null;
        }
        return cliConfig;
    }

    /**
     * Parses the full command line into an import config. Remaining (non-option) arguments are the sources. CLI
     * options that appear after import options are applied to <code>cliConfig</code> as well.
     */
    public static ImportConfig parseImportConfig(CliConfig cliConfig, String[] args) throws ParseException {
        Options options = allOptions();

        // parse the command line
        CommandLine commandLine = parser.parse(options, args);

        CliConfig lateConfig = ConfigUtil.wrapperFor(CliConfig.class).parse(commandLine);
        if (lateConfig.getLogLevel() != null) cliConfig.setLogLevel(lateConfig.getLogLevel());
        if (lateConfig.getPerfReportSeconds() > 0) cliConfig.setPerfReportSeconds(lateConfig.getPerfReportSeconds());
        if (lateConfig.getOutput() != null) cliConfig.setOutput(lateConfig.getOutput());

        // map parsed command line to config objects
        ImportConfig importConfig = new ImportConfig();
        importConfig.setOptions(ConfigUtil.wrapperFor(ImportOptions.class).parse(commandLine));
        importConfig.setStorage(ConfigUtil.wrapperFor(StorageConfig.class).parse(commandLine));
        importConfig.setSources(commandLine.getArgs());
        return importConfig;
    }

    private static Options allOptions() {
        // main CLI options
        Options options = ConfigUtil.wrapperFor(CliConfig.class).getOptions();

        // import options
        for (Option o : ConfigUtil.wrapperFor(ImportOptions.class).getOptions().getOptions()) {
            options.addOption(o);
        }

        // storage node options
        for (Option o : ConfigUtil.wrapperFor(StorageConfig.class).getOptions().getOptions()) {
            options.addOption(o);
        }
        return options;
    }

    public static String longHelp() {
        StringWriter helpWriter = new StringWriter();
        PrintWriter pw = new PrintWriter(helpWriter);
        HelpFormatter fmt = new HelpFormatter();
        fmt.setWidth(79);

        String usage = "java -jar bulk-import.jar --group-name <group> --store-paths <path>... [options] [--] <source>...";
        fmt.printHelp(pw, fmt.getWidth(), usage, "Common options:",
                ConfigUtil.wrapperFor(CliConfig.class).getOptions(), fmt.getLeftPadding(), fmt.getDescPadding(), null);

        ConfigWrapper<ImportOptions> optionsWrapper = ConfigUtil.wrapperFor(ImportOptions.class);
        pw.write('\n');
        pw.write(optionsWrapper.getLabel() + "\n");
        fmt.printOptions(pw, fmt.getWidth(), optionsWrapper.getOptions(false), fmt.getLeftPadding(), fmt.getDescPadding());
        pw.write('\n');
        pw.write("Advanced Options\n");
        fmt.printOptions(pw, fmt.getWidth(), optionsWrapper.getOptions(true), fmt.getLeftPadding(), fmt.getDescPadding());

        ConfigWrapper<StorageConfig> storageWrapper = ConfigUtil.wrapperFor(StorageConfig.class);
        pw.write('\n');
        pw.write(storageWrapper.getLabel() + "\n");
        if (storageWrapper.getDocumentation() != null)
            fmt.printWrapped(pw, fmt.getWidth(), 4, "    " + storageWrapper.getDocumentation());
        fmt.printOptions(pw, fmt.getWidth(), storageWrapper.getOptions(), fmt.getLeftPadding(), fmt.getDescPadding());

        pw.write('\n');
        fmt.printWrapped(pw, fmt.getWidth(), 4, "Sources are files or directories (use --recursive to descend into sub-directories). "
                + "Put a lone -- before the sources when the last option takes multiple values (i.e. --store-paths).");
        pw.flush();

        return helpWriter.toString();
    }

    private CliHelper() {
    }
}
