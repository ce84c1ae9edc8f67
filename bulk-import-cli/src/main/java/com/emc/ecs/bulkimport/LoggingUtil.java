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

import com.emc.ecs.bulkimport.config.LogLevel;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps the CLI log levels onto Log4j 2 and the JDK logger (used by some JDBC drivers).
 */
public final class LoggingUtil {
    private static final Logger log = LoggerFactory.getLogger(LoggingUtil.class);

    private static final Map<LogLevel, Level> log4jLevels = new EnumMap<>(LogLevel.class);
    private static final Map<LogLevel, java.util.logging.Level> jdkLevels = new EnumMap<>(LogLevel.class);

    static {
        map(LogLevel.trace, Level.TRACE, java.util.logging.Level.FINEST);
        map(LogLevel.debug, Level.DEBUG, java.util.logging.Level.FINE);
        map(LogLevel.verbose, Level.INFO, java.util.logging.Level.INFO);
        map(LogLevel.quiet, Level.WARN, java.util.logging.Level.WARNING);
        map(LogLevel.silent, Level.ERROR, java.util.logging.Level.SEVERE);
    }

    private static void map(LogLevel logLevel, Level log4jLevel, java.util.logging.Level jdkLevel) {
        log4jLevels.put(logLevel, log4jLevel);
        jdkLevels.put(logLevel, jdkLevel);
    }

    static Level toLog4jLevel(LogLevel logLevel) {
        return log4jLevels.get(logLevel);
    }

    // only takes effect when the SLF4J binding is log4j2
    public static void setRootLogLevel(LogLevel logLevel) {
        if (logLevel == null) return;
        try {
            Configurator.setRootLevel(log4jLevels.get(logLevel));
            java.util.logging.LogManager.getLogManager().getLogger("").setLevel(jdkLevels.get(logLevel));
            log.debug("root log level set to {}", logLevel);
        } catch (RuntimeException | LinkageError e) {
            log.warn("could not configure log4j (perhaps you're using a different logger, which is fine)", e);
        }
    }

    private LoggingUtil() {
    }
}
