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
package com.emc.ecs.bulkimport.util;

import java.text.MessageFormat;

public final class ImportUtil {
    public static Throwable getCause(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) cause = cause.getCause();
        return cause;
    }

    /**
     * One-line description of an exception and its root cause, suitable for a record's error detail.
     */
    public static String summarize(Throwable t) {
        Throwable cause = getCause(t);
        if (cause == t) return t.toString();
        return MessageFormat.format("[{0}] {1}", t, cause);
    }

    /**
     * Bytes as a human-readable string with two decimals (i.e. 1.50 GB)
     */
    public static String formatBytes(long bytes) {
        String[] units = {"B", "KB", "MB", "GB", "TB"};
        double value = bytes;
        int unit = 0;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        return unit == 0 ? bytes + " B" : String.format("%.2f %s", value, units[unit]);
    }

    private ImportUtil() {
    }
}
