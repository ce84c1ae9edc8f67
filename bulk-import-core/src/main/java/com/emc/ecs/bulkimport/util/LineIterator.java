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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;

/**
 * Reads a source list: one path per line. Surrounding white space is trimmed, blank lines are skipped and
 * <code>#</code> starts a comment unless escaped (<code>file\#1.jpg</code>). "-" reads the list from STDIN.
 */
public class LineIterator extends ReadOnlyIterator<String> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LineIterator.class);

    private final BufferedReader br;
    private final boolean closeReader;
    private int currentLine = 0;

    public LineIterator(String file) {
        try {
            if ("-".equals(file)) {
                br = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
                closeReader = false;
            } else {
                br = Files.newBufferedReader(Paths.get(file), StandardCharsets.UTF_8);
                closeReader = true;
            }
        } catch (NoSuchFileException e) {
            throw new IllegalArgumentException("Source list file not found: " + file, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not open source list file " + file, e);
        }
    }

    /**
     * Note: this class will *not* close the stream; you must handle that in calling code
     */
    public LineIterator(InputStream stream) {
        br = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        closeReader = false;
    }

    @Override
    protected String getNextObject() {
        try {
            String line;
            do {
                line = br.readLine();
                if (line == null) break;
                currentLine++;
                // drop an unescaped comment, then unescape any literal hashes
                line = line.replaceFirst("^((?:\\\\#|[^#])*)(?<!\\\\)#.*$", "$1");
                line = line.trim().replace("\\#", "#");
            } while (line.length() == 0);

            if (line == null) {
                log.debug("end of source list reached after {} lines", currentLine);
                close();
            }
            return line;
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading source list", e);
        }
    }

    @Override
    public void close() {
        if (!closeReader) return;
        try {
            br.close();
        } catch (IOException e) {
            log.warn("could not close source list", e);
        }
    }

    public int getCurrentLine() {
        return currentLine;
    }
}
