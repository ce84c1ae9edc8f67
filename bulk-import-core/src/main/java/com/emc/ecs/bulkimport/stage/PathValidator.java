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

import com.emc.ecs.bulkimport.config.ImportOptions;
import com.emc.ecs.bulkimport.model.ImportError;
import com.emc.ecs.bulkimport.model.StageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides whether a source path may be imported. Never modifies anything, so it is safe in dry-run mode.
 * <p>
 * Checks run in a fixed order and the first failing check decides the error: empty or over-length path, path
 * outside the import roots (INVALID_PATH), missing file (FILE_NOT_FOUND), symlink/directory/device (INVALID_PATH),
 * unreadable (PERMISSION), over the size limit (FILE_TOO_LARGE).
 */
public class PathValidator {
    private static final Logger log = LoggerFactory.getLogger(PathValidator.class);

    public static final int MAX_PATH_LENGTH = 255;

    private final List<Path> importRoots;
    private final long maxFileSize;
    private final boolean followSymlinks;

    public PathValidator(ImportOptions options) {
        this(toPaths(options.getImportRoots()), options.getMaxFileSize(), options.isFollowSymlinks());
    }

    public PathValidator(List<Path> importRoots, long maxFileSize, boolean followSymlinks) {
        List<Path> roots = new ArrayList<>();
        if (importRoots != null) {
            for (Path root : importRoots) {
                roots.add(root.toAbsolutePath().normalize());
            }
        }
        this.importRoots = Collections.unmodifiableList(roots);
        this.maxFileSize = maxFileSize;
        this.followSymlinks = followSymlinks;
    }

    private static List<Path> toPaths(String[] roots) {
        List<Path> paths = new ArrayList<>();
        if (roots != null) {
            for (String root : roots) {
                paths.add(Paths.get(root));
            }
        }
        return paths;
    }

    /**
     * @return the absolute, normalized path on success
     */
    public StageResult<Path> validate(String sourcePath) {
        if (sourcePath == null || sourcePath.trim().isEmpty())
            return StageResult.error(ImportError.INVALID_PATH, "path is empty");
        if (sourcePath.length() > MAX_PATH_LENGTH)
            return StageResult.error(ImportError.INVALID_PATH,
                    "path is longer than " + MAX_PATH_LENGTH + " characters: " + sourcePath.length());

        Path path;
        try {
            path = Paths.get(sourcePath).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            return StageResult.error(ImportError.INVALID_PATH, e.getMessage());
        }

        if (!isWithinRoots(path))
            return StageResult.error(ImportError.INVALID_PATH, path + " is outside the import roots " + importRoots);

        LinkOption[] linkOptions = followSymlinks ? new LinkOption[0] : new LinkOption[]{LinkOption.NOFOLLOW_LINKS};
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class, linkOptions);
        } catch (NoSuchFileException e) {
            return StageResult.error(ImportError.FILE_NOT_FOUND, path + " does not exist");
        } catch (IOException e) {
            log.debug("could not stat {}", path, e);
            return StageResult.error(ImportError.PERMISSION, "cannot stat " + path + ": " + e);
        }

        if (attributes.isSymbolicLink())
            return StageResult.error(ImportError.INVALID_PATH, path + " is a symbolic link");
        if (attributes.isDirectory())
            return StageResult.error(ImportError.INVALID_PATH, path + " is a directory");
        if (!attributes.isRegularFile())
            return StageResult.error(ImportError.INVALID_PATH, path + " is not a regular file");

        if (followSymlinks && !importRoots.isEmpty()) {
            // the link target must stay inside the roots too
            try {
                Path realPath = path.toRealPath();
                if (!isWithinRoots(realPath) && !isWithinRealRoots(realPath))
                    return StageResult.error(ImportError.INVALID_PATH, path + " resolves outside the import roots");
            } catch (IOException e) {
                return StageResult.error(ImportError.FILE_NOT_FOUND, "cannot resolve " + path + ": " + e);
            }
        }

        if (!isReadable(path))
            return StageResult.error(ImportError.PERMISSION, path + " is not readable");

        if (attributes.size() > maxFileSize)
            return StageResult.error(ImportError.FILE_TOO_LARGE,
                    path + " is " + attributes.size() + " bytes (limit " + maxFileSize + ")");

        return StageResult.ok(path);
    }

    protected boolean isReadable(Path path) {
        return Files.isReadable(path);
    }

    private boolean isWithinRoots(Path path) {
        if (importRoots.isEmpty()) return true;
        for (Path root : importRoots) {
            if (path.startsWith(root)) return true;
        }
        return false;
    }

    private boolean isWithinRealRoots(Path realPath) {
        for (Path root : importRoots) {
            try {
                if (realPath.startsWith(root.toRealPath())) return true;
            } catch (IOException e) {
                log.debug("import root {} cannot be resolved", root, e);
            }
        }
        return false;
    }

    public List<Path> getImportRoots() {
        return importRoots;
    }

    public long getMaxFileSize() {
        return maxFileSize;
    }

    public boolean isFollowSymlinks() {
        return followSymlinks;
    }
}
