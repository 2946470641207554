/*
 * Photo-Restore - Desktop front-end for old photo restoration
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.photo.restore.core;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks "the" result among the files a worker produced: the most recently modified regular file
 * whose name does not start with a dot.
 *
 * <p>When several files share the newest timestamp the lexicographically greatest file name wins.
 * Callers should not rely on that.
 */
public final class ArtifactResolver {
    private static final Logger logger = LoggerFactory.getLogger(ArtifactResolver.class);

    /** Reads a candidate's modification time. */
    @FunctionalInterface
    interface ModificationTimes {
        FileTime of(Path file) throws IOException;
    }

    private ArtifactResolver() {}

    /**
     * Returns the newest qualifying file in {@code dir}.
     *
     * @return empty if the directory is missing, is not a directory, or has no qualifying files
     * @throws IOException if an existing directory cannot be listed
     */
    public static Optional<Path> latest(Path dir) throws IOException {
        return latest(dir, Files::getLastModifiedTime);
    }

    static Optional<Path> latest(Path dir, ModificationTimes times) throws IOException {
        if (dir == null || !Files.isDirectory(dir)) {
            logger.debug("No results directory at {}", dir);
            return Optional.empty();
        }

        Path best = null;
        FileTime bestTime = null;
        try (Stream<Path> entries = Files.list(dir)) {
            for (Path candidate : (Iterable<Path>) entries::iterator) {
                if (!isCandidate(candidate)) {
                    continue;
                }
                FileTime modified;
                try {
                    modified = times.of(candidate);
                } catch (NoSuchFileException e) {
                    logger.debug("{} vanished while resolving; skipping", candidate);
                    continue;
                }
                if (best == null || isNewer(candidate, modified, best, bestTime)) {
                    best = candidate;
                    bestTime = modified;
                }
            }
        }

        logger.debug("Latest artifact in {}: {}", dir, best);
        return Optional.ofNullable(best);
    }

    private static boolean isCandidate(Path path) {
        Path name = path.getFileName();
        return name != null && !name.toString().startsWith(".") && Files.isRegularFile(path);
    }

    private static boolean isNewer(Path candidate, FileTime time, Path best, FileTime bestTime) {
        int cmp = time.compareTo(bestTime);
        if (cmp != 0) {
            return cmp > 0;
        }
        return candidate.getFileName().toString().compareTo(best.getFileName().toString()) > 0;
    }
}
