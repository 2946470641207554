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
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the user's selection into a directory the worker can consume. Directories pass through
 * untouched; a single file is copied into a freshly rebuilt scratch directory under the output
 * root. Also empties the worker's own output directories before each launch.
 *
 * <p>The worker runs in its installation root, so every directory handed out here is absolute.
 */
public final class InputStager {
    private static final Logger logger = LoggerFactory.getLogger(InputStager.class);

    private InputStager() {}

    /**
     * Stages {@code input} for a job writing under {@code outputRoot}.
     *
     * @throws IOException if the scratch directory cannot be cleared, created, or filled
     */
    public static StagedInput stage(Path input, Path outputRoot) throws IOException {
        if (Files.isDirectory(input)) {
            Path directory = input.toAbsolutePath().normalize();
            logger.debug("Input {} is a directory; using {} as is", input, directory);
            return StagedInput.alias(directory);
        }
        if (!Files.isRegularFile(input)) {
            throw new IOException("Input is neither a file nor a directory: " + input);
        }

        Path scratch = outputRoot.resolve(JobLayout.STAGING_DIR).toAbsolutePath().normalize();
        Path source = input.toAbsolutePath().normalize();
        if (source.startsWith(scratch)) {
            throw new IOException(
                    "Input " + input + " lives inside the staging directory and would be deleted");
        }

        if (Files.exists(scratch)) {
            logger.debug("Clearing previous staging directory {}", scratch);
            deleteRecursively(scratch);
        }
        Files.createDirectories(scratch);

        Path target = scratch.resolve(source.getFileName().toString());
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        logger.info("Staged {} into {}", source.getFileName(), scratch);
        return StagedInput.scratch(scratch);
    }

    /**
     * Empties and recreates each of {@link JobLayout#WORKER_OUTPUT_DIRS} under {@code outputRoot}.
     * Nothing else under the output root is touched.
     *
     * @throws IOException if {@code staged} lies inside one of those directories, or if a
     *     directory cannot be cleared or created
     */
    public static void clearWorkerOutputs(Path outputRoot, StagedInput staged) throws IOException {
        Path root = outputRoot.toAbsolutePath().normalize();
        for (String name : JobLayout.WORKER_OUTPUT_DIRS) {
            Path dir = root.resolve(name);
            if (staged.directory().startsWith(dir)) {
                throw new IOException(
                        "Input " + staged.directory() + " lives inside the worker output directory "
                                + dir + " and would be deleted");
            }
        }
        for (String name : JobLayout.WORKER_OUTPUT_DIRS) {
            Path dir = root.resolve(name);
            if (Files.exists(dir)) {
                logger.debug("Clearing worker output directory {}", dir);
                deleteRecursively(dir);
            }
            Files.createDirectories(dir);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        Files.walkFileTree(
                root,
                new SimpleFileVisitor<>() {
                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs)
                            throws IOException {
                        Files.delete(file);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc)
                            throws IOException {
                        if (exc != null) {
                            throw exc;
                        }
                        Files.delete(dir);
                        return FileVisitResult.CONTINUE;
                    }
                });
    }
}
