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
import java.nio.file.Path;
import java.util.List;

/**
 * Starts worker processes. Production code uses {@link #system()}; tests substitute a factory
 * returning scripted {@link Process} objects.
 */
@FunctionalInterface
public interface WorkerProcessFactory {
    /**
     * Starts {@code command} in {@code workingDir} with stderr merged into stdout.
     *
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;

    static WorkerProcessFactory system() {
        return (command, workingDir) ->
                new ProcessBuilder(command)
                        .directory(workingDir.toFile())
                        .redirectErrorStream(true)
                        .start();
    }
}
