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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * How to reach the external restoration worker.
 *
 * @param installRoot the worker's installation root; also its working directory
 * @param interpreter program used to run the entry point (e.g. {@code python3}), or null to
 *     execute the entry point directly
 * @param entryPoint the worker script or executable, relative to the installation root
 */
public record WorkerCommand(Path installRoot, String interpreter, Path entryPoint) {
    public WorkerCommand {
        if (installRoot == null) {
            throw new IllegalArgumentException("Installation root is required");
        }
        if (entryPoint == null) {
            throw new IllegalArgumentException("Worker entry point is required");
        }
        if (interpreter != null && interpreter.isBlank()) {
            interpreter = null;
        }
    }

    public Path resolvedEntryPoint() {
        return installRoot.resolve(entryPoint);
    }

    /** The program prefix of every invocation, before any job arguments. */
    List<String> prefix() {
        List<String> command = new ArrayList<>();
        if (interpreter != null) {
            command.add(interpreter);
        }
        command.add(resolvedEntryPoint().toString());
        return command;
    }
}
