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

/**
 * A directory holding exactly the images the worker should consume.
 *
 * @param directory the directory handed to {@code --input_folder}
 * @param owned true if this is the scratch directory created for a single file, false if it is
 *     the user's own directory
 */
public record StagedInput(Path directory, boolean owned) {
    public StagedInput {
        if (directory == null) {
            throw new IllegalArgumentException("Staged directory is required");
        }
    }

    static StagedInput alias(Path directory) {
        return new StagedInput(directory, false);
    }

    static StagedInput scratch(Path directory) {
        return new StagedInput(directory, true);
    }
}
