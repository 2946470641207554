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
 * Everything needed to run the worker once. Built fresh for every run trigger.
 *
 * @param inputPath a single image or a directory of images
 * @param outputDirectory the output root; created if absent
 * @param device accelerator selection
 * @param repairScratches pass {@code --with_scratch} to the worker
 * @param highResolution pass {@code --HR} to the worker
 */
public record JobRequest(
        Path inputPath,
        Path outputDirectory,
        DeviceSelector device,
        boolean repairScratches,
        boolean highResolution) {
    public JobRequest {
        if (inputPath == null) {
            throw new IllegalArgumentException("Input path is required");
        }
        if (outputDirectory == null) {
            throw new IllegalArgumentException("Output directory is required");
        }
        if (device == null) {
            throw new IllegalArgumentException("Device selector is required");
        }
    }

    /** Directory the worker writes its final images into. */
    public Path resultsDirectory() {
        return outputDirectory.resolve(JobLayout.RESULTS_DIR);
    }
}
