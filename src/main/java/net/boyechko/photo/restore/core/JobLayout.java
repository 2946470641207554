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

import java.util.List;

/** Well-known subdirectories of the output root shared with the worker. */
public final class JobLayout {
    private JobLayout() {}

    /** Scratch directory holding a single staged input image. */
    public static final String STAGING_DIR = "_gui_input";

    /** Where the worker leaves its final images. */
    public static final String RESULTS_DIR = "final_output";

    /**
     * Directories the worker writes into, results last. All of them are emptied before every
     * launch so a run can only ever report its own output.
     */
    public static final List<String> WORKER_OUTPUT_DIRS =
            List.of(
                    "stage_1_restore_output",
                    "stage_2_detection_output",
                    "stage_3_face_output",
                    RESULTS_DIR);
}
