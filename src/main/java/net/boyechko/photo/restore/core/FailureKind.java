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

/** Why a restoration job did not produce a result. */
public enum FailureKind {
    /** Preparing the input for the worker failed; no worker was launched. */
    STAGING_FAILURE("Staging failed"),

    /** The worker executable or entry point is missing or cannot be started. */
    WORKER_UNAVAILABLE("Worker unavailable"),

    /** The worker ran and exited with a nonzero status. */
    WORKER_FAILED("Worker failed"),

    /** The worker exited cleanly but left nothing in the results directory. */
    NO_ARTIFACT_FOUND("No output found"),

    /** A programming error escaped the job. */
    UNEXPECTED("Unexpected error");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
