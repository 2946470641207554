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
 * Outcome of one restoration job: either the resolved output file or a failure, never both.
 *
 * @param outputFile the artifact picked from the results directory, or null on failure
 * @param failureKind why the job failed, or null on success
 * @param message human-readable failure description, or null on success
 * @param cause the underlying exception if there was one
 */
public record JobResult(Path outputFile, FailureKind failureKind, String message, Throwable cause) {
    public JobResult {
        if ((outputFile == null) == (failureKind == null)) {
            throw new IllegalArgumentException(
                    "Exactly one of output file and failure kind must be set");
        }
    }

    public static JobResult success(Path outputFile) {
        return new JobResult(outputFile, null, null, null);
    }

    public static JobResult failure(FailureKind kind, String message) {
        return new JobResult(null, kind, message, null);
    }

    public static JobResult failure(FailureKind kind, String message, Throwable cause) {
        return new JobResult(null, kind, message, cause);
    }

    public boolean isSuccess() {
        return outputFile != null;
    }

    /** Failure text prefixed with the kind's label, suitable for an error dialog. */
    public String describeFailure() {
        if (isSuccess()) {
            return "";
        }
        return message == null ? failureKind.label() : failureKind.label() + ": " + message;
    }
}
