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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates one restoration job, from staging the input to resolving the artifact. */
public class RestorationService {
    private static final Logger logger = LoggerFactory.getLogger(RestorationService.class);

    private final JobLauncher launcher;
    private final JobListener listener;

    public static class RestorationServiceBuilder {
        private JobLauncher launcher;
        private JobListener listener = JobListener.silent();

        public RestorationServiceBuilder withLauncher(JobLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public RestorationServiceBuilder withListener(JobListener listener) {
            this.listener = listener;
            return this;
        }

        public RestorationService build() {
            if (launcher == null) {
                throw new IllegalStateException(
                        "JobLauncher must be provided via withLauncher(...) before building RestorationService");
            }
            return new RestorationService(this);
        }
    }

    private RestorationService(RestorationServiceBuilder builder) {
        this.launcher = builder.launcher;
        this.listener = builder.listener;
    }

    /**
     * Runs {@code request} to completion. Blocks for as long as the worker runs; never call this
     * on the interface thread.
     *
     * @return the artifact, or the failure that stopped the job
     */
    public JobResult execute(JobRequest request) {
        listener.onPhaseStart("Staging input");
        if (!Files.exists(request.inputPath())) {
            return fail(
                    JobResult.failure(
                            FailureKind.STAGING_FAILURE, "Input not found: " + request.inputPath()));
        }

        StagedInput staged;
        try {
            Files.createDirectories(request.outputDirectory());
            staged = InputStager.stage(request.inputPath(), request.outputDirectory());
            InputStager.clearWorkerOutputs(request.outputDirectory(), staged);
        } catch (IOException e) {
            logger.error("Staging {} failed", request.inputPath(), e);
            return fail(
                    JobResult.failure(
                            FailureKind.STAGING_FAILURE,
                            "Could not prepare input: " + e.getMessage(),
                            e));
        }
        if (staged.owned()) {
            listener.onInfo("Staged single image into " + staged.directory());
        }

        listener.onPhaseStart("Running worker");
        JobResult result = launcher.run(request, staged, listener);
        if (!result.isSuccess()) {
            return fail(result);
        }

        listener.onSuccess("Output: " + result.outputFile());
        return result;
    }

    private JobResult fail(JobResult result) {
        listener.onError(result.describeFailure());
        return result;
    }
}
