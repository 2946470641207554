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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the external worker for one job and blocks until it exits. The worker is a black box: only
 * its exit code and the files it leaves in the results directory matter.
 */
public class JobLauncher {
    private static final Logger logger = LoggerFactory.getLogger(JobLauncher.class);

    private final WorkerCommand worker;
    private final WorkerProcessFactory processFactory;

    public JobLauncher(WorkerCommand worker) {
        this(worker, WorkerProcessFactory.system());
    }

    public JobLauncher(WorkerCommand worker, WorkerProcessFactory processFactory) {
        this.worker = worker;
        this.processFactory = processFactory;
    }

    /** Invokes the worker on {@code staged} and resolves its artifact. Never throws for job errors. */
    public JobResult run(JobRequest request, StagedInput staged, JobListener listener) {
        Path entryPoint = worker.resolvedEntryPoint();
        if (!Files.isRegularFile(entryPoint)) {
            return JobResult.failure(
                    FailureKind.WORKER_UNAVAILABLE, "Worker not found: " + entryPoint);
        }

        List<String> command = buildCommand(request, staged);
        logger.info("Launching worker: {}", String.join(" ", command));

        Process process;
        try {
            process = processFactory.start(command, worker.installRoot());
        } catch (IOException e) {
            logger.error("Could not start worker {}", command.get(0), e);
            return JobResult.failure(
                    FailureKind.WORKER_UNAVAILABLE,
                    "Failed to start " + command.get(0) + ": " + e.getMessage(),
                    e);
        }

        int exitCode;
        try {
            drainOutput(process.getInputStream(), listener);
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return JobResult.failure(
                    FailureKind.WORKER_FAILED, "Interrupted while waiting for the worker", e);
        }

        if (exitCode != 0) {
            logger.warn("Worker exited with status {}", exitCode);
            return JobResult.failure(
                    FailureKind.WORKER_FAILED, "Worker exited with status " + exitCode);
        }

        Path resultsDir = request.resultsDirectory();
        try {
            Optional<Path> artifact = ArtifactResolver.latest(resultsDir);
            if (artifact.isEmpty()) {
                return JobResult.failure(
                        FailureKind.NO_ARTIFACT_FOUND, "No output image found under " + resultsDir);
            }
            return JobResult.success(artifact.get());
        } catch (IOException e) {
            return JobResult.failure(
                    FailureKind.NO_ARTIFACT_FOUND,
                    "Could not read " + resultsDir + ": " + e.getMessage(),
                    e);
        }
    }

    /** Argument list for the worker, in the order the worker expects. */
    List<String> buildCommand(JobRequest request, StagedInput staged) {
        List<String> command = worker.prefix();
        command.add("--input_folder");
        command.add(staged.directory().toString());
        command.add("--output_folder");
        command.add(request.outputDirectory().toAbsolutePath().toString());
        command.add("--GPU");
        command.add(request.device().toArgument());
        if (request.repairScratches()) {
            command.add("--with_scratch");
        }
        if (request.highResolution()) {
            command.add("--HR");
        }
        return command;
    }

    /** Forwards every output line to the listener so the child never blocks on a full pipe. */
    private static void drainOutput(InputStream stream, JobListener listener) {
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                listener.onWorkerOutput(line);
            }
        } catch (IOException e) {
            // Pipe closes early when the worker dies; its exit code is checked by the caller.
            logger.debug("Worker output stream closed: {}", e.getMessage());
        }
    }
}
