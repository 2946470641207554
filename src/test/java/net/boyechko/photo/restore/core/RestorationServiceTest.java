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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/** End-to-end runs of a job against a scripted worker. */
class RestorationServiceTest {
    @TempDir Path tempDir;

    private Path installRoot;
    private Path outputRoot;
    private WorkerCommand worker;

    @BeforeEach
    void setUp() throws IOException {
        installRoot = Files.createDirectory(tempDir.resolve("install"));
        Files.writeString(installRoot.resolve("run.py"), "# worker");
        outputRoot = tempDir.resolve("output_gui");
        worker = new WorkerCommand(installRoot, "python3", Path.of("run.py"));
    }

    @Test
    void singleFileIsStagedRunAndResolved() throws Exception {
        Path photo = Files.writeString(tempDir.resolve("photo.jpg"), "jpeg");
        Path expectedStaging = outputRoot.resolve(JobLayout.STAGING_DIR).toAbsolutePath();
        ScriptedProcessFactory factory =
                new ScriptedProcessFactory(
                        0,
                        "",
                        command -> {
                            Path results =
                                    Files.createDirectories(outputRoot.resolve(JobLayout.RESULTS_DIR));
                            Path stale = Files.writeString(results.resolve("previous.png"), "p");
                            Files.setLastModifiedTime(
                                    stale, FileTime.from(Instant.now().minusSeconds(3600)));
                            Files.writeString(results.resolve("restored.png"), "r");
                        });

        JobResult result =
                service(factory, JobListener.silent())
                        .execute(
                                new JobRequest(
                                        photo, outputRoot, DeviceSelector.NO_ACCELERATOR, true, false));

        assertTrue(Files.isRegularFile(expectedStaging.resolve("photo.jpg")));
        List<String> command = factory.lastCommand();
        assertEquals(
                expectedStaging.toString(),
                ScriptedProcessFactory.argumentAfter(command, "--input_folder"));
        assertEquals(
                outputRoot.toAbsolutePath().toString(),
                ScriptedProcessFactory.argumentAfter(command, "--output_folder"));
        assertEquals("-1", ScriptedProcessFactory.argumentAfter(command, "--GPU"));
        assertEquals("--with_scratch", command.get(command.size() - 1));
        assertFalse(command.contains("--HR"));

        assertTrue(result.isSuccess(), result.describeFailure());
        assertEquals(outputRoot.resolve(JobLayout.RESULTS_DIR).resolve("restored.png"), result.outputFile());
    }

    @Test
    void failingWorkerOnDirectoryLeavesNoScratchDirectory() throws Exception {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        for (String name : List.of("a.jpg", "b.jpg", "c.png")) {
            Files.writeString(folder.resolve(name), name);
        }
        ScriptedProcessFactory factory = new ScriptedProcessFactory(1);

        JobResult result =
                service(factory, JobListener.silent())
                        .execute(
                                new JobRequest(
                                        folder, outputRoot, DeviceSelector.NO_ACCELERATOR, true, false));

        assertEquals(FailureKind.WORKER_FAILED, result.failureKind());
        assertEquals(
                folder.toString(),
                ScriptedProcessFactory.argumentAfter(factory.lastCommand(), "--input_folder"));
        assertFalse(Files.exists(outputRoot.resolve(JobLayout.STAGING_DIR)));
        try (Stream<Path> files = Files.list(folder)) {
            assertEquals(3, files.count());
        }
    }

    @Test
    void emptyResultsDirectoryIsNoArtifactFound() throws Exception {
        Path photo = Files.writeString(tempDir.resolve("photo.jpg"), "jpeg");
        ScriptedProcessFactory factory =
                new ScriptedProcessFactory(
                        0,
                        "",
                        command -> Files.createDirectories(outputRoot.resolve(JobLayout.RESULTS_DIR)));

        JobResult result =
                service(factory, JobListener.silent())
                        .execute(
                                new JobRequest(
                                        photo, outputRoot, DeviceSelector.NO_ACCELERATOR, false, false));

        assertEquals(FailureKind.NO_ARTIFACT_FOUND, result.failureKind());
        assertNull(result.outputFile());
    }

    @Test
    void relativeFolderIsHandedToWorkerAsAbsolutePath() throws Exception {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        Files.writeString(folder.resolve("a.jpg"), "a");
        Path relative = Path.of("").toAbsolutePath().relativize(folder);
        assertFalse(relative.isAbsolute());
        ScriptedProcessFactory factory = new ScriptedProcessFactory(1);

        service(factory, JobListener.silent())
                .execute(
                        new JobRequest(
                                relative, outputRoot, DeviceSelector.NO_ACCELERATOR, false, false));

        Path handedOver =
                Path.of(ScriptedProcessFactory.argumentAfter(factory.lastCommand(), "--input_folder"));
        assertTrue(handedOver.isAbsolute(), handedOver.toString());
        assertEquals(folder.toAbsolutePath().normalize(), handedOver);
        assertEquals(installRoot, factory.lastWorkingDir());
    }

    @Test
    void previousRunsResultIsNotReportedAgain() throws Exception {
        Path photo = Files.writeString(tempDir.resolve("photo.jpg"), "jpeg");
        ScriptedProcessFactory writesResult =
                new ScriptedProcessFactory(
                        0,
                        "",
                        command ->
                                Files.writeString(
                                        outputRoot.resolve(JobLayout.RESULTS_DIR).resolve("restored.png"),
                                        "r"));
        JobRequest request =
                new JobRequest(photo, outputRoot, DeviceSelector.NO_ACCELERATOR, true, false);

        assertTrue(service(writesResult, JobListener.silent()).execute(request).isSuccess());
        JobResult second =
                service(new ScriptedProcessFactory(0), JobListener.silent()).execute(request);

        assertEquals(FailureKind.NO_ARTIFACT_FOUND, second.failureKind());
        assertNull(second.outputFile());
    }

    @Test
    void workerOutputDirectoriesAreEmptiedBeforeLaunch() throws Exception {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        for (String name : JobLayout.WORKER_OUTPUT_DIRS) {
            Path dir = Files.createDirectories(outputRoot.resolve(name).resolve("nested"));
            Files.writeString(dir.resolve("leftover.png"), "old");
        }
        Path keep = Files.writeString(outputRoot.resolve("notes.txt"), "mine");
        List<Long> entriesSeenByWorker = new ArrayList<>();
        ScriptedProcessFactory factory =
                new ScriptedProcessFactory(
                        0,
                        "",
                        command -> {
                            for (String name : JobLayout.WORKER_OUTPUT_DIRS) {
                                try (Stream<Path> entries = Files.list(outputRoot.resolve(name))) {
                                    entriesSeenByWorker.add(entries.count());
                                }
                            }
                        });

        service(factory, JobListener.silent())
                .execute(new JobRequest(folder, outputRoot, DeviceSelector.NO_ACCELERATOR, false, false));

        assertEquals(List.of(0L, 0L, 0L, 0L), entriesSeenByWorker);
        assertEquals("mine", Files.readString(keep));
    }

    @Test
    void folderInsideResultsDirectoryIsStagingFailure() throws Exception {
        Path results = Files.createDirectories(outputRoot.resolve(JobLayout.RESULTS_DIR));
        Path previous = Files.writeString(results.resolve("restored.png"), "r");
        ScriptedProcessFactory factory = new ScriptedProcessFactory(0);

        JobResult result =
                service(factory, JobListener.silent())
                        .execute(
                                new JobRequest(
                                        results, outputRoot, DeviceSelector.NO_ACCELERATOR, false, false));

        assertEquals(FailureKind.STAGING_FAILURE, result.failureKind());
        assertEquals(0, factory.invocations());
        assertTrue(Files.exists(previous));
    }

    @Test
    void missingInputIsStagingFailureWithoutLaunch() {
        ScriptedProcessFactory factory = new ScriptedProcessFactory(0);
        RecordingListener listener = new RecordingListener();

        JobResult result =
                service(factory, listener)
                        .execute(
                                new JobRequest(
                                        tempDir.resolve("gone.jpg"),
                                        outputRoot,
                                        DeviceSelector.NO_ACCELERATOR,
                                        false,
                                        false));

        assertEquals(FailureKind.STAGING_FAILURE, result.failureKind());
        assertEquals(0, factory.invocations());
        assertEquals(1, listener.errors.size());
    }

    @Test
    void unwritableOutputRootIsStagingFailure() throws Exception {
        Path photo = Files.writeString(tempDir.resolve("photo.jpg"), "jpeg");
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
        ScriptedProcessFactory factory = new ScriptedProcessFactory(0);

        JobResult result =
                service(factory, JobListener.silent())
                        .execute(
                                new JobRequest(
                                        photo,
                                        blocker.resolve("out"),
                                        DeviceSelector.NO_ACCELERATOR,
                                        false,
                                        false));

        assertEquals(FailureKind.STAGING_FAILURE, result.failureKind());
        assertNotNull(result.cause());
        assertEquals(0, factory.invocations());
    }

    @Test
    void outputRootIsCreatedWhenAbsent() throws Exception {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        assertFalse(Files.exists(outputRoot));

        service(new ScriptedProcessFactory(0), JobListener.silent())
                .execute(new JobRequest(folder, outputRoot, DeviceSelector.NO_ACCELERATOR, false, false));

        assertTrue(Files.isDirectory(outputRoot));
    }

    @Test
    void listenerSeesPhasesAndSuccess() throws Exception {
        Path folder = Files.createDirectory(tempDir.resolve("scans"));
        RecordingListener listener = new RecordingListener();
        ScriptedProcessFactory factory =
                new ScriptedProcessFactory(
                        0,
                        "done\n",
                        command -> {
                            Path results =
                                    Files.createDirectories(outputRoot.resolve(JobLayout.RESULTS_DIR));
                            Files.writeString(results.resolve("out.png"), "o");
                        });

        service(factory, listener)
                .execute(new JobRequest(folder, outputRoot, DeviceSelector.of(0), false, true));

        assertEquals(List.of("Staging input", "Running worker"), listener.phases);
        assertEquals(1, listener.successes.size());
        assertTrue(listener.errors.isEmpty());
        assertEquals(List.of("done"), listener.workerLines);
    }

    @Test
    void builderRequiresLauncher() {
        assertThrows(
                IllegalStateException.class,
                () -> new RestorationService.RestorationServiceBuilder().build());
    }

    private RestorationService service(ScriptedProcessFactory factory, JobListener listener) {
        return new RestorationService.RestorationServiceBuilder()
                .withLauncher(new JobLauncher(worker, factory))
                .withListener(listener)
                .build();
    }
}
