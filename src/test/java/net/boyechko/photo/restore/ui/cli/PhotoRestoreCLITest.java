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
package net.boyechko.photo.restore.ui.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import net.boyechko.photo.restore.config.RestorationSettings;
import net.boyechko.photo.restore.core.DeviceSelector;
import net.boyechko.photo.restore.core.JobRequest;
import net.boyechko.photo.restore.core.VerbosityLevel;
import net.boyechko.photo.restore.ui.cli.PhotoRestoreCLI.CLIConfig;
import net.boyechko.photo.restore.ui.cli.PhotoRestoreCLI.CLIException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PhotoRestoreCLITest {
    @TempDir Path tempDir;

    private RestorationSettings settings;
    private Path photo;

    @BeforeEach
    void setUp() throws Exception {
        settings = new RestorationSettings();
        settings.install_root = tempDir.toString();
        photo = Files.writeString(tempDir.resolve("photo.jpg"), "jpeg");
    }

    @Test
    void defaultsComeFromSettings() throws Exception {
        CLIConfig config = parse(photo.toString());

        assertEquals(photo, config.inputPath());
        assertEquals(DeviceSelector.NO_ACCELERATOR, config.device());
        assertTrue(config.repairScratches());
        assertFalse(config.highResolution());
        assertEquals(VerbosityLevel.NORMAL, config.verbosity());
    }

    @Test
    void flagsOverrideDefaults() throws Exception {
        CLIConfig config = parse("--no-scratch", "--hr", "--gpu", "1", "-vv", photo.toString());

        assertFalse(config.repairScratches());
        assertTrue(config.highResolution());
        assertEquals("1", config.device().toArgument());
        assertEquals(VerbosityLevel.DEBUG, config.verbosity());
    }

    @Test
    void inlineGpuValueIsAccepted() throws Exception {
        assertEquals("2", parse("--gpu=2", photo.toString()).device().toArgument());
    }

    @Test
    void outputRootDefaultsToSettings() throws Exception {
        JobRequest request = parse(photo.toString()).toJobRequest(settings);
        assertEquals(settings.outputRoot(), request.outputDirectory());

        Path custom = tempDir.resolve("custom");
        JobRequest overridden = parse("-o", custom.toString(), photo.toString()).toJobRequest(settings);
        assertEquals(custom, overridden.outputDirectory());
    }

    @Test
    void missingInputIsReported() {
        CLIException e = assertThrows(CLIException.class, () -> parse(tempDir.resolve("none.jpg").toString()));
        assertTrue(e.getMessage().startsWith("File not found"));
    }

    @Test
    void noArgumentsIsReported() {
        assertThrows(CLIException.class, () -> parse());
    }

    @Test
    void unknownOptionIsReported() {
        assertThrows(CLIException.class, () -> parse("--colorize", photo.toString()));
    }

    @Test
    void invalidGpuIsReported() {
        assertThrows(CLIException.class, () -> parse("--gpu", "cuda", photo.toString()));
    }

    @Test
    void secondInputIsReported() {
        assertThrows(CLIException.class, () -> parse(photo.toString(), photo.toString()));
    }

    @Test
    void missingWorkerExitsWithFailure() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int exitCode =
                PhotoRestoreCLI.run(
                        parse(photo.toString()),
                        settings,
                        new PrintStream(out, true, StandardCharsets.UTF_8),
                        new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(1, exitCode);
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Worker unavailable"));
    }

    @Test
    void unreadableSettingsAreReportedAsAnError() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int exitCode =
                PhotoRestoreCLI.execute(
                        new String[] {photo.toString()},
                        () -> {
                            throw new IllegalStateException(
                                    "Failed to load settings from resource /photo-restore.yaml");
                        },
                        new PrintStream(out, true, StandardCharsets.UTF_8),
                        new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(1, exitCode);
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertTrue(
                err.toString(StandardCharsets.UTF_8)
                        .startsWith("Error: Failed to load settings from resource"));
    }

    @Test
    void helpPrintsUsageWithoutLoadingSettings() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        int exitCode =
                PhotoRestoreCLI.execute(
                        new String[] {"--help"},
                        () -> {
                            throw new AssertionError("settings must not be loaded for --help");
                        },
                        new PrintStream(out, true, StandardCharsets.UTF_8),
                        System.err);

        assertEquals(0, exitCode);
        assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Usage:"));
    }

    @Test
    void badArgumentsAreReportedAsAnError() {
        ByteArrayOutputStream err = new ByteArrayOutputStream();

        int exitCode =
                PhotoRestoreCLI.execute(
                        new String[] {"--colorize", photo.toString()},
                        () -> settings,
                        System.out,
                        new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(1, exitCode);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Unknown option: --colorize"));
    }

    private CLIConfig parse(String... args) throws CLIException {
        return PhotoRestoreCLI.parseArguments(args, settings);
    }
}
