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

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Supplier;
import net.boyechko.photo.restore.config.RestorationSettings;
import net.boyechko.photo.restore.core.DeviceSelector;
import net.boyechko.photo.restore.core.JobLauncher;
import net.boyechko.photo.restore.core.JobRequest;
import net.boyechko.photo.restore.core.JobResult;
import net.boyechko.photo.restore.core.RestorationService;
import net.boyechko.photo.restore.core.VerbosityLevel;
import net.boyechko.photo.restore.ui.LoggingListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs a single restoration job from the command line and waits for it. */
public class PhotoRestoreCLI {
    private static final Logger logger = LoggerFactory.getLogger(PhotoRestoreCLI.class);

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            Path inputPath,
            Path outputRoot,
            DeviceSelector device,
            boolean repairScratches,
            boolean highResolution,
            VerbosityLevel verbosity) {
        public CLIConfig {
            if (inputPath == null) {
                throw new IllegalArgumentException("Input path is required");
            }
            if (device == null) {
                throw new IllegalArgumentException("Device selector is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
        }

        JobRequest toJobRequest(RestorationSettings settings) {
            Path output = outputRoot != null ? outputRoot : settings.outputRoot();
            return new JobRequest(inputPath, output, device, repairScratches, highResolution);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        Path inputPath;
        Path outputRoot;
        DeviceSelector device;
        boolean repairScratches;
        boolean highResolution;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;

        CLIConfigBuilder(RestorationSettings defaults) {
            device = defaults.device();
            repairScratches = defaults.with_scratch;
            highResolution = defaults.hr;
        }

        CLIConfig build() throws CLIException {
            if (inputPath == null) {
                throw new CLIException("No input file specified");
            }
            if (!Files.exists(inputPath)) {
                throw new CLIException("File not found: " + inputPath);
            }
            return new CLIConfig(
                    inputPath, outputRoot, device, repairScratches, highResolution, verbosity);
        }
    }

    public static void main(String[] args) {
        System.exit(execute(args, RestorationSettings::loadDefault, System.out, System.err));
    }

    /** Everything {@link #main} does short of exiting; returns the process exit code. */
    static int execute(
            String[] args,
            Supplier<RestorationSettings> settingsLoader,
            PrintStream out,
            PrintStream err) {
        if (isHelpRequested(args)) {
            out.println(usageMessage());
            return 0;
        }
        RestorationSettings settings;
        try {
            settings = settingsLoader.get();
        } catch (IllegalStateException | IllegalArgumentException e) {
            logger.debug("Could not load settings", e);
            err.println("Error: " + e.getMessage());
            return 1;
        }

        CLIConfig config;
        try {
            config = parseArguments(args, settings);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        configureLogging(config.verbosity());
        return run(config, settings, out, err);
    }

    /** Runs the job described by {@code config} and returns the process exit code. */
    static int run(CLIConfig config, RestorationSettings settings, PrintStream out, PrintStream err) {
        logger.info("Restoring {} with {}", config.inputPath(), settings.workerCommand());
        RestorationService service =
                new RestorationService.RestorationServiceBuilder()
                        .withLauncher(new JobLauncher(settings.workerCommand()))
                        .withListener(LoggingListener.withConsoleOutput())
                        .build();

        JobResult result = service.execute(config.toJobRequest(settings));
        if (result.isSuccess()) {
            out.println("✓ Output saved to " + result.outputFile());
            return 0;
        }
        err.println("✗ " + result.describeFailure());
        return 1;
    }

    static CLIConfig parseArguments(String[] args, RestorationSettings settings)
            throws CLIException {
        if (args.length == 0) {
            throw new CLIException("No input file specified\n" + usageMessage());
        }

        CLIConfigBuilder b = new CLIConfigBuilder(settings);

        for (int i = 0; i < args.length; i++) {
            if (args[i].startsWith("--gpu=")) {
                b.device = parseDevice(args[i].substring("--gpu=".length()));
            } else {
                switch (args[i]) {
                    case "-g", "--gpu" -> {
                        if (i + 1 < args.length) {
                            b.device = parseDevice(args[++i]);
                        } else {
                            throw new CLIException("Device id not specified after --gpu");
                        }
                    }
                    case "-o", "--output" -> {
                        if (i + 1 < args.length) {
                            b.outputRoot = Paths.get(args[++i]);
                        } else {
                            throw new CLIException("Output folder not specified after -o");
                        }
                    }
                    case "-s", "--with-scratch" -> b.repairScratches = true;
                    case "--no-scratch" -> b.repairScratches = false;
                    case "--hr" -> b.highResolution = true;
                    case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                    case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                    case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                    default -> {
                        if (args[i].startsWith("-")) {
                            throw new CLIException("Unknown option: " + args[i]);
                        }
                        if (b.inputPath == null) {
                            b.inputPath = Paths.get(args[i]);
                        } else {
                            throw new CLIException("Multiple inputs specified");
                        }
                    }
                }
            }
        }

        return b.build();
    }

    private static DeviceSelector parseDevice(String value) throws CLIException {
        try {
            return DeviceSelector.parse(value);
        } catch (IllegalArgumentException e) {
            throw new CLIException(e.getMessage());
        }
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.INFO;
                    case VERBOSE -> Level.DEBUG;
                    case DEBUG -> Level.TRACE;
                };
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ctx.getLogger("net.boyechko.photo.restore").setLevel(level);
        if (verbosity.isAtLeast(VerbosityLevel.DEBUG)) {
            ctx.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG);
        }
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: java PhotoRestoreCLI [-q|-v|-vv] [-g id] [-s|--no-scratch] [--hr] [-o folder] <input>\n"
                + "  -h, --help          Show this help message\n"
                + "  -q, --quiet         Only show errors and the final result\n"
                + "  -v, --verbose       Show staging and launch details\n"
                + "  -vv, --debug        Also show the worker's own output\n"
                + "  -g, --gpu <id>      Accelerator id for the worker (-1 for none)\n"
                + "  -s, --with-scratch  Repair scratches\n"
                + "  --no-scratch        Do not repair scratches\n"
                + "  --hr                High resolution mode\n"
                + "  -o, --output <dir>  Output root (default from photo-restore.yaml)\n"
                + "<input> is a single image or a folder of images.\n"
                + "Examples:\n"
                + "  java PhotoRestoreCLI -s photo.jpg\n"
                + "  java PhotoRestoreCLI --gpu 0 --hr -o out scans/";
    }
}
