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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Stands in for the worker: records each invocation and plays back a scripted outcome. */
public class ScriptedProcessFactory implements WorkerProcessFactory {

    /** Filesystem effects the fake worker performs before "exiting". */
    @FunctionalInterface
    public interface WorkerEffect {
        void apply(List<String> command) throws IOException;
    }

    private final int exitCode;
    private final String output;
    private final WorkerEffect effect;
    private final List<List<String>> commands = new ArrayList<>();
    private final List<Path> workingDirs = new ArrayList<>();

    public ScriptedProcessFactory(int exitCode) {
        this(exitCode, "", command -> {});
    }

    public ScriptedProcessFactory(int exitCode, String output, WorkerEffect effect) {
        this.exitCode = exitCode;
        this.output = output;
        this.effect = effect;
    }

    /** A factory whose worker can never be started. */
    public static WorkerProcessFactory failingToStart(String reason) {
        return (command, workingDir) -> {
            throw new IOException(reason);
        };
    }

    @Override
    public Process start(List<String> command, Path workingDir) throws IOException {
        commands.add(List.copyOf(command));
        workingDirs.add(workingDir);
        effect.apply(command);
        return new FinishedProcess(exitCode, output);
    }

    public int invocations() {
        return commands.size();
    }

    public List<String> lastCommand() {
        return commands.get(commands.size() - 1);
    }

    public Path lastWorkingDir() {
        return workingDirs.get(workingDirs.size() - 1);
    }

    /** Returns the value following {@code flag} in {@code command}. */
    public static String argumentAfter(List<String> command, String flag) {
        int index = command.indexOf(flag);
        if (index < 0 || index + 1 >= command.size()) {
            throw new AssertionError("No value for " + flag + " in " + command);
        }
        return command.get(index + 1);
    }

    private static final class FinishedProcess extends Process {
        private final int exitCode;
        private final byte[] output;

        FinishedProcess(int exitCode, String output) {
            this.exitCode = exitCode;
            this.output = output.getBytes(StandardCharsets.UTF_8);
        }

        @Override
        public OutputStream getOutputStream() {
            return OutputStream.nullOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(output);
        }

        @Override
        public InputStream getErrorStream() {
            return InputStream.nullInputStream();
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {}
    }
}
