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
package net.boyechko.photo.restore.ui.gui;

import java.nio.file.Path;
import net.boyechko.photo.restore.config.RestorationSettings;
import net.boyechko.photo.restore.core.DeviceSelector;
import net.boyechko.photo.restore.core.JobRequest;
import net.boyechko.photo.restore.core.WorkerCommand;

/**
 * The main window's fields as typed, captured on the event thread when the user starts a run.
 * Blank fields fall back to the loaded settings.
 */
record JobForm(
        String inputText,
        String outputFolderText,
        String deviceText,
        String interpreterText,
        boolean repairScratches,
        boolean highResolution) {

    JobForm {
        inputText = inputText == null ? "" : inputText.trim();
        outputFolderText = outputFolderText == null ? "" : outputFolderText.trim();
        deviceText = deviceText == null ? "" : deviceText.trim();
        interpreterText = interpreterText == null ? "" : interpreterText.trim();
    }

    /** Seeds every field from {@code settings}, with no input selected. */
    static JobForm defaults(RestorationSettings settings) {
        return new JobForm(
                "",
                settings.outputRoot().toString(),
                settings.device().toArgument(),
                settings.interpreter,
                settings.with_scratch,
                settings.hr);
    }

    boolean hasInput() {
        return !inputText.isEmpty();
    }

    Path inputPath() {
        return Path.of(inputText);
    }

    /**
     * @throws IllegalArgumentException if the device field is not a number
     */
    JobRequest toJobRequest(RestorationSettings settings) {
        Path output =
                outputFolderText.isEmpty()
                        ? settings.outputRoot()
                        : settings.resolveOutputFolder(outputFolderText);
        return new JobRequest(
                inputPath(),
                output,
                DeviceSelector.parse(deviceText),
                repairScratches,
                highResolution);
    }

    WorkerCommand toWorkerCommand(RestorationSettings settings) {
        return settings.workerCommand(
                interpreterText.isEmpty() ? settings.interpreter : interpreterText);
    }
}
