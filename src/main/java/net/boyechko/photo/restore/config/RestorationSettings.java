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
package net.boyechko.photo.restore.config;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;
import net.boyechko.photo.restore.core.DeviceSelector;
import net.boyechko.photo.restore.core.WorkerCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Where the worker lives and how jobs are run by default. Loaded from YAML; individual values can
 * be overridden with system properties or environment variables.
 */
public final class RestorationSettings {
    public static final String DEFAULT_RESOURCE = "/photo-restore.yaml";

    static final String INSTALL_ROOT_PROPERTY = "photorestore.install.root";
    static final String INTERPRETER_PROPERTY = "photorestore.interpreter";
    static final String OUTPUT_PROPERTY = "photorestore.output.dir";
    static final String INSTALL_ROOT_ENV = "PHOTO_RESTORE_HOME";
    static final String INTERPRETER_ENV = "PHOTO_RESTORE_PYTHON";
    static final String OUTPUT_ENV = "PHOTO_RESTORE_OUTPUT";

    private static final Logger logger = LoggerFactory.getLogger(RestorationSettings.class);

    /** Worker installation root; blank means the current working directory. */
    public String install_root = "";

    /** Program that runs the entry point; blank runs the entry point directly. */
    public String interpreter = "python3";

    public String entry_point = "run.py";

    /** Output root; relative values resolve against the installation root. */
    public String output_folder = "output_gui";

    public int gpu = DeviceSelector.NO_ACCELERATOR_ID;
    public boolean with_scratch = true;
    public boolean hr = false;

    /**
     * Load settings from a classpath resource and apply overrides from the running JVM.
     *
     * @param resourcePath Path starting with "/" for absolute resource path
     */
    public static RestorationSettings fromResource(String resourcePath) {
        return fromResource(resourcePath, System::getProperty, System::getenv);
    }

    static RestorationSettings fromResource(
            String resourcePath,
            Function<String, String> properties,
            Function<String, String> environment) {
        RestorationSettings settings;
        try (var inputStream = RestorationSettings.class.getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IllegalArgumentException("Resource not found: " + resourcePath);
            }
            var yaml = new Yaml(new Constructor(RestorationSettings.class, new LoaderOptions()));
            settings = yaml.load(inputStream);
            if (settings == null) {
                settings = new RestorationSettings();
            }
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Failed to load settings from resource {}: {}", resourcePath, e.getMessage());
            throw new IllegalStateException(
                    "Failed to load settings from resource " + resourcePath + ": " + e.getMessage(),
                    e);
        }

        settings.applyOverrides(properties, environment);
        logger.debug(
                "Loaded settings from {}: install root {}, output {}",
                resourcePath,
                settings.installRoot(),
                settings.outputRoot());
        return settings;
    }

    /** Load default settings from the standard location */
    public static RestorationSettings loadDefault() {
        return fromResource(DEFAULT_RESOURCE);
    }

    void applyOverrides(Function<String, String> properties, Function<String, String> environment) {
        Map<String, String> keys =
                Map.of(
                        INSTALL_ROOT_PROPERTY, INSTALL_ROOT_ENV,
                        INTERPRETER_PROPERTY, INTERPRETER_ENV,
                        OUTPUT_PROPERTY, OUTPUT_ENV);
        for (Map.Entry<String, String> key : keys.entrySet()) {
            String value = properties.apply(key.getKey());
            if (value == null) {
                value = environment.apply(key.getValue());
            }
            if (value == null) {
                continue;
            }
            logger.debug("Overriding {} with {}", key.getKey(), value);
            switch (key.getKey()) {
                case INSTALL_ROOT_PROPERTY -> install_root = value;
                case INTERPRETER_PROPERTY -> interpreter = value;
                case OUTPUT_PROPERTY -> output_folder = value;
                default -> throw new IllegalStateException("Unhandled override " + key.getKey());
            }
        }
    }

    public Path installRoot() {
        if (install_root == null || install_root.isBlank()) {
            return Path.of("").toAbsolutePath();
        }
        return Path.of(install_root).toAbsolutePath().normalize();
    }

    public Path outputRoot() {
        return resolveOutputFolder(output_folder);
    }

    /** Resolves a user-supplied output folder the same way as {@code output_folder}. */
    public Path resolveOutputFolder(String folder) {
        String name = folder == null || folder.isBlank() ? "output_gui" : folder.trim();
        return installRoot().resolve(name).normalize();
    }

    public DeviceSelector device() {
        return DeviceSelector.of(gpu);
    }

    public WorkerCommand workerCommand() {
        return workerCommand(interpreter);
    }

    /** The worker command with a different interpreter; blank runs the entry point directly. */
    public WorkerCommand workerCommand(String interpreterOverride) {
        return new WorkerCommand(installRoot(), interpreterOverride, Path.of(entry_point));
    }
}
