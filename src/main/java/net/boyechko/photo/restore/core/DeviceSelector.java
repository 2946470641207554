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

/**
 * Accelerator the worker should run on: a non-negative device id, or no accelerator at all.
 *
 * @param id device id, or {@value #NO_ACCELERATOR_ID} for CPU-only execution
 */
public record DeviceSelector(int id) {
    public static final int NO_ACCELERATOR_ID = -1;

    public static final DeviceSelector NO_ACCELERATOR = new DeviceSelector(NO_ACCELERATOR_ID);

    public DeviceSelector {
        if (id < 0) {
            id = NO_ACCELERATOR_ID;
        }
    }

    public static DeviceSelector of(int id) {
        return new DeviceSelector(id);
    }

    /**
     * Parses a device id as typed by a user. Blank text and negative numbers select no
     * accelerator.
     *
     * @throws IllegalArgumentException if the text is not an integer
     */
    public static DeviceSelector parse(String text) {
        if (text == null || text.isBlank()) {
            return NO_ACCELERATOR;
        }
        try {
            return new DeviceSelector(Integer.parseInt(text.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid device id: " + text.trim(), e);
        }
    }

    public boolean isAccelerated() {
        return id != NO_ACCELERATOR_ID;
    }

    /** The value passed to the worker's {@code --GPU} flag. */
    public String toArgument() {
        return Integer.toString(id);
    }
}
