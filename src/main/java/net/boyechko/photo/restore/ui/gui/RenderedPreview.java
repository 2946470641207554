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

import java.awt.image.BufferedImage;
import java.nio.file.Path;

/** A scaled bitmap ready to paint, together with the file it came from. */
public final class RenderedPreview {
    private final Path source;
    private final BufferedImage image;
    private boolean released;

    public RenderedPreview(Path source, BufferedImage image) {
        this.source = source;
        this.image = image;
    }

    public Path source() {
        return source;
    }

    public BufferedImage image() {
        return image;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    /** File name shown as the overlay label. */
    public String label() {
        Path name = source.getFileName();
        return name != null ? name.toString() : source.toString();
    }

    /** Drops cached resources held by the bitmap. Only the owning slot calls this. */
    void release() {
        released = true;
        image.flush();
    }

    public boolean isReleased() {
        return released;
    }
}
