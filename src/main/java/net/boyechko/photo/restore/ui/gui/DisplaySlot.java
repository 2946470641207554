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

import java.util.function.Consumer;

/**
 * Exclusive owner of the bitmap shown in one preview pane. A replacement is committed to the pane
 * before the previous bitmap is released, so the pane never paints a released image. Interface
 * thread only.
 */
public final class DisplaySlot {
    private final Consumer<RenderedPreview> onCommit;
    private RenderedPreview current;

    /** @param onCommit attaches a newly committed preview to the pane (may receive null) */
    public DisplaySlot(Consumer<RenderedPreview> onCommit) {
        this.onCommit = onCommit;
    }

    public RenderedPreview current() {
        return current;
    }

    public void replace(RenderedPreview next) {
        RenderedPreview previous = current;
        current = next;
        onCommit.accept(next);
        if (previous != null && previous != next) {
            previous.release();
        }
    }

    public void clear() {
        replace(null);
    }
}
