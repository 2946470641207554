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

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Font;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import javax.swing.JComponent;

/** One of the two image panes: a title, the current preview centered, and its file name. */
public class PreviewPane extends JComponent {
    private static final Color BORDER_COLOR = new Color(0x66, 0x66, 0x66);

    private final String title;
    private final DisplaySlot slot;

    public PreviewPane(String title) {
        this.title = title;
        this.slot = new DisplaySlot(preview -> repaint());
        setPreferredSize(
                new Dimension(PreviewRenderer.MIN_PANE_SIZE, PreviewRenderer.MIN_PANE_SIZE));
        setOpaque(true);
    }

    public String title() {
        return title;
    }

    DisplaySlot slot() {
        return slot;
    }

    /** Shows {@code preview}, releasing the one shown before. Interface thread only. */
    public void display(RenderedPreview preview) {
        slot.replace(preview);
    }

    public void clear() {
        slot.clear();
    }

    @Override
    protected void paintComponent(Graphics graphics) {
        Graphics2D g = (Graphics2D) graphics.create();
        try {
            g.setRenderingHint(
                    RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            int w = getWidth();
            int h = getHeight();

            g.setColor(Color.WHITE);
            g.fillRect(0, 0, w, h);
            g.setColor(BORDER_COLOR);
            g.setStroke(new BasicStroke(2));
            g.drawRect(1, 1, w - 2, h - 2);

            g.setColor(Color.BLACK);
            g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 14));
            g.drawString(title, 10, 10 + g.getFontMetrics().getAscent());

            RenderedPreview preview = slot.current();
            if (preview == null) {
                return;
            }
            int x = (w - preview.width()) / 2;
            int y = (h - preview.height()) / 2 + 10;
            g.drawImage(preview.image(), x, y, null);

            g.setColor(Color.BLACK);
            g.setFont(new Font(Font.SANS_SERIF, Font.PLAIN, 12));
            g.drawString(preview.label(), 10, 40 + g.getFontMetrics().getAscent());
        } finally {
            g.dispose();
        }
    }
}
