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

import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads an image for a preview pane: decode, rotate upright according to EXIF, drop to plain RGB,
 * and shrink to fit the pane without changing the aspect ratio.
 */
public class PreviewRenderer {
    private static final Logger logger = LoggerFactory.getLogger(PreviewRenderer.class);

    static final int MIN_PANE_SIZE = 520;
    static final int UNLAID_OUT_THRESHOLD = 200;
    static final Dimension UNLAID_OUT_FLOOR = new Dimension(800, 600);
    static final int HORIZONTAL_MARGIN = 20;
    static final int VERTICAL_MARGIN = 60;
    static final int MIN_AVAILABLE = 100;

    public RenderedPreview render(Path path, Dimension paneSize) throws PreviewException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new PreviewException("Not a readable file: " + path);
        }

        BufferedImage decoded;
        try {
            decoded = ImageIO.read(path.toFile());
        } catch (IOException e) {
            throw new PreviewException("Cannot read image " + path.getFileName() + ": " + e.getMessage(), e);
        }
        if (decoded == null) {
            throw new PreviewException("Unsupported image format: " + path.getFileName());
        }

        int orientation = ExifOrientation.read(path);
        BufferedImage upright = orientRgb(decoded, orientation);
        Dimension fit = fitWithin(upright.getWidth(), upright.getHeight(), paneSize);
        logger.debug(
                "Rendering {} ({}x{}, orientation {}) at {}x{}",
                path.getFileName(),
                upright.getWidth(),
                upright.getHeight(),
                orientation,
                fit.width,
                fit.height);
        return new RenderedPreview(path, scale(upright, fit));
    }

    /** The area an image may occupy in a pane of the given size, margins removed. */
    static Dimension availableArea(Dimension paneSize) {
        int width = paneSize != null ? paneSize.width : 0;
        int height = paneSize != null ? paneSize.height : 0;
        if (width < UNLAID_OUT_THRESHOLD || height < UNLAID_OUT_THRESHOLD) {
            width = Math.max(width, UNLAID_OUT_FLOOR.width);
            height = Math.max(height, UNLAID_OUT_FLOOR.height);
        } else {
            width = Math.max(width, MIN_PANE_SIZE);
            height = Math.max(height, MIN_PANE_SIZE);
        }
        return new Dimension(
                Math.max(width - HORIZONTAL_MARGIN, MIN_AVAILABLE),
                Math.max(height - VERTICAL_MARGIN, MIN_AVAILABLE));
    }

    /** Target size for an image, preserving aspect ratio and never enlarging it. */
    static Dimension fitWithin(int imageWidth, int imageHeight, Dimension paneSize) {
        Dimension area = availableArea(paneSize);
        double scale =
                Math.min(
                        1.0,
                        Math.min(
                                (double) area.width / imageWidth,
                                (double) area.height / imageHeight));
        if (scale >= 1.0) {
            return new Dimension(imageWidth, imageHeight);
        }
        return new Dimension(
                Math.max(1, (int) Math.round(imageWidth * scale)),
                Math.max(1, (int) Math.round(imageHeight * scale)));
    }

    /** Copies {@code source} into a new RGB image, applying an EXIF orientation (1..8). */
    static BufferedImage orientRgb(BufferedImage source, int orientation) {
        int w = source.getWidth();
        int h = source.getHeight();
        boolean swapsAxes = orientation >= 5 && orientation <= 8;
        BufferedImage out =
                new BufferedImage(swapsAxes ? h : w, swapsAxes ? w : h, BufferedImage.TYPE_INT_RGB);

        int[] row = new int[w];
        for (int sy = 0; sy < h; sy++) {
            source.getRGB(0, sy, w, 1, row, 0, w);
            for (int sx = 0; sx < w; sx++) {
                int dx;
                int dy;
                switch (orientation) {
                    case 2 -> {
                        dx = w - 1 - sx;
                        dy = sy;
                    }
                    case 3 -> {
                        dx = w - 1 - sx;
                        dy = h - 1 - sy;
                    }
                    case 4 -> {
                        dx = sx;
                        dy = h - 1 - sy;
                    }
                    case 5 -> {
                        dx = sy;
                        dy = sx;
                    }
                    case 6 -> {
                        dx = h - 1 - sy;
                        dy = sx;
                    }
                    case 7 -> {
                        dx = h - 1 - sy;
                        dy = w - 1 - sx;
                    }
                    case 8 -> {
                        dx = sy;
                        dy = w - 1 - sx;
                    }
                    default -> {
                        dx = sx;
                        dy = sy;
                    }
                }
                out.setRGB(dx, dy, row[sx]);
            }
        }
        return out;
    }

    private static BufferedImage scale(BufferedImage image, Dimension target) {
        if (image.getWidth() == target.width && image.getHeight() == target.height) {
            return image;
        }
        BufferedImage scaled =
                new BufferedImage(target.width, target.height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.setRenderingHint(
                    RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(image, 0, 0, target.width, target.height, null);
        } finally {
            g.dispose();
        }
        image.flush();
        return scaled;
    }
}
