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

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the EXIF orientation tag (0x0112) from a JPEG file.
 *
 * <p>Values follow the EXIF standard: 1 is upright, 3 is upside down, 6 needs a clockwise quarter
 * turn, 8 a counter-clockwise one, and 2, 4, 5, 7 are the mirrored variants.
 */
final class ExifOrientation {
    private static final Logger logger = LoggerFactory.getLogger(ExifOrientation.class);

    static final int NORMAL = 1;

    private static final int ORIENTATION_TAG = 0x0112;
    private static final int MARKER_SOI = 0xD8;
    private static final int MARKER_EOI = 0xD9;
    private static final int MARKER_SOS = 0xDA;
    private static final int MARKER_APP1 = 0xE1;
    private static final byte[] EXIF_HEADER = "Exif\0\0".getBytes(StandardCharsets.US_ASCII);

    private ExifOrientation() {}

    /** Orientation of the image at {@code path}; {@link #NORMAL} if absent or unreadable. */
    static int read(Path path) {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            return read(in);
        } catch (IOException e) {
            logger.debug("No orientation read from {}: {}", path, e.getMessage());
            return NORMAL;
        }
    }

    static int read(InputStream stream) throws IOException {
        DataInputStream in = new DataInputStream(stream);
        if (in.readUnsignedByte() != 0xFF || in.readUnsignedByte() != MARKER_SOI) {
            return NORMAL;
        }
        try {
            while (true) {
                int marker = nextMarker(in);
                if (marker == MARKER_SOS || marker == MARKER_EOI) {
                    return NORMAL;
                }
                if (marker == 0x01 || (marker >= 0xD0 && marker <= 0xD7)) {
                    continue;
                }
                int length = in.readUnsignedShort() - 2;
                if (length < 0) {
                    return NORMAL;
                }
                byte[] segment = new byte[length];
                in.readFully(segment);
                if (marker == MARKER_APP1 && startsWith(segment, EXIF_HEADER)) {
                    return parseTiff(segment, EXIF_HEADER.length);
                }
            }
        } catch (EOFException e) {
            return NORMAL;
        }
    }

    private static int nextMarker(DataInputStream in) throws IOException {
        int b = in.readUnsignedByte();
        if (b != 0xFF) {
            throw new IOException("Expected JPEG marker, found 0x" + Integer.toHexString(b));
        }
        while (b == 0xFF) {
            b = in.readUnsignedByte();
        }
        return b;
    }

    /** Finds the orientation entry in IFD0 of the TIFF structure starting at {@code start}. */
    static int parseTiff(byte[] data, int start) {
        if (data.length - start < 8) {
            return NORMAL;
        }
        ByteBuffer buf = ByteBuffer.wrap(data, start, data.length - start).slice();
        if (buf.get(0) == 'I' && buf.get(1) == 'I') {
            buf.order(ByteOrder.LITTLE_ENDIAN);
        } else if (buf.get(0) == 'M' && buf.get(1) == 'M') {
            buf.order(ByteOrder.BIG_ENDIAN);
        } else {
            return NORMAL;
        }
        if (buf.getShort(2) != 42) {
            return NORMAL;
        }
        long ifd = Integer.toUnsignedLong(buf.getInt(4));
        if (ifd + 2 > buf.limit()) {
            return NORMAL;
        }
        int entries = Short.toUnsignedInt(buf.getShort((int) ifd));
        for (int i = 0; i < entries; i++) {
            int entry = (int) ifd + 2 + i * 12;
            if (entry + 12 > buf.limit()) {
                return NORMAL;
            }
            if (Short.toUnsignedInt(buf.getShort(entry)) == ORIENTATION_TAG) {
                int value = Short.toUnsignedInt(buf.getShort(entry + 8));
                return value >= 1 && value <= 8 ? value : NORMAL;
            }
        }
        return NORMAL;
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }
}
