/*
 * Copyright (C) Apache-2.0 OR EUPL-1.2.
 */
package de.bmarwell.home.exif.normalizer;

/// Image fixtures shared by the tests.
public final class TestImages {

    private TestImages() {
        // util
    }

    /// Minimal valid JPG (1x1 pixel), without any Exif data.
    public static byte[] minimalJpg() {
        final byte[] header = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xDB, 0x00, 0x43, 0x00};
        final byte[] frame = {
            (byte) 0xFF, (byte) 0xC0, 0x00, 0x0B, 0x08, 0x00, 0x01, 0x00, 0x01, 0x01, 0x01, 0x11, 0x00
        };
        final byte[] dcTable = {(byte) 0xFF, (byte) 0xC4, 0x00, 0x14, 0x00, 0x01};
        final byte[] acTable = {(byte) 0xFF, (byte) 0xC4, 0x00, 0x14, 0x10, 0x01};
        final byte[] scan = {
            (byte) 0xFF, (byte) 0xDA, 0x00, 0x08, 0x01, 0x01, 0x00, 0x00, 0x3F, 0x00, 0x00, (byte) 0xFF, (byte) 0xD9
        };

        final byte[] result = new byte[header.length + 64 + frame.length + 2 * (dcTable.length + 16) + scan.length];
        int pos = 0;
        System.arraycopy(header, 0, result, pos, header.length);
        pos += header.length;
        // quantization table, all ones
        for (int i = 0; i < 64; i++) {
            result[pos++] = 0x01;
        }
        System.arraycopy(frame, 0, result, pos, frame.length);
        pos += frame.length;
        System.arraycopy(dcTable, 0, result, pos, dcTable.length);
        pos += dcTable.length + 16;
        System.arraycopy(acTable, 0, result, pos, acTable.length);
        pos += acTable.length + 16;
        System.arraycopy(scan, 0, result, pos, scan.length);

        return result;
    }
}
